package com.weixiao.gitcad.command;

import com.weixiao.gitcad.archive.ArchiveTransformer;
import com.weixiao.gitcad.archive.ImportResult;
import com.weixiao.gitcad.lifecycle.ExitCodes;
import com.weixiao.gitcad.repo.ArchivePaths;
import com.weixiao.gitcad.repo.Repository;
import com.weixiao.gitcad.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.nio.file.Path;
import java.util.List;

/**
 * gitcad import - 由展开目录重建 .FCStd。
 */
@Command(name = "import", mixinStandardHelpOptions = true, description = "由展开目录重建 .FCStd")
public class ImportCommand extends RepoCommand {

    private static final Logger log = LoggerFactory.getLogger(ImportCommand.class);

    @Parameters(index = "0", arity = "1..*", paramLabel = "FILE", description = "要重建的 .FCStd 文件（可多个）")
    private List<Path> archives;

    @Override
    protected int execute(Repository repo) {
        ArchiveTransformer transformer = new ArchiveTransformer(new ArchivePaths(repo.getRoot(), repo.loadConfig()));
        int code = ExitCodes.OK;
        for (Path archive : archives) {
            Path resolved = gitCad.getStartPath().resolve(archive).normalize();
            Result<ImportResult> result = transformer.importArchive(resolved);
            if (!result.isOk()) {
                log.info("import of {} failed: {}", resolved, result.getFailure());
                System.err.println("error: " + result.getFailure().getMessage());
                code = ExitCodes.BLOCKED;
                continue;
            }
            System.out.println("imported " + archive + " (" + result.getValue().getMemberCount() + " members)");
        }
        return code;
    }
}
