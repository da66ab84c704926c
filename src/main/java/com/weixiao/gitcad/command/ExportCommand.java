package com.weixiao.gitcad.command;

import com.weixiao.gitcad.archive.ArchiveTransformer;
import com.weixiao.gitcad.archive.ExportResult;
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
 * gitcad export - 把一个或多个 .FCStd 导出为展开目录（二进制成员按配置打包为分块）。
 */
@Command(name = "export", mixinStandardHelpOptions = true, description = "将 .FCStd 导出为可 diff 的展开目录")
public class ExportCommand extends RepoCommand {

    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    @Parameters(index = "0", arity = "1..*", paramLabel = "FILE", description = ".FCStd 文件（可多个）")
    private List<Path> archives;

    @Option(names = {"-o", "--output"}, paramLabel = "DIR", description = "导出目录；默认按配置映射，只能与单个文件一起使用")
    private Path output;

    @Override
    protected int execute(Repository repo) {
        if (output != null && archives.size() > 1) {
            System.err.println("fatal: --output can only be used with a single file");
            return ExitCodes.FATAL;
        }
        ArchiveTransformer transformer = new ArchiveTransformer(new ArchivePaths(repo.getRoot(), repo.loadConfig()));
        int code = ExitCodes.OK;
        for (Path archive : archives) {
            Path resolved = gitCad.getStartPath().resolve(archive).normalize();
            Path target = output != null ? gitCad.getStartPath().resolve(output).normalize() : null;
            Result<ExportResult> result = transformer.export(resolved, target);
            if (!result.isOk()) {
                log.info("export of {} failed: {}", resolved, result.getFailure());
                System.err.println("error: " + result.getFailure().getMessage());
                code = ExitCodes.BLOCKED;
                continue;
            }
            ExportResult r = result.getValue();
            System.out.println("exported " + archive + " -> " + repo.getRoot().relativize(r.getTreeRoot())
                    + " (" + r.getMemberCount() + " members, " + r.getChunkedCount() + " chunked)");
        }
        return code;
    }
}
