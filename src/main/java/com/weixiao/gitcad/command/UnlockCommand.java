package com.weixiao.gitcad.command;

import com.weixiao.gitcad.lifecycle.ExitCodes;
import com.weixiao.gitcad.lock.LockCoordinator;
import com.weixiao.gitcad.repo.ArchivePaths;
import com.weixiao.gitcad.repo.Repository;
import com.weixiao.gitcad.result.Result;
import picocli.CommandLine.*;

import java.nio.file.Path;

/**
 * gitcad unlock - 释放归档的锁。
 */
@Command(name = "unlock", mixinStandardHelpOptions = true, description = "释放 .FCStd 的锁")
public class UnlockCommand extends RepoCommand {

    @Parameters(index = "0", paramLabel = "FILE", description = ".FCStd 文件")
    private Path archive;

    @Option(names = {"-f", "--force"}, description = "解除他人持有的锁（需要服务端权限）")
    private boolean force;

    @Override
    protected int execute(Repository repo) {
        Path resolved = gitCad.getStartPath().resolve(archive).normalize();
        LockCoordinator locks = new LockCoordinator(new ArchivePaths(repo.getRoot(), repo.loadConfig()), gitCad.getRunner());
        Result<String> result = locks.release(resolved, gitCad.resolveActor(repo), force);
        if (result.isOk()) {
            System.out.println("unlocked " + archive);
            return ExitCodes.OK;
        }
        System.err.println("error: " + result.getFailure().getMessage());
        return ExitCodes.BLOCKED;
    }
}
