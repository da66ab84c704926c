package com.weixiao.gitcad.command;

import com.weixiao.gitcad.lifecycle.ExitCodes;
import com.weixiao.gitcad.lock.LockCoordinator;
import com.weixiao.gitcad.repo.ArchivePaths;
import com.weixiao.gitcad.repo.Repository;
import com.weixiao.gitcad.result.ErrorKind;
import com.weixiao.gitcad.result.Result;
import picocli.CommandLine.*;

import java.nio.file.Path;

/**
 * gitcad lock - 锁定归档；--force 会夺取他人的锁。
 */
@Command(name = "lock", mixinStandardHelpOptions = true, description = "锁定 .FCStd 以便修改")
public class LockCommand extends RepoCommand {

    @Parameters(index = "0", paramLabel = "FILE", description = ".FCStd 文件")
    private Path archive;

    @Option(names = {"-f", "--force"}, description = "夺取他人持有的锁")
    private boolean force;

    @Override
    protected int execute(Repository repo) {
        String actor = gitCad.resolveActor(repo);
        if (actor == null) {
            System.err.println("fatal: no user configured; set `git config user.name` or pass --actor");
            return ExitCodes.BLOCKED;
        }
        Path resolved = gitCad.getStartPath().resolve(archive).normalize();
        if (!ArchivePaths.isArchive(resolved.getFileName().toString())) {
            System.err.println("error: not a .FCStd file: " + archive);
            return ExitCodes.BLOCKED;
        }
        LockCoordinator locks = new LockCoordinator(new ArchivePaths(repo.getRoot(), repo.loadConfig()), gitCad.getRunner());
        Result<String> result = locks.acquire(resolved, actor, force);
        if (result.isOk()) {
            System.out.println("locked " + archive);
            return ExitCodes.OK;
        }
        System.err.println("error: " + result.getFailure().getMessage());
        if (result.getKind() == ErrorKind.ALREADY_LOCKED) {
            System.err.println("hint: use `gitcad lock --force " + archive + "` to take the lock from "
                    + result.getFailure().getOwner());
        }
        return ExitCodes.BLOCKED;
    }
}
