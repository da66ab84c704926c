package com.weixiao.gitcad.command;

import com.weixiao.gitcad.lifecycle.ExitCodes;
import com.weixiao.gitcad.lock.LockCoordinator;
import com.weixiao.gitcad.lock.LockRecord;
import com.weixiao.gitcad.repo.ArchivePaths;
import com.weixiao.gitcad.repo.Repository;
import com.weixiao.gitcad.result.Result;
import picocli.CommandLine.*;

import java.util.List;

/**
 * gitcad locks - 列出活动锁，每行：归档（找不到时为锁文件路径）、持有者、锁 id。
 */
@Command(name = "locks", mixinStandardHelpOptions = true, description = "列出当前的锁")
public class LocksCommand extends RepoCommand {

    @Override
    protected int execute(Repository repo) {
        LockCoordinator locks = new LockCoordinator(new ArchivePaths(repo.getRoot(), repo.loadConfig()), gitCad.getRunner());
        Result<List<LockRecord>> result = locks.listWithArchives();
        if (!result.isOk()) {
            System.err.println("error: " + result.getFailure().getMessage());
            return ExitCodes.BLOCKED;
        }
        for (LockRecord r : result.getValue()) {
            String name = r.getArchive() != null ? r.getArchive() : r.getPath();
            System.out.println(name + "\t" + r.getOwner() + (r.getLockId().isEmpty() ? "" : "\tID:" + r.getLockId()));
        }
        return ExitCodes.OK;
    }
}
