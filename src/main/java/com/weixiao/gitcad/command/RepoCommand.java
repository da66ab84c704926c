package com.weixiao.gitcad.command;

import com.weixiao.gitcad.GitCad;
import com.weixiao.gitcad.lifecycle.ExitCodes;
import com.weixiao.gitcad.repo.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.IExitCodeGenerator;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;

/**
 * 需要在仓库内执行的子命令的公共部分：从 -C 指定的路径向上查找仓库，找不到时以 fatal 结束。
 */
abstract class RepoCommand implements Runnable, IExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(RepoCommand.class);

    @ParentCommand
    protected GitCad gitCad;

    private int exitCode = 0;

    @Override
    public void run() {
        exitCode = 0;
        Repository repo = Repository.find(gitCad.getStartPath());
        if (repo == null) {
            log.debug("no repo found from {}", gitCad.getStartPath());
            System.err.println("fatal: not a git repository (or any of the parent directories): .git");
            exitCode = ExitCodes.FATAL;
            return;
        }
        log.debug("repo root={}", repo.getRoot());
        try {
            exitCode = execute(repo);
        } catch (IOException | RuntimeException e) {
            log.error("{} failed", getClass().getSimpleName(), e);
            System.err.println("fatal: " + e.getMessage());
            exitCode = ExitCodes.FATAL;
        }
    }

    /** 在仓库内执行，返回退出码。 */
    protected abstract int execute(Repository repo) throws IOException;

    /** 返回本命令的退出码（0 成功，1 被拒绝或失败，2 内部错误）。 */
    @Override
    public int getExitCode() {
        return exitCode;
    }
}
