package com.weixiao.gitcad.command;

import com.weixiao.gitcad.lifecycle.LifecycleEvent;
import com.weixiao.gitcad.lifecycle.LifecycleStateMachine;
import com.weixiao.gitcad.repo.Repository;
import picocli.CommandLine.*;

/**
 * gitcad pre-commit - 钩子：拒绝提交非空的 .FCStd 与未持锁的归档改动。
 */
@Command(name = "pre-commit", mixinStandardHelpOptions = true, description = "git pre-commit 钩子")
public class PreCommitCommand extends RepoCommand {

    @Override
    protected int execute(Repository repo) {
        LifecycleStateMachine machine = new LifecycleStateMachine(repo, gitCad.gitClient(repo), gitCad.getRunner(), System.err);
        return machine.dispatch(new LifecycleEvent.PreCommit(), gitCad.resolveActor(repo));
    }
}
