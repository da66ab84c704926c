package com.weixiao.gitcad.command;

import com.weixiao.gitcad.lifecycle.LifecycleEvent;
import com.weixiao.gitcad.lifecycle.LifecycleStateMachine;
import com.weixiao.gitcad.repo.Repository;
import picocli.CommandLine.*;

/**
 * gitcad post-merge &lt;squash&gt; - 钩子：合并后重建变化的归档。
 */
@Command(name = "post-merge", mixinStandardHelpOptions = true, description = "git post-merge 钩子")
public class PostMergeCommand extends RepoCommand {

    @Parameters(index = "0", arity = "0..1", paramLabel = "SQUASH", defaultValue = "0", description = "1 表示 squash 合并")
    private String squash;

    @Override
    protected int execute(Repository repo) {
        LifecycleStateMachine machine = new LifecycleStateMachine(repo, gitCad.gitClient(repo), gitCad.getRunner(), System.err);
        return machine.dispatch(new LifecycleEvent.PostMerge(squash), null);
    }
}
