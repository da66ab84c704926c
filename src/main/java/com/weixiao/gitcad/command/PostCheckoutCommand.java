package com.weixiao.gitcad.command;

import com.weixiao.gitcad.lifecycle.LifecycleEvent;
import com.weixiao.gitcad.lifecycle.LifecycleStateMachine;
import com.weixiao.gitcad.repo.Repository;
import picocli.CommandLine.*;

/**
 * gitcad post-checkout &lt;old&gt; &lt;new&gt; &lt;flag&gt; - 钩子：切换分支后重建变化的归档。
 */
@Command(name = "post-checkout", mixinStandardHelpOptions = true, description = "git post-checkout 钩子")
public class PostCheckoutCommand extends RepoCommand {

    @Parameters(index = "0", paramLabel = "OLD", description = "之前的 HEAD")
    private String oldRef;

    @Parameters(index = "1", paramLabel = "NEW", description = "新的 HEAD")
    private String newRef;

    @Parameters(index = "2", paramLabel = "FLAG", description = "1 表示切换分支，0 表示检出文件")
    private String branchFlag;

    @Override
    protected int execute(Repository repo) {
        LifecycleStateMachine machine = new LifecycleStateMachine(repo, gitCad.gitClient(repo), gitCad.getRunner(), System.err);
        return machine.dispatch(new LifecycleEvent.PostCheckout(oldRef, newRef, branchFlag), null);
    }
}
