package com.weixiao.gitcad.command;

import com.weixiao.gitcad.lifecycle.LifecycleEvent;
import com.weixiao.gitcad.lifecycle.LifecycleStateMachine;
import com.weixiao.gitcad.repo.Repository;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * gitcad post-rewrite &lt;amend|rebase&gt; - 钩子：rebase 结束后重建全部归档。标准输入为改写映射。
 */
@Command(name = "post-rewrite", mixinStandardHelpOptions = true, description = "git post-rewrite 钩子")
public class PostRewriteCommand extends RepoCommand {

    @Parameters(index = "0", paramLabel = "KIND", description = "amend 或 rebase")
    private String kind;

    @Override
    protected int execute(Repository repo) throws IOException {
        String stdin = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        LifecycleStateMachine machine = new LifecycleStateMachine(repo, gitCad.gitClient(repo), gitCad.getRunner(), System.err);
        return machine.dispatch(new LifecycleEvent.PostRewrite(kind, stdin), null);
    }
}
