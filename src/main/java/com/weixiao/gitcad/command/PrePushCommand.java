package com.weixiao.gitcad.command;

import com.weixiao.gitcad.lifecycle.LifecycleEvent;
import com.weixiao.gitcad.lifecycle.LifecycleStateMachine;
import com.weixiao.gitcad.repo.Repository;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * gitcad pre-push &lt;remote&gt; &lt;url&gt; - 钩子：推送的归档改动必须由当前用户持锁。
 * 标准输入每行一个 ref 更新。
 */
@Command(name = "pre-push", mixinStandardHelpOptions = true, description = "git pre-push 钩子")
public class PrePushCommand extends RepoCommand {

    @Parameters(index = "0", paramLabel = "REMOTE", description = "远端名")
    private String remoteName;

    @Parameters(index = "1", arity = "0..1", paramLabel = "URL", defaultValue = "", description = "远端地址")
    private String remoteUrl;

    @Override
    protected int execute(Repository repo) throws IOException {
        String stdin = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        List<String> lines = new ArrayList<>();
        for (String line : stdin.split("\\R")) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        LifecycleStateMachine machine = new LifecycleStateMachine(repo, gitCad.gitClient(repo), gitCad.getRunner(), System.err);
        return machine.dispatch(new LifecycleEvent.PrePush(remoteName, remoteUrl, lines), gitCad.resolveActor(repo));
    }
}
