package com.weixiao.gitcad.git;

import com.weixiao.gitcad.lock.CommandResult;
import com.weixiao.gitcad.lock.CommandRunner;
import com.weixiao.gitcad.result.ErrorKind;
import com.weixiao.gitcad.result.Result;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProcessGitClient 测试")
class ProcessGitClientTest {

    private static final String A = "1111111111111111111111111111111111111111";
    private static final String ZERO = "0000000000000000000000000000000000000000";

    private final List<List<String>> calls = new ArrayList<>();
    private final List<String> stdins = new ArrayList<>();

    private ProcessGitClient client(Function<List<String>, CommandResult> responder) {
        CommandRunner runner = (Path cwd, List<String> command, String stdin, Duration timeout) -> {
            calls.add(command);
            stdins.add(stdin);
            return responder.apply(command);
        };
        return new ProcessGitClient(Path.of("."), runner);
    }

    @Test
    @DisplayName("暂存路径：去掉空行、去重、统一分隔符")
    void stagedPaths() {
        ProcessGitClient git = client(cmd -> CommandResult.ok("a.FCStd\n\nb\\c.txt\na.FCStd\n"));
        Result<List<String>> staged = git.stagedPaths();
        assertThat(staged.getValue()).containsExactly("a.FCStd", "b/c.txt");
        assertThat(calls.get(0)).containsExactly("git", "diff-index", "--cached", "--name-only", "--diff-filter=ACDMRTUXB", "HEAD");
    }

    @Test
    @DisplayName("没有 HEAD（首次提交）时与空树比较")
    void stagedPaths_initialCommit() {
        ProcessGitClient git = client(cmd -> cmd.contains("HEAD")
                ? CommandResult.failed(128, "fatal: bad revision 'HEAD'")
                : CommandResult.ok("a.FCStd\n"));
        assertThat(git.stagedPaths().getValue()).containsExactly("a.FCStd");
        assertThat(calls.get(1)).contains(ProcessGitClient.EMPTY_TREE);
    }

    @Test
    @DisplayName("推送路径：已有远端分支用区间，新分支排除所有远端")
    void pushedPaths() {
        ProcessGitClient git = client(cmd -> CommandResult.ok("x/.changefile\n"));
        git.pushedPaths(A, "2222222222222222222222222222222222222222");
        git.pushedPaths(A, ZERO);
        assertThat(calls.get(0)).containsExactly("git", "log", "--name-only", "--format=",
                "2222222222222222222222222222222222222222.." + A);
        assertThat(calls.get(1)).containsExactly("git", "log", "--name-only", "--format=", A, "--not", "--remotes");
    }

    @Test
    @DisplayName("lfs 钩子透传参数与标准输入，失败返回 COMMAND_FAILED")
    void runLfsHook() {
        ProcessGitClient git = client(cmd -> CommandResult.failed(1, "git: 'lfs' is not a git command"));
        Result<Void> r = git.runLfsHook("pre-push", List.of("origin", "url"), "line\n");
        assertThat(r.getKind()).isEqualTo(ErrorKind.COMMAND_FAILED);
        assertThat(calls.get(0)).containsExactly("git", "lfs", "pre-push", "origin", "url");
        assertThat(stdins.get(0)).isEqualTo("line\n");
    }

    @Test
    @DisplayName("user.name 未配置时为空")
    void userName() {
        assertThat(client(cmd -> CommandResult.ok("Alice Smith\n")).userName()).contains("Alice Smith");
        assertThat(client(cmd -> CommandResult.failed(1, "")).userName()).isEmpty();
    }

    @Test
    @DisplayName("超时返回 TIMEOUT")
    void timeout() {
        assertThat(client(cmd -> CommandResult.timeout()).changedPaths("a", "b").getKind()).isEqualTo(ErrorKind.TIMEOUT);
    }
}
