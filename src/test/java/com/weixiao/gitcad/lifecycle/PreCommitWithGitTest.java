package com.weixiao.gitcad.lifecycle;

import com.weixiao.gitcad.config.ConfigLoader;
import com.weixiao.gitcad.config.RepositoryConfig;
import com.weixiao.gitcad.git.ProcessGitClient;
import com.weixiao.gitcad.lock.CommandResult;
import com.weixiao.gitcad.lock.CommandRunner;
import com.weixiao.gitcad.lock.ProcessCommandRunner;
import com.weixiao.gitcad.repo.Repository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.weixiao.gitcad.GitCadTestUtil.randomBytes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * 在真实的 git 仓库中跑 pre-commit：暂存区由 git 本身给出。本机没有 git 时跳过。
 */
@DisplayName("pre-commit 真实 git 测试")
class PreCommitWithGitTest {

    private final CommandRunner runner = new ProcessCommandRunner();

    @TempDir
    Path dir;

    private ByteArrayOutputStream errBytes;

    @BeforeEach
    void setUp() throws Exception {
        assumeTrue(gitAvailable(), "git is not installed");
        git("init", "-q");
        git("config", "user.name", "alice");
        git("config", "user.email", "alice@example.com");
        git("config", "commit.gpgsign", "false");
        ConfigLoader.save(dir, RepositoryConfig.defaults().toBuilder().requireLock(false).build());
        errBytes = new ByteArrayOutputStream();
    }

    private boolean gitAvailable() {
        try {
            return runner.run(dir, List.of("git", "--version")).isSuccess();
        } catch (IOException e) {
            return false;
        }
    }

    private void git(String... args) throws IOException {
        List<String> cmd = new ArrayList<>(List.of("git"));
        cmd.addAll(List.of(args));
        CommandResult r = runner.run(dir, cmd);
        assertThat(r.isSuccess()).as("%s: %s", cmd, r.errorText()).isTrue();
    }

    private int preCommit() {
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        ProcessGitClient client = new ProcessGitClient(dir, runner);
        return new LifecycleStateMachine(new Repository(dir), client, runner, err)
                .dispatch(new LifecycleEvent.PreCommit(), "alice");
    }

    @Test
    @DisplayName("首次提交时新加入的非空归档被拒绝")
    void initialCommitBlocksNewArchive() throws Exception {
        Files.write(dir.resolve("part.FCStd"), randomBytes(5000, 1));
        git("add", "part.FCStd");

        assertThat(new ProcessGitClient(dir, runner).stagedPaths().getValue()).containsExactly("part.FCStd");
        assertThat(preCommit()).isEqualTo(ExitCodes.BLOCKED);
        assertThat(errBytes.toString(StandardCharsets.UTF_8)).contains("part.FCStd is not empty");
    }

    @Test
    @DisplayName("已有提交后新加入的非空归档被拒绝，空壳归档放行")
    void laterCommitBlocksNewArchive() throws Exception {
        Files.write(dir.resolve("part.FCStd"), new byte[0]);
        git("add", "part.FCStd");
        git("commit", "-q", "-m", "init");
        assertThat(preCommit()).isEqualTo(ExitCodes.OK);

        Files.write(dir.resolve("bracket.FCStd"), randomBytes(5000, 2));
        git("add", "bracket.FCStd");

        assertThat(new ProcessGitClient(dir, runner).stagedPaths().getValue()).containsExactly("bracket.FCStd");
        assertThat(preCommit()).isEqualTo(ExitCodes.BLOCKED);
        assertThat(errBytes.toString(StandardCharsets.UTF_8)).contains("bracket.FCStd is not empty");
    }
}
