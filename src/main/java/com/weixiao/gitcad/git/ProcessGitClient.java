package com.weixiao.gitcad.git;

import com.weixiao.gitcad.lock.CommandResult;
import com.weixiao.gitcad.lock.CommandRunner;
import com.weixiao.gitcad.result.ErrorKind;
import com.weixiao.gitcad.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 通过 git 子进程实现 {@link GitClient}。
 */
public class ProcessGitClient implements GitClient {

    private static final Logger log = LoggerFactory.getLogger(ProcessGitClient.class);

    /** git 的空树对象，首次提交前没有 HEAD 时用来比较暂存区 */
    static final String EMPTY_TREE = "4b825dc642cb6eb9a060e54bf8d69288fbee4904";
    /** 新增（A）与删除（D）的归档同样要检查 */
    private static final String STAGED_FILTER = "--diff-filter=ACDMRTUXB";
    /** lfs pull 可能下载大量数据 */
    private static final Duration PULL_TIMEOUT = Duration.ofMinutes(10);

    private final Path root;
    private final CommandRunner runner;

    public ProcessGitClient(Path root, CommandRunner runner) {
        this.root = root;
        this.runner = runner;
    }

    @Override
    public Result<List<String>> stagedPaths() {
        Result<List<String>> staged = lines(List.of("git", "diff-index", "--cached", "--name-only", STAGED_FILTER, "HEAD"));
        if (staged.isOk() || staged.getKind() == ErrorKind.TIMEOUT) {
            return staged;
        }
        log.debug("diff-index against HEAD failed, assuming initial commit: {}", staged.getFailure());
        return lines(List.of("git", "diff-index", "--cached", "--name-only", STAGED_FILTER, EMPTY_TREE));
    }

    @Override
    public Result<List<String>> changedPaths(String oldRev, String newRev) {
        return lines(List.of("git", "diff-tree", "-r", "--name-only", "--no-commit-id", oldRev, newRev));
    }

    @Override
    public Result<List<String>> pushedPaths(String localOid, String remoteOid) {
        List<String> cmd = new ArrayList<>(List.of("git", "log", "--name-only", "--format="));
        if (PushRefUpdate.isZero(remoteOid)) {
            cmd.add(localOid);
            cmd.add("--not");
            cmd.add("--remotes");
        } else {
            cmd.add(remoteOid + ".." + localOid);
        }
        return lines(cmd);
    }

    @Override
    public boolean revisionExists(String rev) {
        Result<CommandResult> r = exec(List.of("git", "rev-parse", "--verify", "--quiet", rev), null, CommandRunner.DEFAULT_TIMEOUT);
        return r.isOk() && r.getValue().isSuccess();
    }

    @Override
    public Optional<String> userName() {
        return config("user.name");
    }

    @Override
    public Optional<String> hooksPath() {
        return config("core.hooksPath");
    }

    private Optional<String> config(String key) {
        Result<CommandResult> r = exec(List.of("git", "config", key), null, CommandRunner.DEFAULT_TIMEOUT);
        if (!r.isOk() || !r.getValue().isSuccess()) {
            return Optional.empty();
        }
        String value = r.getValue().getStdout().trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    @Override
    public Result<Void> runLfsHook(String hookName, List<String> args, String stdin) {
        List<String> cmd = new ArrayList<>(List.of("git", "lfs", hookName));
        cmd.addAll(args);
        return checked(cmd, stdin, CommandRunner.DEFAULT_TIMEOUT);
    }

    @Override
    public Result<Void> lfsPull() {
        return checked(List.of("git", "lfs", "pull"), null, PULL_TIMEOUT);
    }

    private Result<Void> checked(List<String> cmd, String stdin, Duration timeout) {
        Result<CommandResult> r = exec(cmd, stdin, timeout);
        if (!r.isOk()) {
            return r.castFailure();
        }
        if (!r.getValue().isSuccess()) {
            return Result.failure(ErrorKind.COMMAND_FAILED, String.join(" ", cmd) + ": " + r.getValue().errorText());
        }
        return Result.success(null);
    }

    /** 运行命令并按行返回非空输出，去重保序，\ 统一为 /。 */
    private Result<List<String>> lines(List<String> cmd) {
        Result<CommandResult> r = exec(cmd, null, CommandRunner.DEFAULT_TIMEOUT);
        if (!r.isOk()) {
            return r.castFailure();
        }
        if (!r.getValue().isSuccess()) {
            return Result.failure(ErrorKind.COMMAND_FAILED, String.join(" ", cmd) + ": " + r.getValue().errorText());
        }
        Set<String> paths = new LinkedHashSet<>();
        for (String line : r.getValue().getStdout().split("\\R")) {
            String p = line.trim();
            if (!p.isEmpty()) {
                paths.add(p.replace('\\', '/'));
            }
        }
        return Result.success(new ArrayList<>(paths));
    }

    private Result<CommandResult> exec(List<String> cmd, String stdin, Duration timeout) {
        try {
            CommandResult r = runner.run(root, cmd, stdin, timeout);
            if (r.isTimedOut()) {
                return Result.failure(ErrorKind.TIMEOUT, String.join(" ", cmd) + " timed out");
            }
            return Result.success(r);
        } catch (IOException e) {
            log.warn("cannot run {}: {}", cmd, e.getMessage());
            return Result.failure(ErrorKind.COMMAND_FAILED, "cannot run " + String.join(" ", cmd) + ": " + e.getMessage());
        }
    }
}
