package com.weixiao.gitcad.lock;

import lombok.Value;

/**
 * 子进程执行结果。timedOut 为 true 时进程已被强制结束，exitCode 无意义。
 */
@Value
public class CommandResult {
    int exitCode;
    String stdout;
    String stderr;
    boolean timedOut;

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }

    /** 优先 stderr，其次 stdout，用于拼错误信息。 */
    public String errorText() {
        if (stderr != null && !stderr.isBlank()) return stderr.trim();
        if (stdout != null && !stdout.isBlank()) return stdout.trim();
        return "exit code " + exitCode;
    }

    public static CommandResult ok(String stdout) {
        return new CommandResult(0, stdout, "", false);
    }

    public static CommandResult failed(int exitCode, String stderr) {
        return new CommandResult(exitCode, "", stderr, false);
    }

    public static CommandResult timeout() {
        return new CommandResult(-1, "", "", true);
    }
}
