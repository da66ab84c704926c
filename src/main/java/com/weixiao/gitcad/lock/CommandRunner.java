package com.weixiao.gitcad.lock;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * 运行外部命令（git / git lfs）。测试中以内存实现替换。
 */
public interface CommandRunner {

    /** 默认超时 */
    Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /**
     * 在 cwd 下运行命令，等待至多 timeout。
     *
     * @param stdin 写入子进程标准输入的内容，null 表示不写
     * @throws IOException 命令无法启动（如 git 不在 PATH 中）
     */
    CommandResult run(Path cwd, List<String> command, String stdin, Duration timeout) throws IOException;

    default CommandResult run(Path cwd, List<String> command) throws IOException {
        return run(cwd, command, null, DEFAULT_TIMEOUT);
    }
}
