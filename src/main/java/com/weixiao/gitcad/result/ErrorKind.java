package com.weixiao.gitcad.result;

/**
 * 错误类别：彼此互斥，调用方据此区分处理方式，不会合并为单一的通用失败。
 */
public enum ErrorKind {

    /** 文件或目录不存在 */
    NOT_FOUND,
    /** 不是预期的文件类型（如非 .FCStd） */
    WRONG_FILE_TYPE,
    /** ZIP 容器损坏或不是 ZIP */
    CORRUPT_ARCHIVE,
    PERMISSION_DENIED,
    /** 子进程超时（不视为"大概成功"） */
    TIMEOUT,
    /** 已被他人锁定，Failure 中带 owner */
    ALREADY_LOCKED,
    NOT_LOCKED,
    /** 单个文件在配置的 cap / 压缩级别下放不进一个分块 */
    FILE_TOO_LARGE,
    /** 配置无效，已回退默认值（非致命） */
    CONFIG_INVALID,
    /** 锁原语或 git 明确拒绝（非零退出码） */
    COMMAND_FAILED,
    IO_ERROR,
    INTERNAL
}
