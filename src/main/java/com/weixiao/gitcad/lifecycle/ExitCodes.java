package com.weixiao.gitcad.lifecycle;

/**
 * 钩子进程退出码。
 */
public final class ExitCodes {

    /** 放行 */
    public static final int OK = 0;
    /** 被策略拦截或领域失败（未持锁、归档非空、导入失败） */
    public static final int BLOCKED = 1;
    /** 内部错误 */
    public static final int FATAL = 2;

    private ExitCodes() {
    }
}
