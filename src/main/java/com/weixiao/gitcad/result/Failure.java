package com.weixiao.gitcad.result;

import lombok.Value;

/**
 * 一次失败的描述：错误类别、可读信息；仅 ALREADY_LOCKED 时 owner 非 null。
 */
@Value
public class Failure {

    ErrorKind kind;
    String message;
    String owner;

    public static Failure of(ErrorKind kind, String message) {
        return new Failure(kind, message, null);
    }

    public static Failure alreadyLocked(String owner, String message) {
        return new Failure(ErrorKind.ALREADY_LOCKED, message, owner);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
