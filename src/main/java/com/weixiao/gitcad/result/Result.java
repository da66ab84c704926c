package com.weixiao.gitcad.result;

import java.util.Objects;
import java.util.function.Function;

/**
 * 操作结果：成功时携带 value，失败时携带 {@link Failure}。
 * 预期内的领域失败（文件不存在、已被锁定等）一律通过 Result 返回，不抛异常。
 *
 * @param <T> 成功时的值类型
 */
public final class Result<T> {

    private final T value;
    private final Failure failure;

    private Result(T value, Failure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(value, null);
    }

    public static <T> Result<T> failure(Failure failure) {
        return new Result<>(null, Objects.requireNonNull(failure, "failure"));
    }

    public static <T> Result<T> failure(ErrorKind kind, String message) {
        return failure(Failure.of(kind, message));
    }

    public boolean isOk() {
        return failure == null;
    }

    /** 成功时返回值；失败时调用属于编程错误，抛 IllegalStateException。 */
    public T getValue() {
        if (failure != null) {
            throw new IllegalStateException("result is a failure: " + failure);
        }
        return value;
    }

    /** 失败信息；成功时为 null。 */
    public Failure getFailure() {
        return failure;
    }

    /** 失败类别；成功时为 null。 */
    public ErrorKind getKind() {
        return failure != null ? failure.getKind() : null;
    }

    /** 成功时转换值，失败原样传递。 */
    public <R> Result<R> map(Function<? super T, ? extends R> fn) {
        if (failure != null) {
            return failure(failure);
        }
        return success(fn.apply(value));
    }

    /** 把失败转为另一种值类型的 Result（仅限失败时调用）。 */
    public <R> Result<R> castFailure() {
        if (failure == null) {
            throw new IllegalStateException("result is a success");
        }
        return failure(failure);
    }

    @Override
    public String toString() {
        return failure == null ? "Success(" + value + ")" : "Failure(" + failure + ")";
    }
}
