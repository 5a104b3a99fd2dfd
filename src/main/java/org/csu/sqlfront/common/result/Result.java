package org.csu.sqlfront.common.result;

import org.csu.sqlfront.common.diagnostic.Diagnostic;

import java.util.function.Function;

/**
 * 递归下降解析与语义检查中使用的结果值：要么成功并携带值，要么失败并携带一条诊断。
 * 失败沿调用链逐层返回，而不是通过抛异常跳出。
 *
 * @param <T> 成功时携带的值类型
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    record Success<T>(T value) implements Result<T> {
    }

    record Failure<T>(Diagnostic diagnostic) implements Result<T> {
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static Result<Void> ok() {
        return new Success<>(null);
    }

    static <T> Result<T> failure(Diagnostic diagnostic) {
        return new Failure<>(diagnostic);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    default T getValue() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        throw new IllegalStateException("No value present: " + getDiagnostic());
    }

    default Diagnostic getDiagnostic() {
        if (this instanceof Failure<T> failure) {
            return failure.diagnostic();
        }
        throw new IllegalStateException("Result is a success, no diagnostic present");
    }

    /**
     * 将失败结果转换为另一种值类型，便于在调用链中继续向上传递。
     */
    default <U> Result<U> propagate() {
        return failure(getDiagnostic());
    }

    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Success<T> success) {
            return success(mapper.apply(success.value()));
        }
        return propagate();
    }

    default <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (this instanceof Success<T> success) {
            return mapper.apply(success.value());
        }
        return propagate();
    }
}
