package com.articlegate.core.model;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/** 값 또는 Failure 중 하나만 갖는 결과 타입. */
public final class AcquisitionResult<T> {
    private final T value;
    private final Failure failure;

    private AcquisitionResult(T value, Failure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> AcquisitionResult<T> success(T value) {
        return new AcquisitionResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> AcquisitionResult<T> failure(Failure failure) {
        return new AcquisitionResult<>(null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isSuccess() { return failure == null; }

    /** 성공 값. 실패 결과에서 호출하면 IllegalStateException */
    public T get() {
        if (failure != null) throw new IllegalStateException("no value: " + failure.kind() + " " + failure.reason());
        return value;
    }

    public Optional<T> value() { return Optional.ofNullable(value); }
    public Optional<Failure> failure() { return Optional.ofNullable(failure); }

    public <R> AcquisitionResult<R> map(Function<? super T, ? extends R> fn) {
        if (failure != null) return failure(failure);
        return success(fn.apply(value));
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success[" + value + "]" : "Failure[" + failure.kind() + ": " + failure.reason() + "]";
    }
}
