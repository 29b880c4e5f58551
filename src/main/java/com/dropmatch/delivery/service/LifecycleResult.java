package com.dropmatch.delivery.service;

import com.dropmatch.common.exception.BusinessException;

import java.util.function.Function;

/**
 * 엔진 연산 결과 - 성공 값 또는 타입이 있는 거절.
 *
 * <p>거절은 예외로 비즈니스 로직을 가로지르지 않는다. 웹 경계에서만
 * {@link #orElseThrow()}로 {@link BusinessException}이 된다.</p>
 *
 * @param replayed 이미 적용된 결과를 재응답한 경우 true (중복 취소, 같은 멱등성 키 재요청 등)
 */
public record LifecycleResult<T>(T value, Rejection rejection, boolean replayed) {

    public static <T> LifecycleResult<T> success(T value) {
        return new LifecycleResult<>(value, null, false);
    }

    public static <T> LifecycleResult<T> replay(T value) {
        return new LifecycleResult<>(value, null, true);
    }

    public static <T> LifecycleResult<T> rejected(RejectionKind kind, String detail) {
        return new LifecycleResult<>(null, new Rejection(kind, detail), false);
    }

    public boolean isSuccess() {
        return rejection == null;
    }

    public <R> LifecycleResult<R> map(Function<T, R> mapper) {
        if (!isSuccess()) {
            return new LifecycleResult<>(null, rejection, false);
        }
        return new LifecycleResult<>(mapper.apply(value), null, replayed);
    }

    /** 거절이면 외부 노출 규칙에 맞춘 BusinessException을 던진다 */
    public T orElseThrow() {
        if (isSuccess()) {
            return value;
        }
        RejectionKind kind = rejection.kind();
        if (kind.disclosesDetail() && rejection.detail() != null) {
            throw new BusinessException(kind.getErrorCode(), rejection.detail());
        }
        throw new BusinessException(kind.getErrorCode());
    }
}
