package com.dropmatch.payment.service;

/**
 * 결제 요청 결과. 같은 멱등성 키로 다시 요청하면 같은 값이 돌아온다.
 * 재응답 여부는 {@code LifecycleResult.replayed()}가 전달한다.
 *
 * @param amountMinor 실제 청구 금액. 항상 배달 레코드의 운임이다
 */
public record ChargeResult(
        String deliveryId,
        String idempotencyKey,
        ChargeStatus status,
        long amountMinor,
        String providerReference
) {
}
