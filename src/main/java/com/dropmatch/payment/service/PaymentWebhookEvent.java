package com.dropmatch.payment.service;

/**
 * 서명 검증을 통과한 웹훅 이벤트.
 *
 * @param idempotencyKey    결제 요청 시 사용한 멱등성 키 (REFUNDED는 생략 가능)
 * @param amountMinor       PG가 통보한 금액. CAPTURED에서는 운임과 같아야 한다
 */
public record PaymentWebhookEvent(
        WebhookEventType type,
        String deliveryId,
        String idempotencyKey,
        String providerReference,
        Long amountMinor
) {
}
