package com.dropmatch.payment.dto;

/**
 * PG 웹훅 본문.
 *
 * <pre>
 * {"event": "payment.captured", "deliveryId": "...", "idempotencyKey": "...",
 *  "paymentId": "pay_...", "amountMinor": 10900}
 * </pre>
 */
public record PaymentWebhookPayload(
        String event,
        String deliveryId,
        String idempotencyKey,
        String paymentId,
        Long amountMinor
) {
}
