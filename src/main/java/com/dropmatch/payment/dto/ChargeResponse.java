package com.dropmatch.payment.dto;

import com.dropmatch.payment.service.ChargeResult;
import com.dropmatch.payment.service.ChargeStatus;

public record ChargeResponse(
        String deliveryId,
        String idempotencyKey,
        ChargeStatus status,
        long amountMinor,
        String providerReference,
        boolean replayed
) {

    /** @param replayed 같은 멱등성 키의 이전 결과를 재응답한 경우 true */
    public static ChargeResponse from(ChargeResult result, boolean replayed) {
        return new ChargeResponse(result.deliveryId(), result.idempotencyKey(), result.status(),
                result.amountMinor(), result.providerReference(), replayed);
    }
}
