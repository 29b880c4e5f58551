package com.dropmatch.payment.service;

import com.dropmatch.delivery.entity.Delivery;
import com.dropmatch.delivery.entity.DeliveryStatus;
import com.dropmatch.delivery.entity.IdempotencyRecord;
import com.dropmatch.delivery.entity.IdempotencyState;
import com.dropmatch.delivery.entity.PaymentState;
import com.dropmatch.fare.FareBreakdown;
import com.dropmatch.fare.FareCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 결제 무결성 검사기 (Payment Integrity Guard)
 *
 * <h3>검사 순서</h3>
 * <ol>
 *   <li>멱등성 키가 이미 기록됨 → 기록된 결과를 재응답 (PENDING이면 "처리 중")</li>
 *   <li>배달 상태가 ACCEPTED 이상, DELIVERED 이하인지</li>
 *   <li>다른 키로 이미 결제됨 → DUPLICATE_PAYMENT, 다른 키가 처리 중 → PAYMENT_IN_PROGRESS</li>
 *   <li>★ 변조 검사: 저장된 경로/차종으로 운임을 다시 계산해 저장 운임과 비교</li>
 * </ol>
 *
 * <p>청구 금액은 언제나 {@link Delivery#getFareMinor()}다. 요청에 실린 금액은 이 클래스에 전달조차 되지 않는다.</p>
 *
 * <p>PG 호출 결과는 세 가지로만 분류한다: 승인, 확정 거절(DECLINED), 불명(INDETERMINATE).
 * 예외는 "결제됐을 수도 있음"이므로 INDETERMINATE로 바꾸고 예약을 유지한다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentIntegrityGuard {

    static final String REFUND_KEY_PREFIX = "refund:";

    private final FareCalculator fareCalculator;
    private final PaymentProvider paymentProvider;
    private final PaymentProperties paymentProperties;

    public PaymentCheck evaluate(Delivery delivery, String idempotencyKey) {
        Optional<IdempotencyRecord> existing = delivery.findPaymentKey(idempotencyKey);
        if (existing.isPresent()) {
            return PaymentCheck.replay(toChargeResult(delivery, idempotencyKey, existing.get()));
        }

        DeliveryStatus status = delivery.getStatus();
        if (!status.isAtOrBeyond(DeliveryStatus.ACCEPTED)) {
            return PaymentCheck.reject(PaymentRejectReason.ILLEGAL_STATE,
                    "Payment is not allowed while delivery is " + status);
        }
        if (delivery.getPaymentState() != PaymentState.UNPAID) {
            return PaymentCheck.reject(PaymentRejectReason.DUPLICATE_PAYMENT,
                    "Payment already " + delivery.getPaymentState());
        }
        if (delivery.pendingPaymentKey().isPresent()) {
            return PaymentCheck.reject(PaymentRejectReason.PAYMENT_IN_PROGRESS, null);
        }

        // ★ 변조 검사 - 금액 값은 detail에 넣지 않는다 (감사 메타데이터에만 기록)
        FareBreakdown recomputed = fareCalculator.compute(
                delivery.getPickup(), delivery.getDropoff(), delivery.getVehicleClass());
        long drift = Math.abs(recomputed.totalMinor() - delivery.getFareMinor());
        if (drift > paymentProperties.fareToleranceMinor()) {
            log.error("Fare mismatch: deliveryId={}, stored={}, recomputed={}",
                    delivery.getId(), delivery.getFareMinor(), recomputed.totalMinor());
            return PaymentCheck.reject(PaymentRejectReason.FARE_MISMATCH,
                    "stored=" + delivery.getFareMinor() + ", recomputed=" + recomputed.totalMinor());
        }

        return PaymentCheck.proceed(delivery.getFareMinor());
    }

    /** 웹훅 매입 금액 검증. 매입 금액은 운임과 정확히 같아야 한다 */
    public boolean matchesFare(Delivery delivery, long capturedAmountMinor) {
        return capturedAmountMinor == delivery.getFareMinor();
    }

    public PaymentProvider.ProviderResult placeCharge(Delivery delivery, String idempotencyKey) {
        // PG 멱등성 키는 배달 단위로 구분
        String providerKey = delivery.getId() + ":" + idempotencyKey;
        try {
            return paymentProvider.charge(delivery.getFareMinor(), providerKey);
        } catch (RuntimeException e) {
            log.error("Payment provider charge failed with unknown outcome: deliveryId={}, key={}",
                    delivery.getId(), idempotencyKey, e);
            return PaymentProvider.ProviderResult.indeterminate(e.getClass().getSimpleName());
        }
    }

    /** 환불 PG 키는 배달당 하나라서 재시도해도 한 번만 환불된다 */
    public PaymentProvider.ProviderResult refund(Delivery delivery, String paymentReference) {
        try {
            return paymentProvider.refund(paymentReference, delivery.getFareMinor(),
                    REFUND_KEY_PREFIX + delivery.getId());
        } catch (RuntimeException e) {
            log.error("Payment provider refund failed with unknown outcome: deliveryId={}", delivery.getId(), e);
            return PaymentProvider.ProviderResult.indeterminate(e.getClass().getSimpleName());
        }
    }

    public boolean verifyWebhook(byte[] payload, String signature) {
        return paymentProvider.verifyWebhookSignature(payload, signature);
    }

    public ChargeResult toChargeResult(Delivery delivery, String idempotencyKey, IdempotencyRecord record) {
        return new ChargeResult(delivery.getId(), idempotencyKey, toChargeStatus(record.getState()),
                record.getAmountMinor(), record.getProviderReference());
    }

    private ChargeStatus toChargeStatus(IdempotencyState state) {
        return switch (state) {
            case PENDING -> ChargeStatus.PENDING;
            case AUTHORIZED -> ChargeStatus.AUTHORIZED;
            case CAPTURED -> ChargeStatus.CAPTURED;
            case REFUNDED -> ChargeStatus.REFUNDED;
        };
    }
}
