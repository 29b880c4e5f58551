package com.dropmatch.payment.service;

import com.dropmatch.delivery.DeliveryFixtures;
import com.dropmatch.delivery.entity.Delivery;
import com.dropmatch.delivery.entity.IdempotencyState;
import com.dropmatch.fare.FareBreakdown;
import com.dropmatch.fare.FareCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.dropmatch.delivery.DeliveryFixtures.FARE_109;
import static com.dropmatch.delivery.DeliveryFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class PaymentIntegrityGuardTest {

    @Mock
    private FareCalculator fareCalculator;
    @Mock
    private PaymentProvider paymentProvider;

    private PaymentIntegrityGuard guard;
    private Delivery accepted;

    @BeforeEach
    void setUp() {
        guard = new PaymentIntegrityGuard(fareCalculator, paymentProvider, new PaymentProperties(1, "secret"));
        accepted = DeliveryFixtures.accepted("cust-1", "drv-1");
    }

    private FareBreakdown fareWithTotal(long total) {
        return new FareBreakdown(50, 51, 0, total - 101, total, 101, 5_100, 900);
    }

    @Test
    @DisplayName("새 키 + 운임 일치 → 저장 운임으로 진행")
    void proceedsWithStoredFare() {
        given(fareCalculator.compute(any(), any(), any())).willReturn(FARE_109);

        PaymentCheck check = guard.evaluate(accepted, "key-1");

        assertThat(check.verdict()).isEqualTo(PaymentCheck.Verdict.PROCEED);
        assertThat(check.amountMinor()).isEqualTo(109);
    }

    @Test
    @DisplayName("재계산 운임이 허용 오차(1) 이내면 통과, 초과면 FARE_MISMATCH")
    void tamperCheckUsesTolerance() {
        given(fareCalculator.compute(any(), any(), any())).willReturn(fareWithTotal(110), fareWithTotal(111));

        assertThat(guard.evaluate(accepted, "key-1").verdict()).isEqualTo(PaymentCheck.Verdict.PROCEED);

        PaymentCheck mismatch = guard.evaluate(accepted, "key-1");
        assertThat(mismatch.verdict()).isEqualTo(PaymentCheck.Verdict.REJECT);
        assertThat(mismatch.reason()).isEqualTo(PaymentRejectReason.FARE_MISMATCH);
    }

    @Test
    @DisplayName("배차 전(CREATED)에는 결제 불가")
    void rejectsBeforeAcceptance() {
        PaymentCheck check = guard.evaluate(DeliveryFixtures.created("cust-1"), "key-1");

        assertThat(check.reason()).isEqualTo(PaymentRejectReason.ILLEGAL_STATE);
        verifyNoInteractions(fareCalculator);
    }

    @Test
    @DisplayName("이미 확정된 키 → 기록된 결과 재응답, 재계산/PG 호출 없음")
    void replaysSettledKey() {
        accepted.reservePaymentKey("key-1", NOW);
        accepted.settlePaymentKey("key-1", IdempotencyState.AUTHORIZED, "pay_1", NOW);

        PaymentCheck check = guard.evaluate(accepted, "key-1");

        assertThat(check.verdict()).isEqualTo(PaymentCheck.Verdict.REPLAY);
        assertThat(check.replay().status()).isEqualTo(ChargeStatus.AUTHORIZED);
        assertThat(check.replay().providerReference()).isEqualTo("pay_1");
        verifyNoInteractions(fareCalculator, paymentProvider);
    }

    @Test
    @DisplayName("같은 키가 처리 중 → PENDING 재응답, 다른 키 → PAYMENT_IN_PROGRESS")
    void pendingReservation() {
        accepted.reservePaymentKey("key-1", NOW);

        assertThat(guard.evaluate(accepted, "key-1").replay().status()).isEqualTo(ChargeStatus.PENDING);
        assertThat(guard.evaluate(accepted, "key-2").reason()).isEqualTo(PaymentRejectReason.PAYMENT_IN_PROGRESS);
    }

    @Test
    @DisplayName("다른 키로 이미 승인된 배달 → DUPLICATE_PAYMENT")
    void rejectsSecondKeyAfterAuthorization() {
        accepted.reservePaymentKey("key-1", NOW);
        accepted.settlePaymentKey("key-1", IdempotencyState.AUTHORIZED, "pay_1", NOW);

        assertThat(guard.evaluate(accepted, "key-2").reason()).isEqualTo(PaymentRejectReason.DUPLICATE_PAYMENT);
    }

    @Test
    @DisplayName("PG 호출은 저장 운임 + 배달 단위 키로만")
    void chargesStoredFare() {
        given(paymentProvider.charge(anyLong(), anyString()))
                .willReturn(new PaymentProvider.ProviderResult(ProviderOutcome.AUTHORIZED, "pay_1", "ok"));

        guard.placeCharge(accepted, "key-1");

        verify(paymentProvider).charge(109, accepted.getId() + ":key-1");
    }

    @Test
    @DisplayName("PG 예외는 결과 불명(INDETERMINATE)")
    void providerExceptionIsIndeterminate() {
        given(paymentProvider.charge(anyLong(), anyString())).willThrow(new IllegalStateException("socket timeout"));

        PaymentProvider.ProviderResult result = guard.placeCharge(accepted, "key-1");

        assertThat(result.outcome()).isEqualTo(ProviderOutcome.INDETERMINATE);
    }

    @Test
    @DisplayName("환불 PG 키는 배달당 하나")
    void refundKeyPerDelivery() {
        given(paymentProvider.refund(anyString(), anyLong(), anyString()))
                .willReturn(new PaymentProvider.ProviderResult(ProviderOutcome.REFUNDED, "rfnd_1", "ok"));

        guard.refund(accepted, "pay_1");

        verify(paymentProvider).refund("pay_1", 109, "refund:" + accepted.getId());
    }

    @Test
    @DisplayName("매입 금액은 운임과 정확히 같아야 함")
    void capturedAmountMustEqualFare() {
        assertThat(guard.matchesFare(accepted, 109)).isTrue();
        assertThat(guard.matchesFare(accepted, 108)).isFalse();
    }
}
