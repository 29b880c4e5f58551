package com.dropmatch.payment.service;

/**
 * {@link PaymentIntegrityGuard#evaluate} 판정.
 *
 * <ul>
 *   <li>REPLAY - 이미 기록된 키. {@code replay}를 그대로 돌려주고 PG를 호출하지 않는다</li>
 *   <li>PROCEED - 새 키. {@code amountMinor}(= 저장 운임)로 예약 후 결제 진행</li>
 *   <li>REJECT - {@code reason}으로 거절</li>
 * </ul>
 */
public record PaymentCheck(Verdict verdict, ChargeResult replay, long amountMinor,
                           PaymentRejectReason reason, String detail) {

    public enum Verdict { REPLAY, PROCEED, REJECT }

    static PaymentCheck replay(ChargeResult result) {
        return new PaymentCheck(Verdict.REPLAY, result, result.amountMinor(), null, null);
    }

    static PaymentCheck proceed(long amountMinor) {
        return new PaymentCheck(Verdict.PROCEED, null, amountMinor, null, null);
    }

    static PaymentCheck reject(PaymentRejectReason reason, String detail) {
        return new PaymentCheck(Verdict.REJECT, null, 0L, reason, detail);
    }
}
