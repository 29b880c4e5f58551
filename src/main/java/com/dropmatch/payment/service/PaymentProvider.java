package com.dropmatch.payment.service;

/**
 * PG사(Payment Gateway) 연동 인터페이스.
 *
 * <p>PG 호출은 외부 네트워크 통신이라 DB 트랜잭션으로 되돌릴 수 없다.
 * 이미 승인된 결제는 반드시 {@link #refund}로 취소해야 한다.</p>
 *
 * <p>구현체는 {@code idempotencyKey}를 PG 측 멱등성 키로 그대로 전달해야 한다.
 * 같은 키의 재호출은 PG 쪽에서도 같은 거래로 취급된다.</p>
 */
public interface PaymentProvider {

    /** PG사에 결제 승인을 요청한다 */
    ProviderResult charge(long amountMinor, String idempotencyKey);

    /** PG사에 결제 취소/환불을 요청한다 */
    ProviderResult refund(String paymentReference, long amountMinor, String idempotencyKey);

    /** 웹훅 원문 바이트와 서명 헤더 값으로 발신자를 검증한다 */
    boolean verifyWebhookSignature(byte[] payload, String signature);

    /**
     * PG사 응답 결과.
     *
     * @param outcome   처리 결과
     * @param reference PG 거래 고유 ID (영수증 번호). 미승인이면 null
     * @param message   PG 응답 메시지 (실패 시 사유 포함)
     */
    record ProviderResult(ProviderOutcome outcome, String reference, String message) {

        public static ProviderResult declined(String message) {
            return new ProviderResult(ProviderOutcome.DECLINED, null, message);
        }

        public static ProviderResult indeterminate(String message) {
            return new ProviderResult(ProviderOutcome.INDETERMINATE, null, message);
        }
    }
}
