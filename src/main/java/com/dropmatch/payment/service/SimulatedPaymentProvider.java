package com.dropmatch.payment.service;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * 샌드박스 PG 구현 - 실제 환경에서는 PG사 API 호출로 대체된다.
 *
 * <p>거래 번호를 멱등성 키에서 결정적으로 만들기 때문에 같은 키로 다시 호출하면
 * 같은 거래 번호가 돌아온다 (실제 PG의 멱등성 키 동작과 동일).</p>
 *
 * <h3>★ Circuit Breaker</h3>
 * <p>{@code paymentProvider} 서킷이 OPEN이면 PG를 호출하지 않으므로 결과는 "결제되지 않음"이 확실하다.
 * fallback은 {@link CallNotPermittedException}만 받아서 DECLINED로 바꾼다.
 * 그 밖의 예외는 호출자에게 그대로 올라가 INDETERMINATE로 처리된다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SimulatedPaymentProvider implements PaymentProvider {

    private final PaymentProperties paymentProperties;

    @Override
    @CircuitBreaker(name = "paymentProvider", fallbackMethod = "chargeFallback")
    public ProviderResult charge(long amountMinor, String idempotencyKey) {
        if (amountMinor <= 0) {
            return ProviderResult.declined("Amount must be positive");
        }
        String reference = "pay_" + deterministicId(idempotencyKey);
        log.info("Simulated charge authorized: amount={}, key={}, reference={}", amountMinor, idempotencyKey, reference);
        return new ProviderResult(ProviderOutcome.AUTHORIZED, reference, "authorized");
    }

    @Override
    @CircuitBreaker(name = "paymentProvider", fallbackMethod = "refundFallback")
    public ProviderResult refund(String paymentReference, long amountMinor, String idempotencyKey) {
        if (paymentReference == null) {
            return ProviderResult.declined("Unknown payment reference");
        }
        String reference = "rfnd_" + deterministicId(idempotencyKey);
        log.info("Simulated refund issued: payment={}, amount={}, reference={}", paymentReference, amountMinor, reference);
        return new ProviderResult(ProviderOutcome.REFUNDED, reference, "refunded");
    }

    @Override
    public boolean verifyWebhookSignature(byte[] payload, String signature) {
        return WebhookSignatures.verify(paymentProperties.webhookSecret(), payload, signature);
    }

    private ProviderResult chargeFallback(long amountMinor, String idempotencyKey, CallNotPermittedException e) {
        log.warn("Payment provider circuit open, charge not placed: key={}", idempotencyKey);
        return ProviderResult.declined("Payment provider unavailable");
    }

    private ProviderResult refundFallback(String paymentReference, long amountMinor, String idempotencyKey,
                                          CallNotPermittedException e) {
        log.warn("Payment provider circuit open, refund not issued: payment={}", paymentReference);
        return ProviderResult.declined("Payment provider unavailable");
    }

    private String deterministicId(String idempotencyKey) {
        return UUID.nameUUIDFromBytes(idempotencyKey.getBytes(StandardCharsets.UTF_8))
                .toString().replace("-", "").substring(0, 20);
    }
}
