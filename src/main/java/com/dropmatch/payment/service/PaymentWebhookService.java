package com.dropmatch.payment.service;

import com.dropmatch.audit.AuditEvent;
import com.dropmatch.audit.AuditEventType;
import com.dropmatch.audit.AuditSeverity;
import com.dropmatch.audit.AuditSink;
import com.dropmatch.common.exception.BusinessException;
import com.dropmatch.common.exception.ErrorCode;
import com.dropmatch.delivery.entity.Delivery;
import com.dropmatch.delivery.service.DeliveryLifecycleEngine;
import com.dropmatch.payment.dto.PaymentWebhookPayload;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.Optional;

/**
 * PG 웹훅 처리.
 *
 * <pre>
 *   raw body + X-Payment-Signature
 *     → 서명 검증 (HMAC-SHA256, 상수 시간 비교). 실패 시 CRITICAL 감사 후 폐기
 *     → JSON 파싱
 *     → 알 수 없는 이벤트 종류는 무시 (200)
 *     → DeliveryLifecycleEngine.confirmPayment()
 * </pre>
 *
 * <p>서명은 파싱 전 원문 바이트로 검증한다. 검증되지 않은 본문의 어떤 값도 읽지 않는다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentWebhookService {

    private final PaymentIntegrityGuard paymentGuard;
    private final DeliveryLifecycleEngine lifecycleEngine;
    private final AuditSink auditSink;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @return 반영된 배달. 처리 대상이 아닌 이벤트 종류면 empty
     * @throws BusinessException 서명/본문이 유효하지 않거나 엔진이 거절한 경우
     */
    public Optional<Delivery> handle(byte[] payload, String signature) {
        if (!paymentGuard.verifyWebhook(payload, signature)) {
            log.error("Webhook signature verification failed: signaturePresent={}", signature != null);
            auditSink.record(AuditEvent.builder(AuditEventType.WEBHOOK_REJECTED, AuditSeverity.CRITICAL, clock.instant())
                    .actorId("payment-provider")
                    .reason("INVALID_SIGNATURE")
                    .meta("signaturePresent", signature != null)
                    .meta("payloadBytes", payload.length)
                    .build());
            throw new BusinessException(ErrorCode.WEBHOOK_REJECTED);
        }

        PaymentWebhookPayload body = parse(payload);
        Optional<WebhookEventType> type = WebhookEventType.fromWireName(body.event());
        if (type.isEmpty()) {
            log.info("Ignoring webhook event type: {}", body.event());
            return Optional.empty();
        }
        if (body.deliveryId() == null || body.deliveryId().isBlank()) {
            throw new BusinessException(ErrorCode.WEBHOOK_REJECTED, "Webhook is missing deliveryId");
        }

        PaymentWebhookEvent event = new PaymentWebhookEvent(type.get(), body.deliveryId(),
                body.idempotencyKey(), body.paymentId(), body.amountMinor());
        return Optional.of(lifecycleEngine.confirmPayment(event).orElseThrow());
    }

    private PaymentWebhookPayload parse(byte[] payload) {
        try {
            return objectMapper.readValue(payload, PaymentWebhookPayload.class);
        } catch (IOException e) {
            log.warn("Signed webhook body is not valid JSON", e);
            auditSink.record(AuditEvent.builder(AuditEventType.WEBHOOK_REJECTED, AuditSeverity.HIGH, clock.instant())
                    .actorId("payment-provider")
                    .reason("MALFORMED_BODY")
                    .build());
            throw new BusinessException(ErrorCode.WEBHOOK_REJECTED);
        }
    }
}
