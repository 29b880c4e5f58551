package com.dropmatch.payment.service;

import com.dropmatch.audit.AuditEvent;
import com.dropmatch.audit.AuditEventType;
import com.dropmatch.audit.AuditSeverity;
import com.dropmatch.audit.AuditSink;
import com.dropmatch.common.exception.BusinessException;
import com.dropmatch.common.exception.ErrorCode;
import com.dropmatch.delivery.DeliveryFixtures;
import com.dropmatch.delivery.entity.Delivery;
import com.dropmatch.delivery.service.DeliveryLifecycleEngine;
import com.dropmatch.delivery.service.LifecycleResult;
import com.dropmatch.delivery.service.RejectionKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class PaymentWebhookServiceTest {

    private static final String SIGNATURE = "sig";

    @Mock
    private PaymentIntegrityGuard paymentGuard;
    @Mock
    private DeliveryLifecycleEngine lifecycleEngine;
    @Mock
    private AuditSink auditSink;

    private PaymentWebhookService webhookService;

    @BeforeEach
    void setUp() {
        webhookService = new PaymentWebhookService(paymentGuard, lifecycleEngine, auditSink, new ObjectMapper(),
                Clock.fixed(DeliveryFixtures.NOW, ZoneOffset.UTC));
    }

    private byte[] body(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("★ 서명 불일치 - 본문을 읽지 않고 CRITICAL 감사 후 거절")
    void invalidSignature() {
        byte[] payload = body("{\"event\":\"payment.captured\",\"deliveryId\":\"d-1\"}");
        given(paymentGuard.verifyWebhook(payload, SIGNATURE)).willReturn(false);

        assertThatThrownBy(() -> webhookService.handle(payload, SIGNATURE))
                .isInstanceOf(BusinessException.class)
                .hasMessage(ErrorCode.WEBHOOK_REJECTED.getMessage());

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditSink).record(captor.capture());
        assertThat(captor.getValue().type()).isEqualTo(AuditEventType.WEBHOOK_REJECTED);
        assertThat(captor.getValue().severity()).isEqualTo(AuditSeverity.CRITICAL);
        assertThat(captor.getValue().deliveryId()).isNull();
        verifyNoInteractions(lifecycleEngine);
    }

    @Test
    @DisplayName("서명은 맞지만 JSON이 아니면 HIGH 감사 후 거절")
    void malformedBody() {
        byte[] payload = body("not-json");
        given(paymentGuard.verifyWebhook(payload, SIGNATURE)).willReturn(true);

        assertThatThrownBy(() -> webhookService.handle(payload, SIGNATURE))
                .isInstanceOf(BusinessException.class);

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditSink).record(captor.capture());
        assertThat(captor.getValue().severity()).isEqualTo(AuditSeverity.HIGH);
    }

    @Test
    @DisplayName("처리 대상이 아닌 이벤트 종류는 무시")
    void unknownEventIgnored() {
        byte[] payload = body("{\"event\":\"payout.settled\",\"deliveryId\":\"d-1\"}");
        given(paymentGuard.verifyWebhook(payload, SIGNATURE)).willReturn(true);

        assertThat(webhookService.handle(payload, SIGNATURE)).isEmpty();
        verifyNoInteractions(lifecycleEngine);
    }

    @Test
    @DisplayName("검증된 매입 이벤트는 엔진으로 전달")
    void capturedForwardedToEngine() {
        Delivery delivery = DeliveryFixtures.accepted("cust-1", "drv-1");
        byte[] payload = body("{\"event\":\"payment.captured\",\"deliveryId\":\"" + delivery.getId()
                + "\",\"idempotencyKey\":\"key-1\",\"paymentId\":\"pay_1\",\"amountMinor\":109}");
        given(paymentGuard.verifyWebhook(payload, SIGNATURE)).willReturn(true);
        given(lifecycleEngine.confirmPayment(any())).willReturn(LifecycleResult.success(delivery));

        Optional<Delivery> result = webhookService.handle(payload, SIGNATURE);

        assertThat(result).contains(delivery);
        ArgumentCaptor<PaymentWebhookEvent> captor = ArgumentCaptor.forClass(PaymentWebhookEvent.class);
        verify(lifecycleEngine).confirmPayment(captor.capture());
        assertThat(captor.getValue()).isEqualTo(new PaymentWebhookEvent(WebhookEventType.CAPTURED,
                delivery.getId(), "key-1", "pay_1", 109L));
    }

    @Test
    @DisplayName("엔진 거절은 에러 코드로 변환")
    void engineRejectionPropagates() {
        byte[] payload = body("{\"event\":\"payment.captured\",\"deliveryId\":\"d-1\","
                + "\"idempotencyKey\":\"key-1\",\"amountMinor\":1}");
        given(paymentGuard.verifyWebhook(payload, SIGNATURE)).willReturn(true);
        given(lifecycleEngine.confirmPayment(any()))
                .willReturn(LifecycleResult.rejected(RejectionKind.FARE_MISMATCH, "captured=1, fare=109"));

        assertThatThrownBy(() -> webhookService.handle(payload, SIGNATURE))
                .isInstanceOf(BusinessException.class)
                .hasMessage(ErrorCode.PAYMENT_NOT_VERIFIED.getMessage());
    }
}
