package com.dropmatch.delivery.service;

import com.dropmatch.audit.AuditEvent;
import com.dropmatch.audit.AuditEventType;
import com.dropmatch.audit.AuditSeverity;
import com.dropmatch.audit.AuditSink;
import com.dropmatch.common.security.Identity;
import com.dropmatch.delivery.entity.Delivery;
import com.dropmatch.delivery.entity.DeliveryAction;
import com.dropmatch.delivery.entity.DeliveryStatus;
import com.dropmatch.payment.service.ChargeResult;
import com.dropmatch.payment.service.ChargeStatus;
import com.dropmatch.payment.service.PaymentWebhookEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 엔진 결과를 감사 이벤트로 바꾸는 헬퍼. 심각도 규칙이 한곳에 모여 있다.
 *
 * <ul>
 *   <li>권한 거절 (NOT_FOUND 포함) - MEDIUM</li>
 *   <li>FARE_MISMATCH, REFUND_FAILED, 웹훅 거절 - HIGH</li>
 *   <li>결과 불명 PG 응답 - CRITICAL</li>
 *   <li>관리자 통과 - 최소 MEDIUM</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
class LifecycleAuditor {

    static final String PAYMENT_PROVIDER_ACTOR = "payment-provider";

    private final AuditSink auditSink;
    private final Clock clock;

    void created(Identity identity, Delivery delivery) {
        auditSink.record(base(AuditEventType.DELIVERY_CREATED, AuditSeverity.INFO, identity, delivery.getId())
                .action("CREATE")
                .transition(null, delivery.getStatus())
                .meta("vehicleClass", delivery.getVehicleClass())
                .meta("fareMinor", delivery.getFareMinor())
                .meta("version", delivery.currentVersion())
                .build());
    }

    void transitionAccepted(Identity identity, Delivery saved, DeliveryAction action, DeliveryStatus from,
                            boolean adminOverride, String refundReference) {
        auditSink.record(base(AuditEventType.TRANSITION_ACCEPTED, AuditSeverity.INFO, identity, saved.getId())
                .action(action)
                .transition(from, saved.getStatus())
                .adminOverride(adminOverride)
                .meta("version", saved.currentVersion())
                .meta("driverId", saved.getDriverId())
                .meta("cancellationReason", action == DeliveryAction.CANCEL ? saved.getCancellationReason() : null)
                .meta("refundReference", refundReference)
                .build());
        if (refundReference != null) {
            auditSink.record(base(AuditEventType.REFUND_ISSUED, AuditSeverity.INFO, identity, saved.getId())
                    .action(action)
                    .meta("fareMinor", saved.getFareMinor())
                    .meta("refundReference", refundReference)
                    .build());
        }
    }

    /** 경합 재시도에서 이미 같은 결과가 반영되어 있던 경우 */
    void alreadyApplied(Identity identity, Delivery delivery, DeliveryAction action, boolean adminOverride) {
        auditSink.record(base(AuditEventType.TRANSITION_ACCEPTED, AuditSeverity.INFO, identity, delivery.getId())
                .action(action)
                .transition(delivery.getStatus(), delivery.getStatus())
                .adminOverride(adminOverride)
                .meta("idempotentReplay", true)
                .meta("version", delivery.currentVersion())
                .build());
    }

    void rejected(AuditEventType type, Identity identity, String deliveryId, Object action,
                  DeliveryStatus currentStatus, Rejection rejection) {
        AuditSeverity severity = type == AuditEventType.WEBHOOK_REJECTED
                ? AuditSeverity.HIGH : severityOf(rejection.kind());
        auditSink.record(base(type, severity, identity, deliveryId)
                .action(action)
                .transition(currentStatus, null)
                .reason(rejection.kind())
                .meta("detail", rejection.detail())
                .build());
    }

    void adminRead(Identity identity, Delivery delivery) {
        auditSink.record(base(AuditEventType.DELIVERY_READ, AuditSeverity.INFO, identity, delivery.getId())
                .action("VIEW")
                .adminOverride(true)
                .meta("status", delivery.getStatus())
                .meta("customerId", delivery.getCustomerId())
                .build());
    }

    void paymentAuthorized(Identity identity, ChargeResult result, Long requestedAmountMinor,
                           boolean adminOverride) {
        AuditEventType type = result.status() == ChargeStatus.REFUNDED
                ? AuditEventType.REFUND_ISSUED : AuditEventType.PAYMENT_AUTHORIZED;
        auditSink.record(base(type, AuditSeverity.INFO, identity, result.deliveryId())
                .action("AUTHORIZE_PAYMENT")
                .adminOverride(adminOverride)
                .meta("idempotencyKey", result.idempotencyKey())
                .meta("status", result.status())
                .meta("chargedMinor", result.amountMinor())
                .meta("providerReference", result.providerReference())
                .meta("requestedAmountIgnored", requestedAmountMinor != null
                        && requestedAmountMinor != result.amountMinor() ? requestedAmountMinor : null)
                .build());
    }

    void paymentReplayed(Identity identity, ChargeResult result, boolean adminOverride) {
        auditSink.record(base(AuditEventType.PAYMENT_REPLAYED, AuditSeverity.INFO, identity, result.deliveryId())
                .action("AUTHORIZE_PAYMENT")
                .adminOverride(adminOverride)
                .meta("idempotencyKey", result.idempotencyKey())
                .meta("status", result.status())
                .build());
    }

    void paymentConfirmed(Delivery saved, PaymentWebhookEvent event) {
        auditSink.record(base(AuditEventType.PAYMENT_CONFIRMED, AuditSeverity.INFO, null, saved.getId())
                .action(event.type().wireName())
                .meta("idempotencyKey", event.idempotencyKey())
                .meta("providerReference", event.providerReference())
                .meta("paymentState", saved.getPaymentState())
                .meta("version", saved.currentVersion())
                .build());
    }

    void reconciliationRequired(Identity identity, String deliveryId, String idempotencyKey,
                                String situation, String providerMessage) {
        auditSink.record(base(AuditEventType.RECONCILIATION_REQUIRED, AuditSeverity.CRITICAL, identity, deliveryId)
                .action("AUTHORIZE_PAYMENT")
                .reason(situation)
                .meta("idempotencyKey", idempotencyKey)
                .meta("providerMessage", providerMessage)
                .build());
    }

    private AuditEvent.Builder base(AuditEventType type, AuditSeverity severity, Identity identity, String deliveryId) {
        AuditEvent.Builder builder = AuditEvent.builder(type, severity, clock.instant()).deliveryId(deliveryId);
        return identity == null ? builder.actorId(PAYMENT_PROVIDER_ACTOR) : builder.actor(identity);
    }

    private AuditSeverity severityOf(RejectionKind kind) {
        if (kind.isAuthorization()) {
            return AuditSeverity.MEDIUM;
        }
        return switch (kind) {
            case FARE_MISMATCH, REFUND_FAILED -> AuditSeverity.HIGH;
            default -> AuditSeverity.INFO;
        };
    }
}
