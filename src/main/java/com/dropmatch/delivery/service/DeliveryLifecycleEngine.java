package com.dropmatch.delivery.service;

import com.dropmatch.audit.AuditEventType;
import com.dropmatch.common.security.Identity;
import com.dropmatch.common.security.Role;
import com.dropmatch.delivery.entity.Delivery;
import com.dropmatch.delivery.entity.DeliveryAction;
import com.dropmatch.delivery.entity.DeliveryStatus;
import com.dropmatch.delivery.entity.IdempotencyRecord;
import com.dropmatch.delivery.entity.IdempotencyState;
import com.dropmatch.delivery.entity.PaymentState;
import com.dropmatch.delivery.event.DeliveryLifecycleEvent;
import com.dropmatch.delivery.guard.AuthorizationDecision;
import com.dropmatch.delivery.guard.DenyReason;
import com.dropmatch.delivery.guard.OwnershipGuard;
import com.dropmatch.delivery.guard.Relation;
import com.dropmatch.delivery.repository.DeliveryRecordStore;
import com.dropmatch.delivery.repository.VersionConflictException;
import com.dropmatch.delivery.statemachine.DeliveryStateMachine;
import com.dropmatch.delivery.statemachine.TransitionDecision;
import com.dropmatch.delivery.statemachine.TransitionRejectReason;
import com.dropmatch.driver.DriverDirectory;
import com.dropmatch.fare.FareBreakdown;
import com.dropmatch.fare.FareCalculator;
import com.dropmatch.fare.Location;
import com.dropmatch.fare.VehicleClass;
import com.dropmatch.payment.service.ChargeResult;
import com.dropmatch.payment.service.ChargeStatus;
import com.dropmatch.payment.service.PaymentCheck;
import com.dropmatch.payment.service.PaymentIntegrityGuard;
import com.dropmatch.payment.service.PaymentProvider.ProviderResult;
import com.dropmatch.payment.service.PaymentRejectReason;
import com.dropmatch.payment.service.PaymentWebhookEvent;
import com.dropmatch.payment.service.ProviderOutcome;
import com.dropmatch.payment.service.WebhookEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * 배달 생명주기 엔진 (Delivery Lifecycle Engine) - 모든 쓰기 연산의 단일 진입점.
 *
 * <h3>연산 공통 흐름</h3>
 * <pre>
 *   load(id, version) → OwnershipGuard → StateMachine / PaymentIntegrityGuard
 *     → compareAndSwap(version)
 *         └ 버전 충돌 → 다시 load 후 1회 재시도 → 또 충돌이면 CONTENTION
 *     → 감사 이벤트 (수락/거절 모두) + 수락 시 DeliveryLifecycleEvent 발행
 * </pre>
 *
 * <h3>★ 결제 3단계</h3>
 * <ol>
 *   <li>예약: 멱등성 키를 PENDING으로 CAS 기록 (PG 호출 전)</li>
 *   <li>PG 호출: 행 락이나 트랜잭션 없이 수행</li>
 *   <li>확정: 승인 → AUTHORIZED 기록, 확정 거절 → 예약 해제, 불명 → 예약 유지 + CRITICAL 감사</li>
 * </ol>
 * <p>1단계가 커밋된 뒤에는 요청이 끊겨도 예약이 남으므로 같은 키의 재시도가 이중 결제로 이어지지 않는다.</p>
 *
 * <h3>거절 처리</h3>
 * <p>거절은 예외가 아니라 {@link LifecycleResult}로 돌려준다. 권한/상태/금액 거절은 재시도하지 않는다.
 * 재시도는 버전 충돌에 한해 정확히 한 번이며, 그 재시도에서 이미 원하는 상태가 반영돼 있으면
 * (예: 동시 취소) 에러 대신 멱등 성공을 돌려준다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryLifecycleEngine {

    private static final String AUTHORIZE_PAYMENT = "AUTHORIZE_PAYMENT";
    private static final int MAX_IDEMPOTENCY_KEY_LENGTH = 128;
    private static final int MAX_CANCELLATION_REASON_LENGTH = 500;

    private static final Map<DeliveryAction, Set<Relation>> REQUIRED_RELATIONS = new EnumMap<>(DeliveryAction.class);

    static {
        REQUIRED_RELATIONS.put(DeliveryAction.PICKUP, Set.of(Relation.IS_ASSIGNED_DRIVER));
        REQUIRED_RELATIONS.put(DeliveryAction.START, Set.of(Relation.IS_ASSIGNED_DRIVER));
        REQUIRED_RELATIONS.put(DeliveryAction.COMPLETE, Set.of(Relation.IS_ASSIGNED_DRIVER));
        REQUIRED_RELATIONS.put(DeliveryAction.CANCEL, Set.of(Relation.IS_CUSTOMER, Relation.IS_ASSIGNED_DRIVER));
    }

    private final DeliveryRecordStore recordStore;
    private final OwnershipGuard ownershipGuard;
    private final DeliveryStateMachine stateMachine;
    private final PaymentIntegrityGuard paymentGuard;
    private final FareCalculator fareCalculator;
    private final DriverDirectory driverDirectory;
    private final LifecycleAuditor auditor;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /** 버전 충돌 시 재시도되는 한 번의 시도. {@code retry}는 두 번째 시도 여부 */
    @FunctionalInterface
    private interface Attempt<T> {
        LifecycleResult<T> run(boolean retry) throws VersionConflictException;
    }

    private record Reservation(Delivery delivery, ChargeResult replay, boolean adminOverride) {
    }

    private enum ApprovalOutcome { SETTLED, REFUNDED_AFTER_CANCEL, REFUND_FAILED }

    // ==================== 생성 / 조회 ====================

    /** 고객 요청으로 배달 생성. 운임은 여기서 한 번만 계산된다 */
    public LifecycleResult<Delivery> create(Identity identity, Location pickup, Location dropoff,
                                            VehicleClass vehicleClass) {
        if (!identity.hasRole(Role.CUSTOMER)) {
            return reject(AuditEventType.TRANSITION_REJECTED, identity, null, "CREATE", null,
                    RejectionKind.ROLE_INSUFFICIENT, null);
        }
        if (pickup.getLatitude() == dropoff.getLatitude() && pickup.getLongitude() == dropoff.getLongitude()) {
            return reject(AuditEventType.TRANSITION_REJECTED, identity, null, "CREATE", null,
                    RejectionKind.INVALID_REQUEST, "Pickup and dropoff must be different locations");
        }

        FareBreakdown fare = fareCalculator.compute(pickup, dropoff, vehicleClass);
        Delivery delivery = Delivery.create(UUID.randomUUID().toString(), identity.actorId(),
                pickup, dropoff, vehicleClass, fare, clock.instant());
        Delivery saved = recordStore.insert(delivery);

        auditor.created(identity, saved);
        log.info("Delivery created: deliveryId={}, customerId={}, vehicleClass={}, fareMinor={}",
                saved.getId(), saved.getCustomerId(), vehicleClass, saved.getFareMinor());
        return LifecycleResult.success(saved);
    }

    /** 고객, 배정 기사, 관리자만 조회 가능. 관리자 조회는 감사 기록 */
    public LifecycleResult<Delivery> view(Identity identity, String deliveryId) {
        Optional<Delivery> loaded = recordStore.load(deliveryId);
        if (loaded.isEmpty()) {
            return reject(AuditEventType.DELIVERY_READ, identity, deliveryId, "VIEW", null,
                    RejectionKind.NOT_FOUND, null);
        }
        Delivery delivery = loaded.get();
        AuthorizationDecision decision = ownershipGuard.authorize(identity, delivery, Relation.IS_ANY_ASSIGNED_PARTY);
        if (!decision.allowed()) {
            return reject(AuditEventType.DELIVERY_READ, identity, deliveryId, "VIEW", delivery.getStatus(),
                    toRejectionKind(decision.denyReason()), null);
        }
        if (decision.adminOverride()) {
            auditor.adminRead(identity, delivery);
        }
        return LifecycleResult.success(delivery);
    }

    // ==================== 상태 전이 ====================

    public LifecycleResult<Delivery> accept(Identity identity, String deliveryId) {
        return transition(identity, deliveryId, DeliveryAction.ACCEPT, null);
    }

    public LifecycleResult<Delivery> pickup(Identity identity, String deliveryId) {
        return transition(identity, deliveryId, DeliveryAction.PICKUP, null);
    }

    public LifecycleResult<Delivery> start(Identity identity, String deliveryId) {
        return transition(identity, deliveryId, DeliveryAction.START, null);
    }

    public LifecycleResult<Delivery> complete(Identity identity, String deliveryId) {
        return transition(identity, deliveryId, DeliveryAction.COMPLETE, null);
    }

    /**
     * 취소. 결제가 승인/매입된 상태면 PG 환불을 먼저 끝낸 뒤 CANCELLED를 기록한다.
     * 환불이 거절되거나 결과 불명이면 취소도 거절된다 (REFUND_FAILED).
     */
    public LifecycleResult<Delivery> cancel(Identity identity, String deliveryId, String reason) {
        if (reason != null && reason.length() > MAX_CANCELLATION_REASON_LENGTH) {
            return reject(AuditEventType.TRANSITION_REJECTED, identity, deliveryId, DeliveryAction.CANCEL, null,
                    RejectionKind.INVALID_REQUEST, "Cancellation reason is too long");
        }
        return transition(identity, deliveryId, DeliveryAction.CANCEL, reason);
    }

    private LifecycleResult<Delivery> transition(Identity identity, String deliveryId, DeliveryAction action,
                                                 String cancellationReason) {
        return withContentionRetry(AuditEventType.TRANSITION_REJECTED, identity, deliveryId, action,
                retry -> attemptTransition(identity, deliveryId, action, cancellationReason, retry));
    }

    private LifecycleResult<Delivery> attemptTransition(Identity identity, String deliveryId, DeliveryAction action,
                                                        String cancellationReason, boolean retry)
            throws VersionConflictException {
        Optional<Delivery> loaded = recordStore.load(deliveryId);
        if (loaded.isEmpty()) {
            return reject(AuditEventType.TRANSITION_REJECTED, identity, deliveryId, action, null,
                    RejectionKind.NOT_FOUND, null);
        }
        Delivery delivery = loaded.get();
        DeliveryStatus from = delivery.getStatus();

        // 1. 소유권 - ACCEPT는 아직 배정 기사가 없으므로 역할로 판단.
        //    이미 배정된 배달은 배정 기사 외에는 권한 거절로 보여 상태가 드러나지 않는다
        boolean adminOverride = false;
        if (action == DeliveryAction.ACCEPT) {
            if (!identity.hasRole(Role.DRIVER)) {
                return reject(AuditEventType.TRANSITION_REJECTED, identity, deliveryId, action, from,
                        RejectionKind.ROLE_INSUFFICIENT, null);
            }
            if (from != DeliveryStatus.CREATED && !delivery.isAssignedDriver(identity.actorId())) {
                return reject(AuditEventType.TRANSITION_REJECTED, identity, deliveryId, action, from,
                        RejectionKind.NOT_ASSIGNED, null);
            }
        } else {
            AuthorizationDecision decision = ownershipGuard.authorize(identity, delivery, REQUIRED_RELATIONS.get(action));
            if (!decision.allowed()) {
                return reject(AuditEventType.TRANSITION_REJECTED, identity, deliveryId, action, from,
                        toRejectionKind(decision.denyReason()), null);
            }
            adminOverride = decision.adminOverride();
        }

        // ★ 경합 재시도에서 이미 같은 결과가 반영돼 있으면 멱등 성공
        if (retry && from == stateMachine.destinationOf(action)
                && (action != DeliveryAction.ACCEPT || delivery.isAssignedDriver(identity.actorId()))) {
            auditor.alreadyApplied(identity, delivery, action, adminOverride);
            log.info("Transition already applied: deliveryId={}, action={}, status={}", deliveryId, action, from);
            return LifecycleResult.replay(delivery);
        }

        // 2. 상태 머신
        TransitionDecision transition = stateMachine.canTransition(from, action, identity.role());
        if (!transition.allowed()) {
            RejectionKind kind = transition.rejectReason() == TransitionRejectReason.ROLE_INSUFFICIENT
                    ? RejectionKind.ROLE_INSUFFICIENT
                    : RejectionKind.ILLEGAL_TRANSITION;
            return reject(AuditEventType.TRANSITION_REJECTED, identity, deliveryId, action, from, kind,
                    transition.detail());
        }

        if (action == DeliveryAction.ACCEPT && !driverDirectory.isAvailable(identity.actorId())) {
            return reject(AuditEventType.TRANSITION_REJECTED, identity, deliveryId, action, from,
                    RejectionKind.DRIVER_UNAVAILABLE, null);
        }

        Instant now = clock.instant();
        String refundReference = null;
        if (action == DeliveryAction.CANCEL) {
            if (delivery.getPaymentState().holdsFunds()) {
                ProviderResult refund = paymentGuard.refund(delivery, delivery.getPaymentReference());
                if (refund.outcome() != ProviderOutcome.REFUNDED) {
                    return reject(AuditEventType.TRANSITION_REJECTED, identity, deliveryId, action, from,
                            RejectionKind.REFUND_FAILED, refund.outcome() + ": " + refund.message());
                }
                delivery.markRefunded(refund.reference(), now);
                refundReference = refund.reference();
            }
            delivery.recordCancellationReason(cancellationReason);
        }

        // 3. CAS 쓰기
        delivery.applyTransition(action, transition.nextStatus(), identity.actorId(), adminOverride, now);
        Delivery saved = recordStore.compareAndSwap(delivery);

        auditor.transitionAccepted(identity, saved, action, from, adminOverride, refundReference);
        eventPublisher.publishEvent(new DeliveryLifecycleEvent(saved.getId(), action, from, saved.getStatus(),
                identity.actorId(), identity.role(), saved.currentVersion(), adminOverride, now));
        log.info("Delivery transition applied: deliveryId={}, action={}, {}->{}, actor={}, version={}",
                deliveryId, action, from, saved.getStatus(), identity.actorId(), saved.currentVersion());
        return LifecycleResult.success(saved);
    }

    // ==================== 결제 ====================

    /**
     * 결제 승인 요청. 청구 금액은 항상 저장된 운임이며 {@code requestedAmountMinor}는
     * 감사 기록에만 남고 청구에 쓰이지 않는다.
     *
     * @return INDETERMINATE / PENDING 결과도 성공으로 돌려준다 (호출자는 같은 키로 재시도)
     */
    public LifecycleResult<ChargeResult> authorizePayment(Identity identity, String deliveryId,
                                                          String idempotencyKey, Long requestedAmountMinor) {
        if (idempotencyKey == null || idempotencyKey.isBlank()
                || idempotencyKey.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            return reject(AuditEventType.PAYMENT_REJECTED, identity, deliveryId, AUTHORIZE_PAYMENT, null,
                    RejectionKind.INVALID_REQUEST,
                    "Idempotency-Key must be 1-" + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }

        // 1단계: 예약
        LifecycleResult<Reservation> reserved = withContentionRetry(AuditEventType.PAYMENT_REJECTED,
                identity, deliveryId, AUTHORIZE_PAYMENT,
                retry -> reservePaymentKey(identity, deliveryId, idempotencyKey, requestedAmountMinor));
        if (!reserved.isSuccess() || reserved.value().replay() != null) {
            return reserved.map(Reservation::replay);
        }
        Delivery reservedDelivery = reserved.value().delivery();
        boolean adminOverride = reserved.value().adminOverride();

        // 2단계: PG 호출 (트랜잭션 밖)
        ProviderResult outcome = paymentGuard.placeCharge(reservedDelivery, idempotencyKey);

        if (outcome.outcome() == ProviderOutcome.INDETERMINATE) {
            log.error("Charge outcome unknown, reservation kept: deliveryId={}, key={}", deliveryId, idempotencyKey);
            auditor.reconciliationRequired(identity, deliveryId, idempotencyKey,
                    "charge outcome unknown", outcome.message());
            return LifecycleResult.success(new ChargeResult(deliveryId, idempotencyKey, ChargeStatus.INDETERMINATE,
                    reservedDelivery.getFareMinor(), null));
        }

        // 3단계: 확정
        LifecycleResult<ChargeResult> finalized = withContentionRetry(AuditEventType.PAYMENT_REJECTED,
                identity, deliveryId, AUTHORIZE_PAYMENT,
                retry -> finalizeCharge(identity, deliveryId, idempotencyKey, outcome, requestedAmountMinor,
                        adminOverride));
        if (!finalized.isSuccess() && finalized.rejection().kind() == RejectionKind.CONTENTION
                && outcome.outcome().isApproved()) {
            auditor.reconciliationRequired(identity, deliveryId, idempotencyKey,
                    "charge approved but not recorded", outcome.reference());
        }
        return finalized;
    }

    private LifecycleResult<Reservation> reservePaymentKey(Identity identity, String deliveryId,
                                                           String idempotencyKey, Long requestedAmountMinor)
            throws VersionConflictException {
        Optional<Delivery> loaded = recordStore.load(deliveryId);
        if (loaded.isEmpty()) {
            return reject(AuditEventType.PAYMENT_REJECTED, identity, deliveryId, AUTHORIZE_PAYMENT, null,
                    RejectionKind.NOT_FOUND, null);
        }
        Delivery delivery = loaded.get();

        // 결제는 고객 본인 또는 관리자 (break-glass, adminOverride 감사)
        AuthorizationDecision decision = ownershipGuard.authorize(identity, delivery, Relation.IS_CUSTOMER);
        if (!decision.allowed()) {
            return reject(AuditEventType.PAYMENT_REJECTED, identity, deliveryId, AUTHORIZE_PAYMENT,
                    delivery.getStatus(), toRejectionKind(decision.denyReason()), null);
        }

        PaymentCheck check = paymentGuard.evaluate(delivery, idempotencyKey);
        switch (check.verdict()) {
            case REPLAY -> {
                auditor.paymentReplayed(identity, check.replay(), decision.adminOverride());
                log.info("Payment request replayed: deliveryId={}, key={}, status={}",
                        deliveryId, idempotencyKey, check.replay().status());
                return LifecycleResult.replay(new Reservation(delivery, check.replay(), decision.adminOverride()));
            }
            case REJECT -> {
                return reject(AuditEventType.PAYMENT_REJECTED, identity, deliveryId, AUTHORIZE_PAYMENT,
                        delivery.getStatus(), toRejectionKind(check.reason()), check.detail());
            }
            default -> {
                if (requestedAmountMinor != null && requestedAmountMinor != check.amountMinor()) {
                    log.warn("Client-supplied amount ignored: deliveryId={}, requested={}",
                            deliveryId, requestedAmountMinor);
                }
                delivery.reservePaymentKey(idempotencyKey, clock.instant());
                Delivery saved = recordStore.compareAndSwap(delivery);
                log.info("Payment key reserved: deliveryId={}, key={}", deliveryId, idempotencyKey);
                return LifecycleResult.success(new Reservation(saved, null, decision.adminOverride()));
            }
        }
    }

    private LifecycleResult<ChargeResult> finalizeCharge(Identity identity, String deliveryId, String idempotencyKey,
                                                         ProviderResult outcome, Long requestedAmountMinor,
                                                         boolean adminOverride)
            throws VersionConflictException {
        Optional<Delivery> loaded = recordStore.load(deliveryId);
        if (loaded.isEmpty()) {
            auditor.reconciliationRequired(identity, deliveryId, idempotencyKey,
                    "delivery vanished after charge", outcome.reference());
            return reject(AuditEventType.PAYMENT_REJECTED, identity, deliveryId, AUTHORIZE_PAYMENT, null,
                    RejectionKind.NOT_FOUND, null);
        }
        Delivery delivery = loaded.get();
        Optional<IdempotencyRecord> record = delivery.findPaymentKey(idempotencyKey);

        // 웹훅이 먼저 확정한 경우 그 결과를 따른다
        if (record.isPresent() && record.get().getState().isResolved()) {
            return LifecycleResult.replay(paymentGuard.toChargeResult(delivery, idempotencyKey, record.get()));
        }
        if (record.isEmpty()) {
            if (outcome.outcome().isApproved()) {
                auditor.reconciliationRequired(identity, deliveryId, idempotencyKey,
                        "reservation released before approval was recorded", outcome.reference());
            }
            return LifecycleResult.success(new ChargeResult(deliveryId, idempotencyKey, ChargeStatus.INDETERMINATE,
                    delivery.getFareMinor(), outcome.reference()));
        }

        Instant now = clock.instant();
        if (outcome.outcome() == ProviderOutcome.DECLINED) {
            delivery.releasePaymentKey(idempotencyKey, now);
            recordStore.compareAndSwap(delivery);
            return reject(AuditEventType.PAYMENT_DECLINED, identity, deliveryId, AUTHORIZE_PAYMENT,
                    delivery.getStatus(), RejectionKind.PAYMENT_DECLINED, outcome.message());
        }

        IdempotencyState settled = outcome.outcome() == ProviderOutcome.CAPTURED
                ? IdempotencyState.CAPTURED : IdempotencyState.AUTHORIZED;
        ApprovalOutcome approval = applyApproval(delivery, idempotencyKey, settled, outcome.reference(), now);
        if (approval == ApprovalOutcome.REFUND_FAILED) {
            auditor.reconciliationRequired(identity, deliveryId, idempotencyKey,
                    "charge approved after cancellation and refund failed", outcome.reference());
            return LifecycleResult.success(new ChargeResult(deliveryId, idempotencyKey, ChargeStatus.INDETERMINATE,
                    delivery.getFareMinor(), outcome.reference()));
        }

        Delivery saved = recordStore.compareAndSwap(delivery);
        ChargeResult result = paymentGuard.toChargeResult(saved, idempotencyKey,
                saved.findPaymentKey(idempotencyKey).orElseThrow());
        auditor.paymentAuthorized(identity, result, requestedAmountMinor, adminOverride);
        log.info("Payment settled: deliveryId={}, key={}, status={}, amountMinor={}",
                deliveryId, idempotencyKey, result.status(), result.amountMinor());
        return LifecycleResult.success(result);
    }

    /**
     * PG 웹훅 확정. 서명 검증은 호출 전에 끝나 있어야 한다.
     * 이미 반영된 이벤트의 재전송은 변경 없이 성공으로 돌려준다.
     */
    public LifecycleResult<Delivery> confirmPayment(PaymentWebhookEvent event) {
        return withContentionRetry(AuditEventType.WEBHOOK_REJECTED, null, event.deliveryId(),
                event.type().wireName(), retry -> applyWebhook(event));
    }

    private LifecycleResult<Delivery> applyWebhook(PaymentWebhookEvent event) throws VersionConflictException {
        String deliveryId = event.deliveryId();
        String action = event.type().wireName();
        Optional<Delivery> loaded = recordStore.load(deliveryId);
        if (loaded.isEmpty()) {
            return reject(AuditEventType.WEBHOOK_REJECTED, null, deliveryId, action, null,
                    RejectionKind.NOT_FOUND, null);
        }
        Delivery delivery = loaded.get();
        DeliveryStatus status = delivery.getStatus();
        Instant now = clock.instant();

        if (event.type() == WebhookEventType.REFUNDED) {
            if (delivery.getPaymentState() == PaymentState.REFUNDED) {
                return LifecycleResult.replay(delivery);
            }
            if (!delivery.getPaymentState().holdsFunds()) {
                return reject(AuditEventType.WEBHOOK_REJECTED, null, deliveryId, action, status,
                        RejectionKind.ILLEGAL_TRANSITION, "No settled payment to refund");
            }
            delivery.markRefunded(event.providerReference(), now);
            return saveConfirmation(delivery, event);
        }

        Optional<IdempotencyRecord> record = event.idempotencyKey() == null
                ? Optional.empty() : delivery.findPaymentKey(event.idempotencyKey());
        if (record.isEmpty()) {
            return reject(AuditEventType.WEBHOOK_REJECTED, null, deliveryId, action, status,
                    RejectionKind.INVALID_REQUEST, "Unknown idempotency key");
        }
        IdempotencyState current = record.get().getState();

        if (event.type() == WebhookEventType.FAILED) {
            if (current == IdempotencyState.CAPTURED || current == IdempotencyState.REFUNDED) {
                return reject(AuditEventType.WEBHOOK_REJECTED, null, deliveryId, action, status,
                        RejectionKind.ILLEGAL_TRANSITION, "Payment already " + current);
            }
            delivery.releasePaymentKey(event.idempotencyKey(), now);
            return saveConfirmation(delivery, event);
        }

        IdempotencyState target = event.type() == WebhookEventType.CAPTURED
                ? IdempotencyState.CAPTURED : IdempotencyState.AUTHORIZED;
        if (target == IdempotencyState.CAPTURED) {
            if (event.amountMinor() == null || !paymentGuard.matchesFare(delivery, event.amountMinor())) {
                log.error("Captured amount does not match fare: deliveryId={}, captured={}, fare={}",
                        deliveryId, event.amountMinor(), delivery.getFareMinor());
                return reject(AuditEventType.WEBHOOK_REJECTED, null, deliveryId, action, status,
                        RejectionKind.FARE_MISMATCH, "captured=" + event.amountMinor() + ", fare=" + delivery.getFareMinor());
            }
            if (status == DeliveryStatus.CREATED) {
                return reject(AuditEventType.WEBHOOK_REJECTED, null, deliveryId, action, status,
                        RejectionKind.ILLEGAL_TRANSITION, "Capture before acceptance");
            }
        }

        // 재전송 또는 이미 더 진행된 키
        if (current == target || current == IdempotencyState.REFUNDED
                || (current == IdempotencyState.CAPTURED && target == IdempotencyState.AUTHORIZED)) {
            return LifecycleResult.replay(delivery);
        }

        ApprovalOutcome approval = applyApproval(delivery, event.idempotencyKey(), target,
                event.providerReference(), now);
        if (approval == ApprovalOutcome.REFUND_FAILED) {
            auditor.reconciliationRequired(null, deliveryId, event.idempotencyKey(),
                    "webhook approval after cancellation and refund failed", event.providerReference());
            return reject(AuditEventType.WEBHOOK_REJECTED, null, deliveryId, action, status,
                    RejectionKind.REFUND_FAILED, null);
        }
        return saveConfirmation(delivery, event);
    }

    private LifecycleResult<Delivery> saveConfirmation(Delivery delivery, PaymentWebhookEvent event)
            throws VersionConflictException {
        Delivery saved = recordStore.compareAndSwap(delivery);
        auditor.paymentConfirmed(saved, event);
        log.info("Payment webhook applied: deliveryId={}, event={}, paymentState={}",
                saved.getId(), event.type().wireName(), saved.getPaymentState());
        return LifecycleResult.success(saved);
    }

    /** 승인 결과 반영. 그 사이 배달이 취소됐으면 즉시 환불하고 REFUNDED로 기록한다 */
    private ApprovalOutcome applyApproval(Delivery delivery, String idempotencyKey, IdempotencyState settled,
                                          String providerReference, Instant now) {
        if (delivery.getStatus() == DeliveryStatus.CANCELLED) {
            log.warn("Charge approved after cancellation, refunding: deliveryId={}, key={}",
                    delivery.getId(), idempotencyKey);
            ProviderResult refund = paymentGuard.refund(delivery, providerReference);
            if (refund.outcome() != ProviderOutcome.REFUNDED) {
                return ApprovalOutcome.REFUND_FAILED;
            }
            delivery.settlePaymentKey(idempotencyKey, IdempotencyState.REFUNDED, refund.reference(), now);
            return ApprovalOutcome.REFUNDED_AFTER_CANCEL;
        }
        delivery.settlePaymentKey(idempotencyKey, settled, providerReference, now);
        return ApprovalOutcome.SETTLED;
    }

    // ==================== 공통 ====================

    private <T> LifecycleResult<T> withContentionRetry(AuditEventType rejectionType, Identity identity,
                                                       String deliveryId, Object action, Attempt<T> attempt) {
        try {
            return attempt.run(false);
        } catch (VersionConflictException first) {
            log.info("Version conflict, retrying once: deliveryId={}, action={}", deliveryId, action);
            try {
                return attempt.run(true);
            } catch (VersionConflictException second) {
                return reject(rejectionType, identity, deliveryId, action, null,
                        RejectionKind.CONTENTION, second.getMessage());
            }
        }
    }

    private <T> LifecycleResult<T> reject(AuditEventType type, Identity identity, String deliveryId, Object action,
                                          DeliveryStatus currentStatus, RejectionKind kind, String detail) {
        Rejection rejection = new Rejection(kind, detail);
        auditor.rejected(type, identity, deliveryId, action, currentStatus, rejection);
        log.warn("Lifecycle request rejected: deliveryId={}, action={}, actor={}, kind={}",
                deliveryId, action, identity == null ? LifecycleAuditor.PAYMENT_PROVIDER_ACTOR : identity.actorId(),
                kind);
        return LifecycleResult.rejected(kind, detail);
    }

    private RejectionKind toRejectionKind(DenyReason reason) {
        return switch (reason) {
            case NOT_OWNER -> RejectionKind.NOT_OWNER;
            case NOT_ASSIGNED -> RejectionKind.NOT_ASSIGNED;
            case ROLE_INSUFFICIENT -> RejectionKind.ROLE_INSUFFICIENT;
        };
    }

    private RejectionKind toRejectionKind(PaymentRejectReason reason) {
        return switch (reason) {
            case ILLEGAL_STATE -> RejectionKind.ILLEGAL_TRANSITION;
            case DUPLICATE_PAYMENT -> RejectionKind.DUPLICATE_PAYMENT;
            case PAYMENT_IN_PROGRESS -> RejectionKind.PAYMENT_IN_PROGRESS;
            case FARE_MISMATCH -> RejectionKind.FARE_MISMATCH;
        };
    }
}
