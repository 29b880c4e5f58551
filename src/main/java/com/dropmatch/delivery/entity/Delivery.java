package com.dropmatch.delivery.entity;

import com.dropmatch.fare.FareBreakdown;
import com.dropmatch.fare.Location;
import com.dropmatch.fare.VehicleClass;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 배달(Delivery) 엔티티 - 배달 생명주기와 결제 무결성의 기준 레코드.
 *
 * <h3>핵심 필드 설명</h3>
 * <ul>
 *   <li>{@code status} - CREATED → ACCEPTED → PICKED_UP → IN_TRANSIT → DELIVERED, 또는 CANCELLED</li>
 *   <li>{@code customerId}, {@code driverId} - 소유권 판단 기준. driverId는 ACCEPTED 전까지 null</li>
 *   <li>{@code fareMinor} - 생성 시 서버가 계산한 운임. {@code updatable = false}로 이후 변경 불가</li>
 *   <li>{@code idempotencyKeys} - 결제 요청 멱등성 키별 결과 (금액 + 시각)</li>
 *   <li>{@code version} - JPA Optimistic Lock (@Version). compare-and-swap 토큰</li>
 *   <li>{@code transitionLog} - append-only 전이 이력</li>
 * </ul>
 *
 * <h3>★ 상태 변경 규칙</h3>
 * <p>이 클래스에는 "상태를 X로 설정"하는 메서드가 없다. {@link #applyTransition}은 상태 머신이
 * 이미 허가한 (동작, 다음 상태) 쌍만 받고, 결제 상태는 멱등성 키 단위의 메서드로만 바뀐다.
 * 변경은 분리된(detached) 복사본에 적용된 뒤 레코드 저장소의 CAS 쓰기로 반영된다.</p>
 */
@Entity
@Table(name = "deliveries", indexes = {
        @Index(name = "idx_delivery_status", columnList = "status"),
        @Index(name = "idx_delivery_customer", columnList = "customerId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Delivery {

    @Id
    @Column(length = 36, updatable = false)
    private String id;

    @Version
    private Long version;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DeliveryStatus status;

    @Column(nullable = false, updatable = false)
    private String customerId;

    private String driverId;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "latitude", column = @Column(name = "pickup_latitude", nullable = false, updatable = false)),
            @AttributeOverride(name = "longitude", column = @Column(name = "pickup_longitude", nullable = false, updatable = false)),
            @AttributeOverride(name = "address", column = @Column(name = "pickup_address", updatable = false))
    })
    private Location pickup;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "latitude", column = @Column(name = "dropoff_latitude", nullable = false, updatable = false)),
            @AttributeOverride(name = "longitude", column = @Column(name = "dropoff_longitude", nullable = false, updatable = false)),
            @AttributeOverride(name = "address", column = @Column(name = "dropoff_address", updatable = false))
    })
    private Location dropoff;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private VehicleClass vehicleClass;

    @Column(nullable = false, updatable = false)
    private long fareMinor;

    @Column(nullable = false, updatable = false)
    private long driverEarningsMinor;

    @Column(nullable = false, updatable = false)
    private long distanceMeters;

    @Column(nullable = false, updatable = false)
    private long durationSeconds;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentState paymentState;

    private String paymentReference;  // PG 거래 번호

    private String cancellationReason;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "delivery_idempotency_keys", joinColumns = @JoinColumn(name = "delivery_id"))
    @MapKeyColumn(name = "idempotency_key")
    private Map<String, IdempotencyRecord> idempotencyKeys = new HashMap<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "delivery_transition_log", joinColumns = @JoinColumn(name = "delivery_id"))
    @OrderColumn(name = "seq")
    private List<TransitionLogEntry> transitionLog = new ArrayList<>();

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    private Delivery(String id, String customerId, Location pickup, Location dropoff,
                     VehicleClass vehicleClass, FareBreakdown fare, Instant now) {
        this.id = Objects.requireNonNull(id, "id");
        this.customerId = Objects.requireNonNull(customerId, "customerId");
        this.pickup = Objects.requireNonNull(pickup, "pickup");
        this.dropoff = Objects.requireNonNull(dropoff, "dropoff");
        this.vehicleClass = Objects.requireNonNull(vehicleClass, "vehicleClass");
        this.fareMinor = fare.totalMinor();
        this.driverEarningsMinor = fare.driverEarningsMinor();
        this.distanceMeters = fare.distanceMeters();
        this.durationSeconds = fare.durationSeconds();
        this.status = DeliveryStatus.CREATED;
        this.paymentState = PaymentState.UNPAID;
        this.createdAt = now;
        this.updatedAt = now;
    }

    /** 고객 요청으로 생성. 운임은 FareCalculator 결과에서만 온다 */
    public static Delivery create(String id, String customerId, Location pickup, Location dropoff,
                                  VehicleClass vehicleClass, FareBreakdown fare, Instant now) {
        return new Delivery(id, customerId, pickup, dropoff, vehicleClass, fare, now);
    }

    /** 저장소가 돌려준 버전 (insert 전이면 0) */
    public long currentVersion() {
        return version == null ? 0L : version;
    }

    public boolean isCustomer(String actorId) {
        return customerId.equals(actorId);
    }

    public boolean isAssignedDriver(String actorId) {
        return driverId != null && driverId.equals(actorId);
    }

    public Map<String, IdempotencyRecord> getIdempotencyKeys() {
        return Collections.unmodifiableMap(idempotencyKeys);
    }

    public List<TransitionLogEntry> getTransitionLog() {
        return Collections.unmodifiableList(transitionLog);
    }

    // ==================== 생명주기 전이 ====================

    /**
     * 상태 머신이 허가한 전이를 적용한다. ACCEPT는 행위자를 배정 기사로 기록한다.
     * 로그 항목의 버전은 이 변경을 싣고 갈 CAS 쓰기의 결과 버전이다.
     */
    public void applyTransition(DeliveryAction action, DeliveryStatus next, String actorId,
                                boolean adminOverride, Instant now) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Delivery " + id + " is already " + status);
        }
        if (action == DeliveryAction.ACCEPT) {
            this.driverId = actorId;
        }
        transitionLog.add(new TransitionLogEntry(status, next, action, actorId, adminOverride, now,
                currentVersion() + 1));
        this.status = next;
        this.updatedAt = now;
    }

    public void recordCancellationReason(String reason) {
        this.cancellationReason = reason;
    }

    // ==================== 결제 / 멱등성 ====================

    public Optional<IdempotencyRecord> findPaymentKey(String idempotencyKey) {
        return Optional.ofNullable(idempotencyKeys.get(idempotencyKey));
    }

    /** 아직 PG 결과가 확정되지 않은 예약 키 */
    public Optional<String> pendingPaymentKey() {
        return idempotencyKeys.entrySet().stream()
                .filter(entry -> entry.getValue().getState() == IdempotencyState.PENDING)
                .map(Map.Entry::getKey)
                .findFirst();
    }

    /** PG 호출 전에 키를 예약한다. 금액은 항상 저장된 운임 */
    public void reservePaymentKey(String idempotencyKey, Instant now) {
        if (idempotencyKeys.containsKey(idempotencyKey)) {
            throw new IllegalStateException("Idempotency key already recorded: " + idempotencyKey);
        }
        idempotencyKeys.put(idempotencyKey, IdempotencyRecord.pending(fareMinor, now));
        this.updatedAt = now;
    }

    /**
     * 키의 PG 결과를 확정하고 결제 상태를 함께 옮긴다.
     *
     * @throws IllegalStateException 결제 상태 전이가 불가능하거나 ACCEPTED 이전에 CAPTURED를 기록하려는 경우
     */
    public void settlePaymentKey(String idempotencyKey, IdempotencyState result, String providerReference,
                                 Instant now) {
        IdempotencyRecord record = idempotencyKeys.get(idempotencyKey);
        if (record == null) {
            throw new IllegalStateException("Unknown idempotency key: " + idempotencyKey);
        }
        PaymentState target = switch (result) {
            case AUTHORIZED -> PaymentState.AUTHORIZED;
            case CAPTURED -> PaymentState.CAPTURED;
            case REFUNDED -> PaymentState.REFUNDED;
            case PENDING -> throw new IllegalArgumentException("PENDING is not a settled result");
        };
        // 취소 후 도착한 승인은 곧바로 환불되어 REFUNDED로 기록되므로 UNPAID에서도 허용
        if (target == PaymentState.REFUNDED && paymentState == PaymentState.UNPAID) {
            record.resolve(result, providerReference, now);
            this.paymentState = PaymentState.REFUNDED;
            this.updatedAt = now;
            return;
        }
        if (target == PaymentState.CAPTURED && !status.isAtOrBeyond(DeliveryStatus.ACCEPTED)) {
            throw new IllegalStateException("Cannot capture delivery " + id + " in status " + status);
        }
        movePaymentState(target);
        record.resolve(result, providerReference, now);
        if (providerReference != null) {
            this.paymentReference = providerReference;
        }
        this.updatedAt = now;
    }

    /**
     * PG가 결제를 하지 않았다고 확정 응답한 키의 예약을 되돌린다.
     * 이미 승인된 키였다면 결제 상태도 UNPAID로 돌아간다 (PG 측 실패 통보).
     */
    public void releasePaymentKey(String idempotencyKey, Instant now) {
        IdempotencyRecord removed = idempotencyKeys.remove(idempotencyKey);
        if (removed == null) {
            return;
        }
        if (removed.getState() == IdempotencyState.AUTHORIZED && paymentState == PaymentState.AUTHORIZED) {
            movePaymentState(PaymentState.UNPAID);
            this.paymentReference = null;
        }
        this.updatedAt = now;
    }

    /** 환불 완료. 승인/매입된 모든 키가 REFUNDED가 된다 */
    public void markRefunded(String refundReference, Instant now) {
        movePaymentState(PaymentState.REFUNDED);
        idempotencyKeys.values().stream()
                .filter(record -> record.getState() == IdempotencyState.AUTHORIZED
                        || record.getState() == IdempotencyState.CAPTURED)
                .forEach(record -> record.resolve(IdempotencyState.REFUNDED, null, now));
        if (refundReference != null) {
            this.paymentReference = refundReference;
        }
        this.updatedAt = now;
    }

    private void movePaymentState(PaymentState next) {
        if (paymentState == next) {
            return;
        }
        if (!paymentState.canMoveTo(next)) {
            throw new IllegalStateException("Payment state " + paymentState + " cannot move to " + next);
        }
        this.paymentState = next;
    }
}
