package com.dropmatch.delivery.dto;

import com.dropmatch.delivery.entity.Delivery;
import com.dropmatch.delivery.entity.DeliveryAction;
import com.dropmatch.delivery.entity.DeliveryStatus;
import com.dropmatch.delivery.entity.PaymentState;
import com.dropmatch.delivery.entity.TransitionLogEntry;
import com.dropmatch.fare.Location;
import com.dropmatch.fare.VehicleClass;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * 배달 응답. 멱등성 키 목록은 내보내지 않는다.
 *
 * @param availableActions 현재 상태에서 정의된 동작 (역할/소유권 판단 전)
 */
public record DeliveryResponse(
        String id,
        DeliveryStatus status,
        String customerId,
        String driverId,
        Location pickup,
        Location dropoff,
        VehicleClass vehicleClass,
        long fareMinor,
        long distanceMeters,
        long durationSeconds,
        PaymentState paymentState,
        String cancellationReason,
        long version,
        Instant createdAt,
        List<Transition> transitions,
        Set<DeliveryAction> availableActions
) {

    public record Transition(DeliveryStatus from, DeliveryStatus to, DeliveryAction action,
                             String actorId, Instant at, long version) {

        static Transition from(TransitionLogEntry entry) {
            return new Transition(entry.getFromStatus(), entry.getToStatus(), entry.getAction(),
                    entry.getActorId(), entry.getOccurredAt(), entry.getVersion());
        }
    }

    public static DeliveryResponse from(Delivery delivery, Set<DeliveryAction> availableActions) {
        return new DeliveryResponse(
                delivery.getId(),
                delivery.getStatus(),
                delivery.getCustomerId(),
                delivery.getDriverId(),
                delivery.getPickup(),
                delivery.getDropoff(),
                delivery.getVehicleClass(),
                delivery.getFareMinor(),
                delivery.getDistanceMeters(),
                delivery.getDurationSeconds(),
                delivery.getPaymentState(),
                delivery.getCancellationReason(),
                delivery.currentVersion(),
                delivery.getCreatedAt(),
                delivery.getTransitionLog().stream().map(Transition::from).toList(),
                availableActions);
    }
}
