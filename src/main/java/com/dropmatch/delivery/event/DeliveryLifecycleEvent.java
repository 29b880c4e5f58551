package com.dropmatch.delivery.event;

import com.dropmatch.common.security.Role;
import com.dropmatch.delivery.entity.DeliveryAction;
import com.dropmatch.delivery.entity.DeliveryStatus;

import java.time.Instant;

/**
 * 수락된 전이마다 하나씩 발행되는 불변 이벤트.
 *
 * @param version 전이가 기록된 레코드 버전
 */
public record DeliveryLifecycleEvent(
        String deliveryId,
        DeliveryAction action,
        DeliveryStatus fromStatus,
        DeliveryStatus toStatus,
        String actorId,
        Role actorRole,
        long version,
        boolean adminOverride,
        Instant occurredAt
) {
}
