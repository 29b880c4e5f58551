package com.dropmatch.delivery;

import com.dropmatch.delivery.entity.Delivery;
import com.dropmatch.delivery.entity.DeliveryAction;
import com.dropmatch.delivery.entity.DeliveryStatus;
import com.dropmatch.fare.FareBreakdown;
import com.dropmatch.fare.Location;
import com.dropmatch.fare.VehicleClass;

import java.time.Instant;
import java.util.UUID;

public final class DeliveryFixtures {

    public static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    /** 기본 50 + 거리 51 + 수수료 8 = 109 */
    public static final FareBreakdown FARE_109 = new FareBreakdown(50, 51, 0, 8, 109, 101, 5_100, 900);

    public static final Location PICKUP = new Location(12.9716, 77.5946, "MG Road");
    public static final Location DROPOFF = new Location(12.9352, 77.6245, "Koramangala");

    private DeliveryFixtures() {
    }

    public static Delivery created(String customerId) {
        return Delivery.create(UUID.randomUUID().toString(), customerId, PICKUP, DROPOFF,
                VehicleClass.BIKE, FARE_109, NOW);
    }

    public static Delivery accepted(String customerId, String driverId) {
        Delivery delivery = created(customerId);
        delivery.applyTransition(DeliveryAction.ACCEPT, DeliveryStatus.ACCEPTED, driverId, false, NOW);
        return delivery;
    }
}
