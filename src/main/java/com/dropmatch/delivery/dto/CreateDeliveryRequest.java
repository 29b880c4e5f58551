package com.dropmatch.delivery.dto;

import com.dropmatch.fare.VehicleClass;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * 배달 생성 요청. 운임/상태/고객 ID 필드는 없다 (본문에 실려 와도 무시된다).
 */
public record CreateDeliveryRequest(
        @NotNull @Valid LocationRequest pickup,
        @NotNull @Valid LocationRequest dropoff,
        @NotNull VehicleClass vehicleClass
) {
}
