package com.dropmatch.fare;

/**
 * 요금 계산기. 순수 함수여야 하며, 금액이 걸린 경로에서는 라이프사이클 엔진만 호출한다.
 */
public interface FareCalculator {

    FareBreakdown compute(Location pickup, Location dropoff, VehicleClass vehicleClass);
}
