package com.dropmatch.fare;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 요금표 기반 계산기.
 *
 * <pre>
 * distanceCost = perKm × meters / 1000          (반올림)
 * fuel         = fuelPerKm × meters / 1000      (반올림)
 * commission   = (base + distanceCost) × bp / 10000   (반올림)
 * total        = base + distanceCost + fuel + commission
 * driver       = total - commission
 * </pre>
 *
 * <p>정수 연산만 사용하므로 같은 경로/차종이면 언제 계산해도 같은 값이 나온다.
 * 결제 시점의 변조 검사가 이 성질에 의존한다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TariffFareCalculator implements FareCalculator {

    private final RouteEstimator routeEstimator;
    private final FareProperties fareProperties;

    @Override
    public FareBreakdown compute(Location pickup, Location dropoff, VehicleClass vehicleClass) {
        RouteEstimate route = routeEstimator.estimate(pickup, dropoff);
        FareProperties.Tariff tariff = fareProperties.tariffFor(vehicleClass);

        long meters = route.distanceMeters();
        long base = tariff.baseFareMinor();
        long distanceCost = perKm(tariff.perKmMinor(), meters);
        long fuel = perKm(fareProperties.fuelAdjustmentPerKmMinor(), meters);
        long commission = roundedDivide((base + distanceCost) * fareProperties.commissionBasisPoints(), 10_000);
        long total = base + distanceCost + fuel + commission;

        log.debug("Fare computed: vehicleClass={}, meters={}, total={}", vehicleClass, meters, total);
        return new FareBreakdown(base, distanceCost, fuel, commission, total,
                total - commission, meters, route.durationSeconds());
    }

    private long perKm(long ratePerKm, long meters) {
        return roundedDivide(ratePerKm * meters, 1000);
    }

    // half-up, 음수 입력 없음
    private long roundedDivide(long numerator, long denominator) {
        return (numerator + denominator / 2) / denominator;
    }
}
