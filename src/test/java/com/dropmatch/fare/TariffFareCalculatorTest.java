package com.dropmatch.fare;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TariffFareCalculatorTest {

    private static final Location A = new Location(12.97, 77.59, "A");
    private static final Location B = new Location(12.93, 77.62, "B");

    private final FareProperties properties = new FareProperties(
            Map.of(VehicleClass.BIKE, new FareProperties.Tariff(2000, 800),
                    VehicleClass.MINI_TRUCK, new FareProperties.Tariff(5000, 1500)),
            200, 1000, 3);

    private TariffFareCalculator calculatorFor(long meters) {
        RouteEstimator fixedRoute = (pickup, dropoff) -> new RouteEstimate(meters, 900);
        return new TariffFareCalculator(fixedRoute, properties);
    }

    @Test
    @DisplayName("5km 오토바이 - 기본 2000 + 거리 4000 + 유류 1000 + 수수료 600")
    void computesBreakdown() {
        FareBreakdown fare = calculatorFor(5_000).compute(A, B, VehicleClass.BIKE);

        assertThat(fare.baseFareMinor()).isEqualTo(2000);
        assertThat(fare.distanceCostMinor()).isEqualTo(4000);
        assertThat(fare.fuelAdjustmentMinor()).isEqualTo(1000);
        assertThat(fare.platformCommissionMinor()).isEqualTo(600);
        assertThat(fare.totalMinor()).isEqualTo(7600);
        assertThat(fare.driverEarningsMinor()).isEqualTo(7000);
        assertThat(fare.distanceMeters()).isEqualTo(5_000);
    }

    @Test
    @DisplayName("정수 반올림 - 1234m")
    void roundsHalfUp() {
        FareBreakdown fare = calculatorFor(1_234).compute(A, B, VehicleClass.BIKE);

        assertThat(fare.distanceCostMinor()).isEqualTo(987);
        assertThat(fare.fuelAdjustmentMinor()).isEqualTo(247);
        assertThat(fare.platformCommissionMinor()).isEqualTo(299);
        assertThat(fare.totalMinor()).isEqualTo(3533);
    }

    @Test
    @DisplayName("같은 입력이면 언제나 같은 운임 (변조 검사 전제)")
    void deterministic() {
        TariffFareCalculator calculator = calculatorFor(7_777);

        assertThat(calculator.compute(A, B, VehicleClass.MINI_TRUCK))
                .isEqualTo(calculator.compute(A, B, VehicleClass.MINI_TRUCK));
    }

    @Test
    @DisplayName("요금표에 없는 차종은 설정 오류")
    void missingTariff() {
        assertThatThrownBy(() -> calculatorFor(1_000).compute(A, B, VehicleClass.PICKUP))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("PICKUP");
    }

    @Test
    @DisplayName("Haversine - 적도 위 경도 1도는 약 111km, km당 3분")
    void haversineEstimate() {
        HaversineRouteEstimator estimator = new HaversineRouteEstimator(properties);

        RouteEstimate route = estimator.estimate(new Location(0, 0, null), new Location(0, 1, null));

        assertThat(route.distanceMeters()).isBetween(111_000L, 111_400L);
        assertThat(route.durationSeconds()).isEqualTo(334 * 60);
        assertThat(estimator.estimate(A, A).distanceMeters()).isZero();
    }
}
