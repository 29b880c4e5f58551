package com.dropmatch.fare;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

/**
 * 요금표 설정 ({@code dropmatch.fare.*}).
 *
 * <pre>
 * dropmatch:
 *   fare:
 *     tariffs:
 *       BIKE: { base-fare-minor: 2000, per-km-minor: 800 }
 *     fuel-adjustment-per-km-minor: 200
 *     commission-basis-points: 1000   # 10%
 *     minutes-per-km: 3
 * </pre>
 */
@ConfigurationProperties(prefix = "dropmatch.fare")
public record FareProperties(
        Map<VehicleClass, Tariff> tariffs,
        long fuelAdjustmentPerKmMinor,
        long commissionBasisPoints,
        int minutesPerKm
) {

    public record Tariff(long baseFareMinor, long perKmMinor) {
    }

    public Tariff tariffFor(VehicleClass vehicleClass) {
        Tariff tariff = tariffs == null ? null : tariffs.get(vehicleClass);
        if (tariff == null) {
            throw new IllegalStateException("No tariff configured for vehicle class " + vehicleClass);
        }
        return tariff;
    }
}
