package com.dropmatch.fare;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 대권 거리(Haversine) 기반 추정기. 외부 지도 API 없이 동작하는 기본 구현이며,
 * 소요 시간은 km당 고정 분(minutes-per-km)으로 환산한다.
 */
@Component
@RequiredArgsConstructor
public class HaversineRouteEstimator implements RouteEstimator {

    private static final double EARTH_RADIUS_METERS = 6_371_000d;

    private final FareProperties fareProperties;

    @Override
    public RouteEstimate estimate(Location pickup, Location dropoff) {
        double dLat = Math.toRadians(dropoff.getLatitude() - pickup.getLatitude());
        double dLng = Math.toRadians(dropoff.getLongitude() - pickup.getLongitude());
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(pickup.getLatitude()))
                * Math.cos(Math.toRadians(dropoff.getLatitude()))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        long meters = Math.round(EARTH_RADIUS_METERS * c);

        // 1km 미만도 최소 1분으로 올림
        long seconds = (long) Math.ceil(meters / 1000d * fareProperties.minutesPerKm()) * 60;
        return new RouteEstimate(meters, seconds);
    }
}
