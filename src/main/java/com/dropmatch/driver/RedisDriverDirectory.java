package com.dropmatch.driver;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.geo.Point;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Redis GEO 기반 기사 가용성 저장소.
 *
 * <pre>
 *   온라인:   GEOADD drivers:location {lng} {lat} {driverId}
 *   오프라인: ZREM   drivers:location {driverId}
 *   가용성:   GEOPOS drivers:location {driverId}  → 좌표가 있으면 운행 가능
 * </pre>
 *
 * <p>Redis 장애 시 가용성 조회는 false로 처리한다 (확인할 수 없는 기사에게 배차하지 않음).</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisDriverDirectory implements DriverDirectory {

    static final String DRIVER_GEO_KEY = "drivers:location";

    private final StringRedisTemplate redisTemplate;

    @Override
    public boolean isAvailable(String driverId) {
        try {
            List<Point> positions = redisTemplate.opsForGeo().position(DRIVER_GEO_KEY, driverId);
            return positions != null && !positions.isEmpty() && positions.get(0) != null;
        } catch (DataAccessException e) {
            log.warn("Driver availability lookup failed, treating as unavailable: driverId={}", driverId, e);
            return false;
        }
    }

    @Override
    public void goOnline(String driverId, double latitude, double longitude) {
        // Redis GEO 좌표 순서는 (경도, 위도)
        redisTemplate.opsForGeo().add(DRIVER_GEO_KEY, new Point(longitude, latitude), driverId);
        log.debug("Driver {} online at ({}, {})", driverId, latitude, longitude);
    }

    @Override
    public void goOffline(String driverId) {
        redisTemplate.opsForGeo().remove(DRIVER_GEO_KEY, driverId);
        log.debug("Driver {} offline", driverId);
    }
}
