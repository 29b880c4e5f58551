package com.dropmatch.driver;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.geo.Point;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.GeoOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RedisDriverDirectoryTest {

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private GeoOperations<String, String> geoOperations;

    @InjectMocks
    private RedisDriverDirectory driverDirectory;

    @BeforeEach
    void setUp() {
        given(redisTemplate.opsForGeo()).willReturn(geoOperations);
    }

    @Test
    @DisplayName("GEO 좌표가 있는 기사만 운행 가능")
    void availableWhenPositioned() {
        given(geoOperations.position(RedisDriverDirectory.DRIVER_GEO_KEY, "drv-1"))
                .willReturn(List.of(new Point(77.59, 12.97)));
        given(geoOperations.position(RedisDriverDirectory.DRIVER_GEO_KEY, "drv-2"))
                .willReturn(Collections.singletonList(null));

        assertThat(driverDirectory.isAvailable("drv-1")).isTrue();
        assertThat(driverDirectory.isAvailable("drv-2")).isFalse();
    }

    @Test
    @DisplayName("Redis 장애 시 운행 불가로 처리")
    void failsClosedOnRedisError() {
        given(geoOperations.position(RedisDriverDirectory.DRIVER_GEO_KEY, "drv-1"))
                .willThrow(new RedisConnectionFailureException("connection refused"));

        assertThat(driverDirectory.isAvailable("drv-1")).isFalse();
    }

    @Test
    @DisplayName("온라인 등록은 (경도, 위도) 순서로 GEOADD")
    void goOnlineUsesLongitudeFirst() {
        driverDirectory.goOnline("drv-1", 12.97, 77.59);

        verify(geoOperations).add(RedisDriverDirectory.DRIVER_GEO_KEY, new Point(77.59, 12.97), "drv-1");
    }
}
