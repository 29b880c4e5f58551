package com.dropmatch.common.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedRateLimiterMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedRetryMetrics;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j 메트릭 설정 (Prometheus)
 *
 * <p>이 애플리케이션이 실제로 사용하는 3가지 패턴의 메트릭을 Micrometer에 바인딩한다.
 * /actuator/prometheus 에서 수집된다.</p>
 *
 * <pre>
 *   ┌──────────────────┬───────────────────────┬──────────────────────────────────────────────┐
 *   │ 패턴             │ 인스턴스              │ Prometheus 메트릭                              │
 *   ├──────────────────┼───────────────────────┼──────────────────────────────────────────────┤
 *   │ Retry            │ recordStoreRead       │ resilience4j_retry_calls_total               │
 *   │ Rate Limiter     │ deliveryApi/paymentApi│ resilience4j_ratelimiter_available_permissions│
 *   │ Circuit Breaker  │ paymentProvider       │ resilience4j_circuitbreaker_state            │
 *   └──────────────────┴───────────────────────┴──────────────────────────────────────────────┘
 * </pre>
 *
 * <p>recordStoreRead 재시도 횟수가 늘면 레코드 저장소 쪽 장애를, paymentProvider 서킷이 열리면
 * PG 장애를 의심한다. 쓰기는 재시도 대상이 아니므로 쓰기 관련 Retry 메트릭은 없다.</p>
 */
@Configuration
public class ResilienceMetricsConfig {

    public ResilienceMetricsConfig(
            MeterRegistry meterRegistry,
            CircuitBreakerRegistry circuitBreakerRegistry,
            RetryRegistry retryRegistry,
            @SuppressWarnings("SpringJavaInjectionPointsAutowiringInspection")
            RateLimiterRegistry rateLimiterRegistry) {

        TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(circuitBreakerRegistry)
                .bindTo(meterRegistry);
        TaggedRetryMetrics.ofRetryRegistry(retryRegistry)
                .bindTo(meterRegistry);
        TaggedRateLimiterMetrics.ofRateLimiterRegistry(rateLimiterRegistry)
                .bindTo(meterRegistry);
    }
}
