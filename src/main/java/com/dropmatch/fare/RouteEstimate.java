package com.dropmatch.fare;

/**
 * 경로 추정 결과.
 *
 * @param distanceMeters  추정 거리 (m)
 * @param durationSeconds 추정 소요 시간 (초)
 */
public record RouteEstimate(long distanceMeters, long durationSeconds) {
}
