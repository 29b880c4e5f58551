package com.dropmatch.fare;

/**
 * 요금 산정 내역. 모든 금액은 정수 최소 화폐 단위(minor units)이며 부동소수점을 쓰지 않는다.
 *
 * @param baseFareMinor           차종별 기본 요금
 * @param distanceCostMinor       거리 요금 (km당 요금 × 거리)
 * @param fuelAdjustmentMinor     유류 할증
 * @param platformCommissionMinor 플랫폼 수수료 (기본+거리 요금의 일정 비율)
 * @param totalMinor              고객 청구 금액 = 위 4개 합계
 * @param driverEarningsMinor     기사 정산 금액 = total - commission
 * @param distanceMeters          산정에 쓰인 거리
 * @param durationSeconds         산정에 쓰인 예상 소요 시간
 */
public record FareBreakdown(
        long baseFareMinor,
        long distanceCostMinor,
        long fuelAdjustmentMinor,
        long platformCommissionMinor,
        long totalMinor,
        long driverEarningsMinor,
        long distanceMeters,
        long durationSeconds
) {
}
