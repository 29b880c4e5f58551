package com.dropmatch.fare;

/**
 * 거리/소요 시간 추정 경계. 같은 입력에는 항상 같은 결과를 돌려줘야 한다
 * (결제 시점의 요금 재계산이 생성 시점 요금과 일치해야 하므로).
 */
public interface RouteEstimator {

    RouteEstimate estimate(Location pickup, Location dropoff);
}
