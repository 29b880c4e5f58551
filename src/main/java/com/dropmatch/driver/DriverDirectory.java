package com.dropmatch.driver;

/**
 * 기사 가용성 조회. 배차 수락 시 "현재 운행 가능한 기사인가"를 판단하는 외부 협력자.
 */
public interface DriverDirectory {

    boolean isAvailable(String driverId);

    void goOnline(String driverId, double latitude, double longitude);

    void goOffline(String driverId);
}
