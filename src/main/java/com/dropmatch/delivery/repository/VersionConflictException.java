package com.dropmatch.delivery.repository;

import lombok.Getter;

/**
 * CAS 쓰기 시 저장된 버전이 읽은 버전과 달랐음을 뜻한다.
 * checked 예외라서 쓰기 경로마다 재시도 여부를 명시적으로 결정해야 한다.
 */
@Getter
public class VersionConflictException extends Exception {

    private final String deliveryId;
    private final long expectedVersion;

    public VersionConflictException(String deliveryId, long expectedVersion, Throwable cause) {
        super("Version conflict on delivery " + deliveryId + " (expected version " + expectedVersion + ")", cause);
        this.deliveryId = deliveryId;
        this.expectedVersion = expectedVersion;
    }
}
