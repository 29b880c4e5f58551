package com.dropmatch.delivery.repository;

import com.dropmatch.delivery.entity.Delivery;

import java.util.Optional;

/**
 * 배달 레코드 저장소 - 단일 행 compare-and-swap 쓰기만 제공한다.
 *
 * <p>반환되는 레코드는 모두 분리된 복사본이다. 호출자는 복사본을 수정한 뒤
 * {@link #compareAndSwap}으로 저장하며, 그 사이 다른 쓰기가 있었으면 실패한다.</p>
 */
public interface DeliveryRecordStore {

    Optional<Delivery> load(String deliveryId);

    /** 새 레코드 저장. 저장 후 버전은 0 */
    Delivery insert(Delivery delivery);

    /**
     * {@code delivery}가 읽힌 버전({@link Delivery#currentVersion()})이 저장된 버전과 같을 때만 쓴다.
     *
     * @return 버전이 1 증가한 저장 결과
     * @throws VersionConflictException 그 사이 다른 쓰기가 버전을 올린 경우
     */
    Delivery compareAndSwap(Delivery delivery) throws VersionConflictException;
}
