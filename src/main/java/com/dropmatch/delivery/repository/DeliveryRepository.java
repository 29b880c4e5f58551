package com.dropmatch.delivery.repository;

import com.dropmatch.delivery.entity.Delivery;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * 배달 리포지토리. 엔진은 이 인터페이스를 직접 쓰지 않고 {@link DeliveryRecordStore}를 거친다.
 */
public interface DeliveryRepository extends JpaRepository<Delivery, String> {
}
