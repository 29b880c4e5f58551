package com.dropmatch.audit;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditRecordRepository extends JpaRepository<AuditRecord, String> {

    List<AuditRecord> findByDeliveryIdOrderByOccurredAtAsc(String deliveryId);
}
