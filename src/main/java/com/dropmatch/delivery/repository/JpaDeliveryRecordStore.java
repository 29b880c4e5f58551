package com.dropmatch.delivery.repository;

import com.dropmatch.delivery.entity.Delivery;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * JPA @Version 기반 레코드 저장소.
 *
 * <h3>★ CAS 쓰기 동작</h3>
 * <pre>
 *   compareAndSwap(detached delivery, version=v)
 *     → 짧은 트랜잭션에서 merge + flush
 *     → Hibernate: 저장된 버전 != v 이면 StaleObjectStateException
 *     → UPDATE deliveries SET ..., version = v + 1 WHERE id = ? AND version = v
 *     → 0 rows 이면 StaleObjectStateException
 *   Spring이 OptimisticLockingFailureException으로 변환 → VersionConflictException
 * </pre>
 *
 * <p>트랜잭션은 쓰기 한 번 동안만 열린다. PG 호출 같은 I/O 구간에 행 락을 잡지 않는다.</p>
 *
 * <p>읽기만 Resilience4j {@code @Retry(recordStoreRead)}로 재시도한다. 쓰기는 버전 충돌 외에는
 * 재시도하지 않는다 (중복 적용 방지).</p>
 */
@Slf4j
@Component
public class JpaDeliveryRecordStore implements DeliveryRecordStore {

    private final DeliveryRepository deliveryRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaDeliveryRecordStore(DeliveryRepository deliveryRepository,
                                  PlatformTransactionManager transactionManager) {
        this.deliveryRepository = deliveryRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    @Retry(name = "recordStoreRead")
    public Optional<Delivery> load(String deliveryId) {
        return deliveryRepository.findById(deliveryId);
    }

    @Override
    public Delivery insert(Delivery delivery) {
        return transactionTemplate.execute(status -> deliveryRepository.saveAndFlush(delivery));
    }

    @Override
    public Delivery compareAndSwap(Delivery delivery) throws VersionConflictException {
        long expectedVersion = delivery.currentVersion();
        try {
            return transactionTemplate.execute(status -> deliveryRepository.saveAndFlush(delivery));
        } catch (OptimisticLockingFailureException e) {
            log.debug("CAS rejected: deliveryId={}, expectedVersion={}", delivery.getId(), expectedVersion);
            throw new VersionConflictException(delivery.getId(), expectedVersion, e);
        }
    }
}
