package com.dropmatch.delivery.repository;

import com.dropmatch.delivery.entity.Delivery;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 테스트용 CAS 저장소. 행을 JSON 문자열로 보관해 호출자마다 완전히 분리된 복사본을 돌려준다.
 * 버전 비교와 교체는 하나의 락 안에서 일어나므로 실제 스레드로 경합을 재현할 수 있다.
 */
public class InMemoryDeliveryRecordStore implements DeliveryRecordStore {

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE)
            .setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE)
            .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Map<String, String> rows = new ConcurrentHashMap<>();
    private final AtomicInteger successfulWrites = new AtomicInteger();
    private final AtomicInteger conflicts = new AtomicInteger();
    private volatile Consumer<Delivery> beforeCompareAndSwap = delivery -> { };

    @Override
    public Optional<Delivery> load(String deliveryId) {
        return Optional.ofNullable(rows.get(deliveryId)).map(this::read);
    }

    @Override
    public Delivery insert(Delivery delivery) {
        ObjectNode node = mapper.valueToTree(delivery);
        node.put("version", 0L);
        if (rows.putIfAbsent(delivery.getId(), node.toString()) != null) {
            throw new IllegalStateException("Duplicate id " + delivery.getId());
        }
        return read(node.toString());
    }

    @Override
    public Delivery compareAndSwap(Delivery delivery) throws VersionConflictException {
        beforeCompareAndSwap.accept(delivery);
        long expected = delivery.currentVersion();
        ObjectNode node = mapper.valueToTree(delivery);
        node.put("version", expected + 1);
        String next = node.toString();

        synchronized (this) {
            String current = rows.get(delivery.getId());
            if (current == null || read(current).currentVersion() != expected) {
                conflicts.incrementAndGet();
                throw new VersionConflictException(delivery.getId(), expected, null);
            }
            rows.put(delivery.getId(), next);
        }
        successfulWrites.incrementAndGet();
        return read(next);
    }

    /** CAS 직전에 실행할 훅 (경합 재현용) */
    public void beforeCompareAndSwap(Consumer<Delivery> hook) {
        this.beforeCompareAndSwap = hook;
    }

    /** 다른 요청이 먼저 쓴 것처럼 레코드를 직접 바꾼다 */
    public void overwrite(Delivery delivery) {
        ObjectNode node = mapper.valueToTree(delivery);
        node.put("version", delivery.currentVersion() + 1);
        rows.put(delivery.getId(), node.toString());
    }

    public int successfulWrites() {
        return successfulWrites.get();
    }

    public int conflicts() {
        return conflicts.get();
    }

    private Delivery read(String json) {
        try {
            return mapper.readValue(json, Delivery.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }
}
