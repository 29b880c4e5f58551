package com.dropmatch.payment.service;

import java.util.Arrays;
import java.util.Optional;

/** PG 웹훅 이벤트 종류와 와이어 이름 */
public enum WebhookEventType {
    AUTHORIZED("payment.authorized"),
    CAPTURED("payment.captured"),
    FAILED("payment.failed"),
    REFUNDED("payment.refunded");

    private final String wireName;

    WebhookEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<WebhookEventType> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(name))
                .findFirst();
    }
}
