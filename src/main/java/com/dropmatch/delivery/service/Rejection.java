package com.dropmatch.delivery.service;

/**
 * @param detail 내부 사유. {@link RejectionKind#disclosesDetail()}인 경우에만 외부로 나간다
 */
public record Rejection(RejectionKind kind, String detail) {
}
