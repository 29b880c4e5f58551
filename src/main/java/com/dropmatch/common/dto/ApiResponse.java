package com.dropmatch.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 응답 래퍼.
 *
 * <p>모든 엔드포인트가 success/data/message 3개 필드로 응답한다.
 * 실패 응답은 {@code GlobalExceptionHandler}가 ProblemDetail로 내려주므로
 * 이 래퍼는 성공 응답 전용이다.</p>
 *
 * @param <T> 응답 데이터 타입
 */
@JsonInclude(JsonInclude.Include.NON_NULL) // null 필드는 JSON에서 제외
public record ApiResponse<T>(
        boolean success,
        T data,
        String message
) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    /** 성공이지만 부가 설명이 필요한 경우 (예: 이미 취소된 배달에 대한 멱등 응답) */
    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, data, message);
    }
}
