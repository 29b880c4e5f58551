package com.dropmatch.common.exception;

import lombok.Getter;

/**
 * 비즈니스 예외 (Business Exception)
 *
 * <p>웹 경계에서만 던져지는 unchecked 예외. 엔진 내부의 거절은
 * {@code LifecycleResult}로 전달되고, 컨트롤러가 응답을 만들 때 이 예외로 변환한다.
 * {@link GlobalExceptionHandler}가 RFC 7807 ProblemDetail로 바꿔 응답한다.</p>
 *
 * <pre>
 *   throw new BusinessException(ErrorCode.FORBIDDEN);
 *   throw new BusinessException(ErrorCode.ILLEGAL_TRANSITION, "Action PICKUP is not allowed from status CREATED");
 * </pre>
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    /**
     * 커스텀 메시지를 지정하는 생성자.
     * 상세 사유를 외부에 노출해도 되는 에러 코드(상태 전이 거절 등)에만 사용한다.
     */
    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
