package com.dropmatch.common.security;

import com.dropmatch.common.exception.BusinessException;
import com.dropmatch.common.exception.ErrorCode;

/**
 * 컨트롤러에서 request attribute로 받은 Identity를 꺼내는 헬퍼.
 */
public final class AuthenticatedIdentity {

    private AuthenticatedIdentity() {
    }

    /** 인증되지 않은 요청이면 401 */
    public static Identity require(Identity identity) {
        if (identity == null) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED);
        }
        return identity;
    }
}
