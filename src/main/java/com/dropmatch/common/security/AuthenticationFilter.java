package com.dropmatch.common.security;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * JWT 인증 필터.
 *
 * <pre>
 *   Client → [Authorization: Bearer xxx] → AuthenticationFilter
 *     1. "Bearer " 접두사 제거하여 토큰 추출
 *     2. IdentityContext.verify()로 서명/만료/role 검증
 *     3. 유효하면 request.setAttribute(IDENTITY_ATTRIBUTE, identity)
 *     4. chain.doFilter()로 다음 필터/컨트롤러로 전달
 * </pre>
 *
 * <p>토큰이 없거나 무효여도 요청을 막지 않는다. 인증이 필요한 컨트롤러가
 * attribute 부재를 보고 401을 돌려준다 (웹훅 엔드포인트는 토큰 대신 서명으로 검증).</p>
 */
@Component
@RequiredArgsConstructor
public class AuthenticationFilter implements Filter {

    public static final String IDENTITY_ATTRIBUTE = "identity";

    private final IdentityContext identityContext;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        // 클라이언트가 attribute를 직접 심을 수 없지만, 앞단 필터가 남긴 값도 신뢰하지 않는다
        httpRequest.removeAttribute(IDENTITY_ATTRIBUTE);

        String token = resolveToken(httpRequest);
        if (token != null) {
            identityContext.verify(token)
                    .ifPresent(identity -> httpRequest.setAttribute(IDENTITY_ATTRIBUTE, identity));
        }

        chain.doFilter(request, response);
    }

    private String resolveToken(HttpServletRequest request) {
        String bearer = request.getHeader("Authorization");
        if (bearer != null && bearer.startsWith("Bearer ")) {
            return bearer.substring(7);
        }
        return null;
    }
}
