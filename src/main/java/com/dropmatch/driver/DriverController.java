package com.dropmatch.driver;

import com.dropmatch.common.dto.ApiResponse;
import com.dropmatch.common.exception.BusinessException;
import com.dropmatch.common.exception.ErrorCode;
import com.dropmatch.common.security.AuthenticatedIdentity;
import com.dropmatch.common.security.AuthenticationFilter;
import com.dropmatch.common.security.Identity;
import com.dropmatch.common.security.Role;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * 기사 운행 상태 API. 기사 ID는 토큰에서만 가져온다 (경로/본문의 기사 ID 없음).
 */
@RestController
@RequestMapping("/drivers/me")
@RequiredArgsConstructor
public class DriverController {

    private final DriverDirectory driverDirectory;

    @PutMapping("/location")
    @RateLimiter(name = "deliveryApi")
    public ApiResponse<String> goOnline(
            @RequestAttribute(name = AuthenticationFilter.IDENTITY_ATTRIBUTE, required = false) Identity identity,
            @Valid @RequestBody DriverLocationRequest request) {
        Identity driver = requireDriver(identity);
        driverDirectory.goOnline(driver.actorId(), request.latitude(), request.longitude());
        return ApiResponse.ok("online");
    }

    @DeleteMapping("/location")
    public ApiResponse<String> goOffline(
            @RequestAttribute(name = AuthenticationFilter.IDENTITY_ATTRIBUTE, required = false) Identity identity) {
        driverDirectory.goOffline(requireDriver(identity).actorId());
        return ApiResponse.ok("offline");
    }

    private Identity requireDriver(Identity identity) {
        Identity verified = AuthenticatedIdentity.require(identity);
        if (!verified.hasRole(Role.DRIVER)) {
            throw new BusinessException(ErrorCode.FORBIDDEN);
        }
        return verified;
    }
}
