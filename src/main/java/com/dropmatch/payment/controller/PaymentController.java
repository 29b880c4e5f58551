package com.dropmatch.payment.controller;

import com.dropmatch.common.dto.ApiResponse;
import com.dropmatch.common.security.AuthenticatedIdentity;
import com.dropmatch.common.security.AuthenticationFilter;
import com.dropmatch.common.security.Identity;
import com.dropmatch.delivery.service.DeliveryLifecycleEngine;
import com.dropmatch.delivery.service.LifecycleResult;
import com.dropmatch.payment.dto.ChargeResponse;
import com.dropmatch.payment.dto.PaymentRequest;
import com.dropmatch.payment.service.ChargeResult;
import com.dropmatch.payment.service.ChargeStatus;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 결제 API.
 *
 * <p>{@code Idempotency-Key} 헤더는 필수다. 같은 키로 다시 호출하면 PG를 다시 호출하지 않고
 * 첫 결과를 그대로 돌려준다. 결과가 아직 확정되지 않았으면 (PENDING / INDETERMINATE) 202를 준다.</p>
 */
@RestController
@RequestMapping("/deliveries")
@RequiredArgsConstructor
public class PaymentController {

    private final DeliveryLifecycleEngine lifecycleEngine;

    @PostMapping("/{id}/payments")
    @RateLimiter(name = "paymentApi")
    public ResponseEntity<ApiResponse<ChargeResponse>> authorizePayment(
            @RequestAttribute(name = AuthenticationFilter.IDENTITY_ATTRIBUTE, required = false) Identity identity,
            @PathVariable String id,
            @RequestHeader("Idempotency-Key") String idempotencyKey,
            @RequestBody(required = false) PaymentRequest request) {
        Long clientAmount = request == null ? null : request.amountMinor();
        LifecycleResult<ChargeResult> result = lifecycleEngine.authorizePayment(
                AuthenticatedIdentity.require(identity), id, idempotencyKey, clientAmount);
        ChargeResult charge = result.orElseThrow();

        HttpStatus status = charge.status() == ChargeStatus.PENDING || charge.status() == ChargeStatus.INDETERMINATE
                ? HttpStatus.ACCEPTED
                : HttpStatus.OK;
        return ResponseEntity.status(status).body(ApiResponse.ok(ChargeResponse.from(charge, result.replayed())));
    }
}
