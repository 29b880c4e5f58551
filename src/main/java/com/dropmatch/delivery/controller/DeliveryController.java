package com.dropmatch.delivery.controller;

import com.dropmatch.common.dto.ApiResponse;
import com.dropmatch.common.security.AuthenticatedIdentity;
import com.dropmatch.common.security.AuthenticationFilter;
import com.dropmatch.common.security.Identity;
import com.dropmatch.delivery.dto.CancelDeliveryRequest;
import com.dropmatch.delivery.dto.CreateDeliveryRequest;
import com.dropmatch.delivery.dto.DeliveryResponse;
import com.dropmatch.delivery.entity.Delivery;
import com.dropmatch.delivery.service.DeliveryLifecycleEngine;
import com.dropmatch.delivery.service.LifecycleResult;
import com.dropmatch.delivery.statemachine.DeliveryStateMachine;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 배달 API - 동작별 엔드포인트만 제공한다. 상태를 직접 지정하는 엔드포인트는 없다.
 *
 * <pre>
 *   POST /deliveries                   생성 (CUSTOMER)
 *   GET  /deliveries/{id}              조회
 *   POST /deliveries/{id}/accept       배차 수락 (DRIVER)
 *   POST /deliveries/{id}/pickup       픽업
 *   POST /deliveries/{id}/start        운송 시작
 *   POST /deliveries/{id}/complete     배달 완료
 *   POST /deliveries/{id}/cancel       취소 (본문: reason)
 * </pre>
 */
@RestController
@RequestMapping("/deliveries")
@RequiredArgsConstructor
public class DeliveryController {

    private final DeliveryLifecycleEngine lifecycleEngine;
    private final DeliveryStateMachine stateMachine;

    @PostMapping
    @RateLimiter(name = "deliveryApi")
    public ResponseEntity<ApiResponse<DeliveryResponse>> create(
            @RequestAttribute(name = AuthenticationFilter.IDENTITY_ATTRIBUTE, required = false) Identity identity,
            @Valid @RequestBody CreateDeliveryRequest request) {
        Delivery delivery = lifecycleEngine.create(AuthenticatedIdentity.require(identity),
                request.pickup().toLocation(), request.dropoff().toLocation(), request.vehicleClass()).orElseThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(toResponse(delivery)));
    }

    @GetMapping("/{id}")
    @RateLimiter(name = "deliveryApi")
    public ApiResponse<DeliveryResponse> getDelivery(
            @RequestAttribute(name = AuthenticationFilter.IDENTITY_ATTRIBUTE, required = false) Identity identity,
            @PathVariable String id) {
        return respond(lifecycleEngine.view(AuthenticatedIdentity.require(identity), id));
    }

    @PostMapping("/{id}/accept")
    @RateLimiter(name = "deliveryApi")
    public ApiResponse<DeliveryResponse> accept(
            @RequestAttribute(name = AuthenticationFilter.IDENTITY_ATTRIBUTE, required = false) Identity identity,
            @PathVariable String id) {
        return respond(lifecycleEngine.accept(AuthenticatedIdentity.require(identity), id));
    }

    @PostMapping("/{id}/pickup")
    @RateLimiter(name = "deliveryApi")
    public ApiResponse<DeliveryResponse> pickup(
            @RequestAttribute(name = AuthenticationFilter.IDENTITY_ATTRIBUTE, required = false) Identity identity,
            @PathVariable String id) {
        return respond(lifecycleEngine.pickup(AuthenticatedIdentity.require(identity), id));
    }

    @PostMapping("/{id}/start")
    @RateLimiter(name = "deliveryApi")
    public ApiResponse<DeliveryResponse> start(
            @RequestAttribute(name = AuthenticationFilter.IDENTITY_ATTRIBUTE, required = false) Identity identity,
            @PathVariable String id) {
        return respond(lifecycleEngine.start(AuthenticatedIdentity.require(identity), id));
    }

    @PostMapping("/{id}/complete")
    @RateLimiter(name = "deliveryApi")
    public ApiResponse<DeliveryResponse> complete(
            @RequestAttribute(name = AuthenticationFilter.IDENTITY_ATTRIBUTE, required = false) Identity identity,
            @PathVariable String id) {
        return respond(lifecycleEngine.complete(AuthenticatedIdentity.require(identity), id));
    }

    @PostMapping("/{id}/cancel")
    @RateLimiter(name = "deliveryApi")
    public ApiResponse<DeliveryResponse> cancel(
            @RequestAttribute(name = AuthenticationFilter.IDENTITY_ATTRIBUTE, required = false) Identity identity,
            @PathVariable String id,
            @Valid @RequestBody(required = false) CancelDeliveryRequest request) {
        String reason = request == null ? null : request.reason();
        return respond(lifecycleEngine.cancel(AuthenticatedIdentity.require(identity), id, reason));
    }

    private ApiResponse<DeliveryResponse> respond(LifecycleResult<Delivery> result) {
        DeliveryResponse response = toResponse(result.orElseThrow());
        // 동시 요청이 먼저 같은 전이를 반영한 경우
        return result.replayed()
                ? ApiResponse.ok(response, "Already " + response.status())
                : ApiResponse.ok(response);
    }

    private DeliveryResponse toResponse(Delivery delivery) {
        return DeliveryResponse.from(delivery, stateMachine.actionsFrom(delivery.getStatus()));
    }
}
