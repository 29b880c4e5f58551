package com.dropmatch.payment.controller;

import com.dropmatch.common.dto.ApiResponse;
import com.dropmatch.payment.service.PaymentWebhookService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * PG 웹훅 수신. JWT 대신 {@code X-Payment-Signature} 서명으로 발신자를 검증한다.
 */
@RestController
@RequestMapping("/webhooks")
@RequiredArgsConstructor
public class PaymentWebhookController {

    static final String SIGNATURE_HEADER = "X-Payment-Signature";

    private final PaymentWebhookService webhookService;

    @PostMapping("/payments")
    public ApiResponse<String> receive(@RequestBody byte[] payload,
                                       @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature) {
        return webhookService.handle(payload, signature)
                .map(delivery -> ApiResponse.ok("processed"))
                .orElseGet(() -> ApiResponse.ok("ignored"));
    }
}
