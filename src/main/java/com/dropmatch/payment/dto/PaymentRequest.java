package com.dropmatch.payment.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * 결제 요청 본문 (선택).
 *
 * <p>청구 금액은 서버가 저장된 운임으로 정한다. 클라이언트가 금액을 보내면
 * 감사 로그에만 남고 청구에는 쓰이지 않는다.</p>
 */
public record PaymentRequest(@JsonAlias("amount") Long amountMinor) {
}
