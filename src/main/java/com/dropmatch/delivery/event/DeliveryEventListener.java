package com.dropmatch.delivery.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 생명주기 이벤트 구독자. 실시간 위치/상태 브로드캐스트 전송 계층으로 넘기는 지점이며,
 * 현재는 구조화 로그로 내보낸다.
 */
@Slf4j
@Component
public class DeliveryEventListener {

    @EventListener
    public void onLifecycleEvent(DeliveryLifecycleEvent event) {
        log.info("Broadcast delivery event: deliveryId={}, {} {}->{}, version={}",
                event.deliveryId(), event.action(), event.fromStatus(), event.toStatus(), event.version());
    }
}
