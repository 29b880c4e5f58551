package com.dropmatch.delivery.entity;

/** 배달에 요청할 수 있는 전이 동작. 상태를 직접 지정하는 동작은 존재하지 않는다. */
public enum DeliveryAction {
    ACCEPT,
    PICKUP,
    START,
    COMPLETE,
    CANCEL
}
