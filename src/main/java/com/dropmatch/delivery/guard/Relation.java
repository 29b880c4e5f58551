package com.dropmatch.delivery.guard;

/** 행위자와 배달 레코드 사이에 요구되는 관계 */
public enum Relation {
    IS_CUSTOMER,
    IS_ASSIGNED_DRIVER,
    IS_ADMIN,
    /** 고객 또는 배정 기사 */
    IS_ANY_ASSIGNED_PARTY
}
