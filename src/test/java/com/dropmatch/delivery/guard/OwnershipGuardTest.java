package com.dropmatch.delivery.guard;

import com.dropmatch.common.security.Identity;
import com.dropmatch.common.security.Role;
import com.dropmatch.delivery.DeliveryFixtures;
import com.dropmatch.delivery.entity.Delivery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class OwnershipGuardTest {

    private final OwnershipGuard guard = new OwnershipGuard();
    private final Delivery delivery = DeliveryFixtures.accepted("cust-1", "drv-1");

    @Test
    @DisplayName("기록된 고객과 배정 기사는 각자의 관계를 충족")
    void ownersAllowed() {
        assertThat(guard.authorize(new Identity("cust-1", Role.CUSTOMER), delivery, Relation.IS_CUSTOMER).allowed())
                .isTrue();
        assertThat(guard.authorize(new Identity("drv-1", Role.DRIVER), delivery, Relation.IS_ASSIGNED_DRIVER).allowed())
                .isTrue();
        assertThat(guard.authorize(new Identity("drv-1", Role.DRIVER), delivery, Relation.IS_ANY_ASSIGNED_PARTY).allowed())
                .isTrue();
    }

    @Test
    @DisplayName("다른 고객은 NOT_OWNER, 다른 기사는 NOT_ASSIGNED")
    void strangersDeniedWithSpecificReason() {
        AuthorizationDecision otherCustomer = guard.authorize(
                new Identity("cust-2", Role.CUSTOMER), delivery, Relation.IS_CUSTOMER);
        AuthorizationDecision otherDriver = guard.authorize(
                new Identity("drv-2", Role.DRIVER), delivery, Relation.IS_ASSIGNED_DRIVER);

        assertThat(otherCustomer.denyReason()).isEqualTo(DenyReason.NOT_OWNER);
        assertThat(otherDriver.denyReason()).isEqualTo(DenyReason.NOT_ASSIGNED);
    }

    @Test
    @DisplayName("고객 ID와 같은 문자열이라도 기사 역할이면 고객 관계를 충족하지 않음")
    void roleMustMatchRelation() {
        AuthorizationDecision decision = guard.authorize(
                new Identity("cust-1", Role.DRIVER), delivery, Relation.IS_CUSTOMER);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.denyReason()).isEqualTo(DenyReason.ROLE_INSUFFICIENT);
    }

    @Test
    @DisplayName("관리자는 모든 관계를 충족하되 adminOverride로 표시")
    void adminBreakGlass() {
        AuthorizationDecision decision = guard.authorize(
                new Identity("ops-1", Role.ADMIN), delivery, Relation.IS_ASSIGNED_DRIVER);

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.adminOverride()).isTrue();
    }

    @Test
    @DisplayName("복수 관계 - 하나라도 충족하면 허용, 아니면 가장 구체적인 사유")
    void anyOfRelations() {
        Set<Relation> cancelParties = Set.of(Relation.IS_CUSTOMER, Relation.IS_ASSIGNED_DRIVER);

        assertThat(guard.authorize(new Identity("cust-1", Role.CUSTOMER), delivery, cancelParties).allowed()).isTrue();
        assertThat(guard.authorize(new Identity("drv-9", Role.DRIVER), delivery, cancelParties).denyReason())
                .isEqualTo(DenyReason.NOT_ASSIGNED);
    }

    @Test
    @DisplayName("배정 전 배달에는 어떤 기사도 배정 기사가 아님")
    void noDriverBeforeAcceptance() {
        Delivery created = DeliveryFixtures.created("cust-1");

        assertThat(guard.authorize(new Identity("drv-1", Role.DRIVER), created, Relation.IS_ASSIGNED_DRIVER).denyReason())
                .isEqualTo(DenyReason.NOT_ASSIGNED);
    }
}
