package com.dropmatch.delivery.statemachine;

import com.dropmatch.common.security.Role;
import com.dropmatch.delivery.entity.DeliveryAction;
import com.dropmatch.delivery.entity.DeliveryStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class DeliveryStateMachineTest {

    private final DeliveryStateMachine stateMachine = new DeliveryStateMachine();

    @Test
    @DisplayName("정상 경로 - 각 상태에서 다음 상태는 하나뿐")
    void happyPath() {
        assertThat(stateMachine.canTransition(DeliveryStatus.CREATED, DeliveryAction.ACCEPT, Role.DRIVER).nextStatus())
                .isEqualTo(DeliveryStatus.ACCEPTED);
        assertThat(stateMachine.canTransition(DeliveryStatus.ACCEPTED, DeliveryAction.PICKUP, Role.DRIVER).nextStatus())
                .isEqualTo(DeliveryStatus.PICKED_UP);
        assertThat(stateMachine.canTransition(DeliveryStatus.PICKED_UP, DeliveryAction.START, Role.DRIVER).nextStatus())
                .isEqualTo(DeliveryStatus.IN_TRANSIT);
        assertThat(stateMachine.canTransition(DeliveryStatus.IN_TRANSIT, DeliveryAction.COMPLETE, Role.DRIVER).nextStatus())
                .isEqualTo(DeliveryStatus.DELIVERED);
    }

    @Test
    @DisplayName("단계 건너뛰기 거절 - CREATED에서 바로 COMPLETE 불가")
    void skipStateRejected() {
        TransitionDecision decision = stateMachine.canTransition(DeliveryStatus.CREATED, DeliveryAction.COMPLETE, Role.DRIVER);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.rejectReason()).isEqualTo(TransitionRejectReason.ACTION_NOT_ALLOWED);
        assertThat(decision.detail()).contains("COMPLETE").contains("CREATED");
    }

    @Test
    @DisplayName("역행 거절 - IN_TRANSIT에서 PICKUP 불가")
    void regressionRejected() {
        assertThat(stateMachine.canTransition(DeliveryStatus.IN_TRANSIT, DeliveryAction.PICKUP, Role.DRIVER).rejectReason())
                .isEqualTo(TransitionRejectReason.ACTION_NOT_ALLOWED);
    }

    @ParameterizedTest
    @EnumSource(value = DeliveryStatus.class, names = {"DELIVERED", "CANCELLED"})
    @DisplayName("종료 상태에서는 모든 동작 거절 (관리자 포함)")
    void terminalStatesRejectEverything(DeliveryStatus terminal) {
        for (DeliveryAction action : DeliveryAction.values()) {
            TransitionDecision decision = stateMachine.canTransition(terminal, action, Role.ADMIN);
            assertThat(decision.allowed()).isFalse();
            assertThat(decision.rejectReason()).isEqualTo(TransitionRejectReason.TERMINAL_STATE);
        }
        assertThat(stateMachine.actionsFrom(terminal)).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(value = DeliveryStatus.class, names = {"CREATED", "ACCEPTED", "PICKED_UP"})
    @DisplayName("취소는 IN_TRANSIT 이전 모든 상태에서 고객/기사/관리자에게 허용")
    void cancelAvailableUntilTransit(DeliveryStatus from) {
        for (Role role : Role.values()) {
            assertThat(stateMachine.canTransition(from, DeliveryAction.CANCEL, role).nextStatus())
                    .isEqualTo(DeliveryStatus.CANCELLED);
        }
    }

    @Test
    @DisplayName("운송 중에는 취소 불가")
    void cancelNotAllowedInTransit() {
        assertThat(stateMachine.canTransition(DeliveryStatus.IN_TRANSIT, DeliveryAction.CANCEL, Role.CUSTOMER).rejectReason())
                .isEqualTo(TransitionRejectReason.ACTION_NOT_ALLOWED);
    }

    @Test
    @DisplayName("역할 불일치 - 고객은 기사 동작 불가, 관리자는 배차 수락 불가")
    void roleMismatch() {
        assertThat(stateMachine.canTransition(DeliveryStatus.ACCEPTED, DeliveryAction.PICKUP, Role.CUSTOMER).rejectReason())
                .isEqualTo(TransitionRejectReason.ROLE_INSUFFICIENT);
        assertThat(stateMachine.canTransition(DeliveryStatus.CREATED, DeliveryAction.ACCEPT, Role.ADMIN).rejectReason())
                .isEqualTo(TransitionRejectReason.ROLE_INSUFFICIENT);
        assertThat(stateMachine.canTransition(DeliveryStatus.IN_TRANSIT, DeliveryAction.COMPLETE, Role.ADMIN).allowed())
                .isTrue();
    }

    @Test
    @DisplayName("모든 동작의 목적지는 테이블 간선과 일치")
    void destinationsMatchTable() {
        assertThat(stateMachine.isLegalEdge(DeliveryStatus.CREATED, DeliveryAction.ACCEPT,
                stateMachine.destinationOf(DeliveryAction.ACCEPT))).isTrue();
        assertThat(stateMachine.isLegalEdge(DeliveryStatus.PICKED_UP, DeliveryAction.CANCEL,
                stateMachine.destinationOf(DeliveryAction.CANCEL))).isTrue();
        assertThat(stateMachine.isLegalEdge(DeliveryStatus.CREATED, DeliveryAction.PICKUP, DeliveryStatus.PICKED_UP))
                .isFalse();
    }
}
