package com.dropmatch.delivery.statemachine;

import com.dropmatch.common.security.Role;
import com.dropmatch.delivery.entity.DeliveryAction;
import com.dropmatch.delivery.entity.DeliveryStatus;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.dropmatch.delivery.entity.DeliveryAction.*;
import static com.dropmatch.delivery.entity.DeliveryStatus.*;

/**
 * 배달 상태 전이 합법성 테이블.
 *
 * <pre>
 * | From                          | Action   | To         | Role                      |
 * |-------------------------------|----------|------------|---------------------------|
 * | CREATED                       | ACCEPT   | ACCEPTED   | DRIVER                    |
 * | ACCEPTED                      | PICKUP   | PICKED_UP  | DRIVER, ADMIN             |
 * | PICKED_UP                     | START    | IN_TRANSIT | DRIVER, ADMIN             |
 * | IN_TRANSIT                    | COMPLETE | DELIVERED  | DRIVER, ADMIN             |
 * | CREATED, ACCEPTED, PICKED_UP  | CANCEL   | CANCELLED  | CUSTOMER, DRIVER, ADMIN   |
 * | DELIVERED, CANCELLED          | *        | -          | 무조건 거절               |
 * </pre>
 *
 * <p>(상태, 동작) 쌍마다 목적지는 정확히 하나다. 임의 상태 지정 경로가 없으므로 단계 건너뛰기나
 * 역행 전이는 테이블 구성만으로 불가능하다. 배정 기사 여부 같은 레코드 관계는
 * {@link com.dropmatch.delivery.guard.OwnershipGuard}가 따로 판단한다.</p>
 */
@Component
public class DeliveryStateMachine {

    private record Edge(DeliveryStatus to, Set<Role> roles) {
    }

    private static final Set<Role> DRIVER_ONLY = EnumSet.of(Role.DRIVER);
    private static final Set<Role> DRIVER_OR_ADMIN = EnumSet.of(Role.DRIVER, Role.ADMIN);
    private static final Set<Role> ANY_PARTY = EnumSet.of(Role.CUSTOMER, Role.DRIVER, Role.ADMIN);

    private final Map<DeliveryStatus, Map<DeliveryAction, Edge>> table = new EnumMap<>(DeliveryStatus.class);

    public DeliveryStateMachine() {
        edge(CREATED, ACCEPT, ACCEPTED, DRIVER_ONLY);
        edge(ACCEPTED, PICKUP, PICKED_UP, DRIVER_OR_ADMIN);
        edge(PICKED_UP, START, IN_TRANSIT, DRIVER_OR_ADMIN);
        edge(IN_TRANSIT, COMPLETE, DELIVERED, DRIVER_OR_ADMIN);
        for (DeliveryStatus from : EnumSet.of(CREATED, ACCEPTED, PICKED_UP)) {
            edge(from, CANCEL, CANCELLED, ANY_PARTY);
        }
    }

    private void edge(DeliveryStatus from, DeliveryAction action, DeliveryStatus to, Set<Role> roles) {
        table.computeIfAbsent(from, key -> new EnumMap<>(DeliveryAction.class))
                .put(action, new Edge(to, roles));
    }

    public TransitionDecision canTransition(DeliveryStatus current, DeliveryAction action, Role actorRole) {
        if (current.isTerminal()) {
            return TransitionDecision.reject(TransitionRejectReason.TERMINAL_STATE,
                    "Delivery is already " + current + "; no further actions are allowed");
        }
        Edge edge = table.getOrDefault(current, Map.of()).get(action);
        if (edge == null) {
            return TransitionDecision.reject(TransitionRejectReason.ACTION_NOT_ALLOWED,
                    "Action " + action + " is not allowed while delivery is " + current);
        }
        if (!edge.roles().contains(actorRole)) {
            return TransitionDecision.reject(TransitionRejectReason.ROLE_INSUFFICIENT,
                    "Role " + actorRole + " cannot perform " + action);
        }
        return TransitionDecision.allow(edge.to());
    }

    /** 동작의 목적지. 동작마다 목적지가 하나뿐이라 출발 상태와 무관하다 */
    public DeliveryStatus destinationOf(DeliveryAction action) {
        return switch (action) {
            case ACCEPT -> ACCEPTED;
            case PICKUP -> PICKED_UP;
            case START -> IN_TRANSIT;
            case COMPLETE -> DELIVERED;
            case CANCEL -> CANCELLED;
        };
    }

    /** 현재 상태에서 정의된 동작 목록 (역할 무관) */
    public Set<DeliveryAction> actionsFrom(DeliveryStatus current) {
        Map<DeliveryAction, Edge> edges = table.get(current);
        if (edges == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(edges.keySet()));
    }

    /** 전이 로그 검증용: (from, to) 쌍이 테이블의 어떤 간선인지 */
    public boolean isLegalEdge(DeliveryStatus from, DeliveryAction action, DeliveryStatus to) {
        Edge edge = table.getOrDefault(from, Map.of()).get(action);
        return edge != null && edge.to() == to;
    }
}
