package com.dropmatch.delivery.guard;

import com.dropmatch.common.security.Identity;
import com.dropmatch.common.security.Role;
import com.dropmatch.delivery.entity.Delivery;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * 소유권 검사기 (Ownership Guard)
 *
 * <p>판단 근거는 저장된 레코드의 {@code customerId}/{@code driverId}와 검증된 Identity뿐이다.
 * 요청 본문의 어떤 값도 참조하지 않는다.</p>
 *
 * <h3>판정 규칙</h3>
 * <ul>
 *   <li>ADMIN - 모든 관계를 충족 (break-glass). {@code adminOverride}로 표시된다</li>
 *   <li>IS_CUSTOMER - CUSTOMER 역할 + customerId 일치. 다른 고객이면 NOT_OWNER</li>
 *   <li>IS_ASSIGNED_DRIVER - DRIVER 역할 + driverId 일치. 다른 기사면 NOT_ASSIGNED</li>
 *   <li>IS_ANY_ASSIGNED_PARTY - 위 둘 중 하나</li>
 *   <li>IS_ADMIN - ADMIN만</li>
 * </ul>
 * <p>역할이 관계를 원천적으로 충족할 수 없으면 ROLE_INSUFFICIENT.</p>
 */
@Component
public class OwnershipGuard {

    public AuthorizationDecision authorize(Identity identity, Delivery delivery, Relation required) {
        return authorize(identity, delivery, Set.of(required));
    }

    /** 관계 중 하나라도 충족하면 허용 (예: 취소는 고객 | 배정 기사 | 관리자) */
    public AuthorizationDecision authorize(Identity identity, Delivery delivery, Set<Relation> anyOf) {
        if (identity.isAdmin()) {
            return AuthorizationDecision.allowAsAdmin();
        }

        DenyReason reason = DenyReason.ROLE_INSUFFICIENT;
        for (Relation relation : anyOf) {
            DenyReason outcome = check(identity, delivery, relation);
            if (outcome == null) {
                return AuthorizationDecision.allow();
            }
            // 역할은 맞지만 레코드와 연결되지 않은 사유가 더 구체적이다
            if (outcome != DenyReason.ROLE_INSUFFICIENT) {
                reason = outcome;
            }
        }
        return AuthorizationDecision.deny(reason);
    }

    /** @return 충족하면 null, 아니면 거절 사유 */
    private DenyReason check(Identity identity, Delivery delivery, Relation relation) {
        return switch (relation) {
            case IS_ADMIN -> DenyReason.ROLE_INSUFFICIENT;
            case IS_CUSTOMER -> checkCustomer(identity, delivery);
            case IS_ASSIGNED_DRIVER -> checkDriver(identity, delivery);
            case IS_ANY_ASSIGNED_PARTY -> identity.hasRole(Role.CUSTOMER)
                    ? checkCustomer(identity, delivery)
                    : checkDriver(identity, delivery);
        };
    }

    private DenyReason checkCustomer(Identity identity, Delivery delivery) {
        if (!identity.hasRole(Role.CUSTOMER)) {
            return DenyReason.ROLE_INSUFFICIENT;
        }
        return delivery.isCustomer(identity.actorId()) ? null : DenyReason.NOT_OWNER;
    }

    private DenyReason checkDriver(Identity identity, Delivery delivery) {
        if (!identity.hasRole(Role.DRIVER)) {
            return DenyReason.ROLE_INSUFFICIENT;
        }
        return delivery.isAssignedDriver(identity.actorId()) ? null : DenyReason.NOT_ASSIGNED;
    }
}
