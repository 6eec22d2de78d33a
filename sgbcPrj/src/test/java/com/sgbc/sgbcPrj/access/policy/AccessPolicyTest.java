package com.sgbc.sgbcPrj.access.policy;

import com.sgbc.sgbcPrj.access.dto.ActorContext;
import com.sgbc.sgbcPrj.domain.Role;
import com.sgbc.sgbcPrj.exception.CirculationException;
import com.sgbc.sgbcPrj.exception.ErrorCode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccessPolicyTest {

    private final AccessPolicy policy = new AccessPolicy();

    private final ActorContext admin = new ActorContext(1L, Role.NETWORK_ADMIN, null);
    private final ActorContext coordinatorL1 = new ActorContext(2L, Role.LOCAL_COORDINATOR, 1L);
    private final ActorContext reader = new ActorContext(3L, Role.READER, 1L);

    @Test
    void adminManagesNetworkButNeverCirculates() {
        assertThat(policy.permittedOperations(admin, 1L))
                .contains(Operation.MANAGE_LIBRARIES, Operation.MANAGE_CATALOG, Operation.MANAGE_STAFF,
                        Operation.VIEW_LOCAL_INVENTORY, Operation.VIEW_NETWORK_DASHBOARD)
                .doesNotContain(Operation.CHECKOUT, Operation.RETURN, Operation.MANAGE_LOCAL_INVENTORY);
    }

    @Test
    void coordinatorHasFullLocalRightsAtHomeOnly() {
        assertThat(policy.permittedOperations(coordinatorL1, 1L))
                .contains(Operation.CHECKOUT, Operation.RETURN, Operation.MANAGE_LOCAL_INVENTORY,
                        Operation.MANAGE_READERS, Operation.VIEW_LOCAL_REPORTS)
                .doesNotContain(Operation.MANAGE_CATALOG, Operation.MANAGE_STAFF);

        assertThat(policy.permittedOperations(coordinatorL1, 2L)).containsExactly(Operation.SEARCH);
        assertThat(policy.permittedOperations(coordinatorL1, null)).containsExactly(Operation.SEARCH);
    }

    @Test
    void readersAndAnonymousCallersOnlySearch() {
        assertThat(policy.permittedOperations(reader, 1L)).containsExactly(Operation.SEARCH);
        assertThat(policy.permittedOperations(null, 1L)).containsExactly(Operation.SEARCH);
    }

    @Test
    void requireThrowsForbidden() {
        assertThatThrownBy(() -> policy.require(coordinatorL1, Operation.CHECKOUT, 2L))
                .isInstanceOf(CirculationException.class)
                .extracting(e -> ((CirculationException) e).getCode())
                .isEqualTo(ErrorCode.FORBIDDEN);

        assertThatThrownBy(() -> policy.requireRoleCapable(admin, Operation.RETURN))
                .isInstanceOf(CirculationException.class);

        policy.requireRoleCapable(coordinatorL1, Operation.RETURN);
        policy.require(admin, Operation.VIEW_LOCAL_INVENTORY, 7L);
    }
}
