package com.sgbc.sgbcPrj.access.policy;

import com.sgbc.sgbcPrj.access.dto.ActorContext;
import com.sgbc.sgbcPrj.exception.CirculationException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

@Component
public class AccessPolicy {

    private static final Set<Operation> ADMIN_OPERATIONS = Collections.unmodifiableSet(EnumSet.of(
            Operation.MANAGE_LIBRARIES,
            Operation.MANAGE_CATALOG,
            Operation.MANAGE_STAFF,
            Operation.VIEW_NETWORK_DASHBOARD,
            Operation.VIEW_LOCAL_INVENTORY,
            Operation.VIEW_LOCAL_REPORTS,
            Operation.SEARCH
    ));

    private static final Set<Operation> COORDINATOR_HOME_OPERATIONS = Collections.unmodifiableSet(EnumSet.of(
            Operation.CHECKOUT,
            Operation.RETURN,
            Operation.VIEW_LOCAL_INVENTORY,
            Operation.MANAGE_LOCAL_INVENTORY,
            Operation.MANAGE_READERS,
            Operation.VIEW_LOCAL_REPORTS,
            Operation.SEARCH
    ));

    private static final Set<Operation> SEARCH_ONLY = Collections.unmodifiableSet(EnumSet.of(Operation.SEARCH));

    /**
     * Operations the actor may perform against a target library.
     * - NETWORK_ADMIN: catalog, libraries, staff and read access everywhere, never circulation
     * - LOCAL_COORDINATOR: everything local, but only at the home library
     * - READER: search only
     *
     * @param targetLibraryId library the operation touches, null for network-wide operations
     */
    public Set<Operation> permittedOperations(ActorContext actor, Long targetLibraryId) {
        if (actor == null || actor.getRole() == null) {
            return SEARCH_ONLY;
        }

        switch (actor.getRole()) {
            case NETWORK_ADMIN:
                return ADMIN_OPERATIONS;
            case LOCAL_COORDINATOR:
                return actor.isHomeLibrary(targetLibraryId) ? COORDINATOR_HOME_OPERATIONS : SEARCH_ONLY;
            case READER:
                return SEARCH_ONLY;
            default:
                throw new IllegalStateException("Unhandled role: " + actor.getRole());
        }
    }

    public boolean isPermitted(ActorContext actor, Operation operation, Long targetLibraryId) {
        return permittedOperations(actor, targetLibraryId).contains(operation);
    }

    /** Throws FORBIDDEN unless the operation is permitted on the target library. */
    public void require(ActorContext actor, Operation operation, Long targetLibraryId) {
        if (!isPermitted(actor, operation, targetLibraryId)) {
            throw CirculationException.forbidden(
                    operation + " not permitted on library " + targetLibraryId);
        }
    }

    /** Role-level check, before the target library is known. */
    public void requireRoleCapable(ActorContext actor, Operation operation) {
        Long probe = (actor == null) ? null : actor.getHomeLibraryId();
        if (!isPermitted(actor, operation, probe)) {
            throw CirculationException.forbidden(operation + " not permitted for this role");
        }
    }
}
