package com.sgbc.sgbcPrj.access.dto;

import com.sgbc.sgbcPrj.domain.Role;
import lombok.Value;

/**
 * Authenticated caller as seen by the services.
 * Passed explicitly on every call; the services keep no session of their own.
 */
@Value
public class ActorContext {

    Long userId;
    Role role;
    Long homeLibraryId;   // null for NETWORK_ADMIN

    public boolean isHomeLibrary(Long libraryId) {
        return homeLibraryId != null && homeLibraryId.equals(libraryId);
    }
}
