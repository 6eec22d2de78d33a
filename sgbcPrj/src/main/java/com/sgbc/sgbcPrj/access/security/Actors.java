package com.sgbc.sgbcPrj.access.security;

import com.sgbc.sgbcPrj.access.dto.ActorContext;
import org.springframework.security.core.Authentication;

public final class Actors {

    private Actors() {}

    /** Anonymous callers come back as null; the access policy treats them as search-only. */
    public static ActorContext from(Authentication auth) {
        if (auth == null || !(auth.getPrincipal() instanceof LoginUser)) {
            return null;
        }
        return ((LoginUser) auth.getPrincipal()).toActor();
    }
}
