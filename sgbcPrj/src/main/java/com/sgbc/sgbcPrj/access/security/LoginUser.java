package com.sgbc.sgbcPrj.access.security;

import com.sgbc.sgbcPrj.access.dto.ActorContext;
import com.sgbc.sgbcPrj.domain.Role;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import java.util.Collection;
import java.util.List;

/** Principal of an authenticated staff account. */
@Getter
@RequiredArgsConstructor
public class LoginUser implements UserDetails {

    private final Long userId;
    private final String email;
    private final String passwordHash;
    private final Role role;
    private final Long libraryId;
    private final boolean active;

    public ActorContext toActor() {
        return new ActorContext(userId, role, libraryId);
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return List.of(new SimpleGrantedAuthority("ROLE_" + role.name()));
    }

    @Override
    public String getPassword() {
        return passwordHash;
    }

    @Override
    public String getUsername() {
        return email;
    }

    @Override
    public boolean isEnabled() {
        return active;
    }
}
