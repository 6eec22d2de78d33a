package com.sgbc.sgbcPrj.access.security;

import com.sgbc.sgbcPrj.domain.Role;
import com.sgbc.sgbcPrj.domain.UserDTO;
import com.sgbc.sgbcPrj.member.mapper.MemberMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LoginUserDetailsService implements UserDetailsService {

    private final MemberMapper memberMapper;

    @Override
    public UserDetails loadUserByUsername(String email) {
        UserDTO user = memberMapper.selectByEmail(email);

        // readers have no password and cannot log in
        if (user == null || user.getRole() == Role.READER || user.getPassword() == null) {
            throw new UsernameNotFoundException("No staff account for " + email);
        }

        return new LoginUser(
                user.getId(),
                user.getEmail(),
                user.getPassword(),
                user.getRole(),
                user.getLibraryId(),
                user.isActive()
        );
    }
}
