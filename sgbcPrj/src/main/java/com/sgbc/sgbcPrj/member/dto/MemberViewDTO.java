package com.sgbc.sgbcPrj.member.dto;

import com.sgbc.sgbcPrj.domain.Role;
import com.sgbc.sgbcPrj.domain.UserDTO;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** USERS row without the password hash. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MemberViewDTO {
    private Long id;
    private String name;
    private String email;
    private String document;
    private String phone;
    private Role role;
    private Long libraryId;
    private boolean active;

    public static MemberViewDTO of(UserDTO user) {
        return new MemberViewDTO(user.getId(), user.getName(), user.getEmail(), user.getDocument(),
                user.getPhone(), user.getRole(), user.getLibraryId(), user.isActive());
    }
}
