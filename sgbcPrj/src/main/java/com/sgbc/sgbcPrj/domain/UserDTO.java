package com.sgbc.sgbcPrj.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Row of USERS. Staff accounts (admin, coordinators) and readers share the table;
 * readers carry no password and never log in.
 */
@AllArgsConstructor
@NoArgsConstructor
@Data
public class UserDTO {

    private Long id;
    private String name;
    private String email;
    private String document;
    private String phone;
    @ToString.Exclude
    private String password;     // BCrypt hash, staff only
    private Role role;
    private Long libraryId;      // home library, null for the network admin
    private boolean active;
    private LocalDateTime createdAt;
}
