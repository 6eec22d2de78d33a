package com.sgbc.sgbcPrj.member.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CoordinatorCreateDTO {
    private String name;
    private String email;
    @ToString.Exclude
    private String password;
    private Long libraryId;
}
