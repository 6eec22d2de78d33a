package com.sgbc.sgbcPrj.member.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReaderCreateDTO {
    private String name;
    private String email;      // email or phone contact, unique network-wide
    private String document;   // optional
    private String phone;
    private boolean privacyConsent;
}
