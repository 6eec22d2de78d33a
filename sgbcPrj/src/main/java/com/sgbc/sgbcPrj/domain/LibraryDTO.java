package com.sgbc.sgbcPrj.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@AllArgsConstructor
@NoArgsConstructor
@Data
public class LibraryDTO {

    private Long id;
    private String name;
    private String city;
    private String address;
    private boolean active;
    private LocalDateTime createdAt;
}
