package com.sgbc.sgbcPrj.inventory.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LibraryCreateDTO {
    private String name;
    private String city;
    private String address;
}
