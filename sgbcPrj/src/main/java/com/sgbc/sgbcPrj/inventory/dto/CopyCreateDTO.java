package com.sgbc.sgbcPrj.inventory.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** The owning library is always the coordinator's home library. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CopyCreateDTO {
    private Long titleId;
    private String code;
}
