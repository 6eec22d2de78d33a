package com.sgbc.sgbcPrj.report.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CountRowDTO {
    private String label;   // yyyy-MM or a loan status
    private long total;
}
