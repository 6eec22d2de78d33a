package com.sgbc.sgbcPrj.report.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NetworkDashboardDTO {
    private long libraryCount;
    private long titleCount;
    private long openLoanCount;
}
