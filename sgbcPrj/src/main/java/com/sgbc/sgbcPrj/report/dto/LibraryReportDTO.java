package com.sgbc.sgbcPrj.report.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class LibraryReportDTO {
    private Long libraryId;
    private List<CountRowDTO> loansPerMonth = new ArrayList<>();
    private List<CountRowDTO> loansPerStatus = new ArrayList<>();
}
