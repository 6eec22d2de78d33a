package com.sgbc.sgbcPrj.report.controller;

import com.sgbc.sgbcPrj.access.security.Actors;
import com.sgbc.sgbcPrj.report.dto.LibraryReportDTO;
import com.sgbc.sgbcPrj.report.dto.NetworkDashboardDTO;
import com.sgbc.sgbcPrj.report.service.ReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/reports")
public class ReportController {

    private final ReportService reportService;

    @GetMapping("/network")
    public NetworkDashboardDTO network(Authentication auth) {
        return reportService.networkDashboard(Actors.from(auth));
    }

    /** loans per month and per status for one library */
    @GetMapping("/libraries/{libraryId}")
    public LibraryReportDTO library(@PathVariable Long libraryId, Authentication auth) {
        return reportService.libraryReport(libraryId, Actors.from(auth));
    }
}
