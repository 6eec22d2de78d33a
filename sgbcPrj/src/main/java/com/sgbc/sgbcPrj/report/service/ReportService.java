package com.sgbc.sgbcPrj.report.service;

import com.sgbc.sgbcPrj.access.dto.ActorContext;
import com.sgbc.sgbcPrj.access.policy.AccessPolicy;
import com.sgbc.sgbcPrj.access.policy.Operation;
import com.sgbc.sgbcPrj.inventory.service.InventoryService;
import com.sgbc.sgbcPrj.report.dto.LibraryReportDTO;
import com.sgbc.sgbcPrj.report.dto.NetworkDashboardDTO;
import com.sgbc.sgbcPrj.report.mapper.ReportMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReportService {

    private final ReportMapper mapper;
    private final InventoryService inventoryService;
    private final AccessPolicy accessPolicy;

    /** Network-wide counters for the admin dashboard */
    public NetworkDashboardDTO networkDashboard(ActorContext actor) {
        accessPolicy.require(actor, Operation.VIEW_NETWORK_DASHBOARD, null);
        return new NetworkDashboardDTO(
                mapper.countLibraries(),
                mapper.countTitles(),
                mapper.countOpenLoans()
        );
    }

    public LibraryReportDTO libraryReport(Long libraryId, ActorContext actor) {
        accessPolicy.require(actor, Operation.VIEW_LOCAL_REPORTS, libraryId);
        inventoryService.getLibrary(libraryId);

        LibraryReportDTO dto = new LibraryReportDTO();
        dto.setLibraryId(libraryId);
        dto.setLoansPerMonth(mapper.countLoansPerMonth(libraryId));
        dto.setLoansPerStatus(mapper.countLoansPerStatus(libraryId));
        return dto;
    }
}
