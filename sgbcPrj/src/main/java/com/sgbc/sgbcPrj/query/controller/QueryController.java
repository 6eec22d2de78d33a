package com.sgbc.sgbcPrj.query.controller;

import com.sgbc.sgbcPrj.access.security.Actors;
import com.sgbc.sgbcPrj.domain.CopyDTO;
import com.sgbc.sgbcPrj.domain.CopyStatus;
import com.sgbc.sgbcPrj.query.dto.OpenLoanDTO;
import com.sgbc.sgbcPrj.query.dto.TitleSearchDTO;
import com.sgbc.sgbcPrj.query.service.CirculationQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class QueryController {

    private final CirculationQueryService service;

    @GetMapping("/libraries/{libraryId}/copies/available")
    public List<CopyDTO> availableCopies(@PathVariable Long libraryId, Authentication auth) {
        return service.listAvailableCopies(libraryId, Actors.from(auth));
    }

    @GetMapping("/libraries/{libraryId}/copies")
    public List<CopyDTO> copies(@PathVariable Long libraryId,
                                @RequestParam(required = false) CopyStatus status,
                                Authentication auth) {
        return service.listCopies(libraryId, status, Actors.from(auth));
    }

    @GetMapping("/libraries/{libraryId}/loans/open")
    public List<OpenLoanDTO> openLoans(@PathVariable Long libraryId, Authentication auth) {
        return service.listOpenLoans(libraryId, Actors.from(auth));
    }

    /** Public catalog, no login required */
    @GetMapping("/search/titles")
    public List<TitleSearchDTO> searchTitles(@RequestParam String q,
                                             @RequestParam(required = false) Long libraryId) {
        return service.searchTitles(q, libraryId);
    }
}
