package com.sgbc.sgbcPrj.query.service;

import com.sgbc.sgbcPrj.access.dto.ActorContext;
import com.sgbc.sgbcPrj.access.policy.AccessPolicy;
import com.sgbc.sgbcPrj.access.policy.Operation;
import com.sgbc.sgbcPrj.domain.CopyDTO;
import com.sgbc.sgbcPrj.domain.CopyStatus;
import com.sgbc.sgbcPrj.exception.CirculationException;
import com.sgbc.sgbcPrj.inventory.mapper.InventoryMapper;
import com.sgbc.sgbcPrj.query.dto.OpenLoanDTO;
import com.sgbc.sgbcPrj.query.dto.TitleSearchDTO;
import com.sgbc.sgbcPrj.query.mapper.QueryMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Read-only projections over the current store state. No caching: every call hits the database.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CirculationQueryService {

    private static final int MAX_TERM_LENGTH = 200;

    private final QueryMapper queryMapper;
    private final InventoryMapper inventoryMapper;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    /** Copies on the shelf at a library, ordered by title then code */
    public List<CopyDTO> listAvailableCopies(Long libraryId, ActorContext actor) {
        return listCopies(libraryId, CopyStatus.AVAILABLE, actor);
    }

    /** status == null lists every copy of the library */
    public List<CopyDTO> listCopies(Long libraryId, CopyStatus status, ActorContext actor) {
        accessPolicy.require(actor, Operation.VIEW_LOCAL_INVENTORY, libraryId);
        requireLibrary(libraryId);
        return inventoryMapper.selectCopiesByLibrary(libraryId, status);
    }

    public List<OpenLoanDTO> listOpenLoans(Long libraryId, ActorContext actor) {
        accessPolicy.require(actor, Operation.VIEW_LOCAL_INVENTORY, libraryId);
        requireLibrary(libraryId);

        LocalDateTime now = LocalDateTime.now(clock);
        List<OpenLoanDTO> loans = queryMapper.selectOpenLoansByLibrary(libraryId);
        for (OpenLoanDTO loan : loans) {
            loan.setOverdue(loan.getDueDate().isBefore(now));
        }
        return loans;
    }

    /** Public catalog search: case-insensitive substring of the title text. */
    public List<TitleSearchDTO> searchTitles(String term, Long libraryId) {
        if (term == null || term.isBlank()) {
            return Collections.emptyList();
        }
        String safe = term.trim();
        if (safe.length() > MAX_TERM_LENGTH) {
            throw CirculationException.invalid("search term too long");
        }
        return queryMapper.searchTitles("%" + escapeLike(safe.toLowerCase(Locale.ROOT)) + "%", libraryId);
    }

    private void requireLibrary(Long libraryId) {
        if (inventoryMapper.selectLibrary(libraryId) == null) {
            throw CirculationException.notFound("Library", libraryId);
        }
    }

    // '\' is the ESCAPE character declared in the mapper
    private String escapeLike(String value) {
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
