package com.sgbc.sgbcPrj.inventory.service;

import com.sgbc.sgbcPrj.access.dto.ActorContext;
import com.sgbc.sgbcPrj.access.policy.AccessPolicy;
import com.sgbc.sgbcPrj.access.policy.Operation;
import com.sgbc.sgbcPrj.audit.service.AuditLogService;
import com.sgbc.sgbcPrj.domain.CopyDTO;
import com.sgbc.sgbcPrj.domain.CopyStatus;
import com.sgbc.sgbcPrj.domain.LibraryDTO;
import com.sgbc.sgbcPrj.domain.TitleDTO;
import com.sgbc.sgbcPrj.exception.CirculationException;
import com.sgbc.sgbcPrj.exception.ErrorCode;
import com.sgbc.sgbcPrj.inventory.dto.CopyCreateDTO;
import com.sgbc.sgbcPrj.inventory.dto.LibraryCreateDTO;
import com.sgbc.sgbcPrj.inventory.dto.TitleCreateDTO;
import com.sgbc.sgbcPrj.inventory.mapper.InventoryMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Libraries, catalog titles and physical copies.
 * Copy status is never written here after creation; that belongs to the circulation engine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InventoryService {

    private final InventoryMapper mapper;
    private final AccessPolicy accessPolicy;
    private final AuditLogService auditLogService;
    private final Clock clock;

    @Transactional
    public LibraryDTO createLibrary(LibraryCreateDTO dto, ActorContext actor) {
        accessPolicy.require(actor, Operation.MANAGE_LIBRARIES, null);
        requireText(dto.getName(), "library name");

        LibraryDTO library = new LibraryDTO();
        library.setName(dto.getName().trim());
        library.setCity(dto.getCity());
        library.setAddress(dto.getAddress());
        library.setActive(true);
        mapper.insertLibrary(library);

        auditLogService.record(AuditLogService.CREATE_LIBRARY, actor, "library " + library.getId() + " " + library.getName());
        log.info("library created id={} name={}", library.getId(), library.getName());
        return mapper.selectLibrary(library.getId());
    }

    @Transactional(readOnly = true)
    public LibraryDTO getLibrary(Long id) {
        LibraryDTO library = mapper.selectLibrary(id);
        if (library == null) throw CirculationException.notFound("Library", id);
        return library;
    }

    @Transactional(readOnly = true)
    public List<LibraryDTO> listLibraries() {
        return mapper.selectLibraries();
    }

    @Transactional
    public TitleDTO createTitle(TitleCreateDTO dto, ActorContext actor) {
        accessPolicy.require(actor, Operation.MANAGE_CATALOG, null);
        requireText(dto.getTitle(), "title");
        requireText(dto.getAuthor(), "author");

        TitleDTO title = new TitleDTO();
        title.setTitle(dto.getTitle().trim());
        title.setAuthor(dto.getAuthor().trim());
        title.setCategory(dto.getCategory());
        title.setIsbn(blankToNull(dto.getIsbn()));
        title.setPublisher(dto.getPublisher());
        title.setPubYear(dto.getPubYear());
        mapper.insertTitle(title);

        auditLogService.record(AuditLogService.CREATE_TITLE, actor, "title " + title.getId() + " " + title.getTitle());
        log.info("title created id={} title={}", title.getId(), title.getTitle());
        return mapper.selectTitle(title.getId());
    }

    @Transactional(readOnly = true)
    public TitleDTO getTitle(Long id) {
        TitleDTO title = mapper.selectTitle(id);
        if (title == null) throw CirculationException.notFound("Title", id);
        return title;
    }

    @Transactional(readOnly = true)
    public List<TitleDTO> listTitles() {
        return mapper.selectTitles();
    }

    /** New copies start AVAILABLE at the coordinator's home library. */
    @Transactional
    public CopyDTO createCopy(CopyCreateDTO dto, ActorContext actor) {
        accessPolicy.requireRoleCapable(actor, Operation.MANAGE_LOCAL_INVENTORY);
        Long libraryId = actor.getHomeLibraryId();
        accessPolicy.require(actor, Operation.MANAGE_LOCAL_INVENTORY, libraryId);

        requireText(dto.getCode(), "copy code");
        if (dto.getTitleId() == null) throw CirculationException.invalid("titleId is required");

        // referential integrity: both references must resolve
        getTitle(dto.getTitleId());
        getLibrary(libraryId);

        CopyDTO copy = new CopyDTO();
        copy.setTitleId(dto.getTitleId());
        copy.setLibraryId(libraryId);
        copy.setCode(dto.getCode().trim());
        copy.setStatus(CopyStatus.AVAILABLE);
        copy.setAcquiredAt(LocalDate.now(clock));

        try {
            mapper.insertCopy(copy);
        } catch (DuplicateKeyException e) {
            throw new CirculationException(ErrorCode.VALIDATION_FAILED,
                    "Copy code already used in this library: " + copy.getCode(), e);
        }

        auditLogService.record(AuditLogService.CREATE_COPY, actor, "copy " + copy.getId() + " code " + copy.getCode());
        log.info("copy created id={} libraryId={} code={}", copy.getId(), libraryId, copy.getCode());
        return mapper.selectCopy(copy.getId());
    }

    @Transactional(readOnly = true)
    public CopyDTO getCopy(Long id) {
        CopyDTO copy = mapper.selectCopy(id);
        if (copy == null) throw CirculationException.notFound("Copy", id);
        return copy;
    }

    private void requireText(String value, String field) {
        if (value == null || value.trim().isEmpty()) {
            throw CirculationException.invalid(field + " is required");
        }
    }

    private String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value.trim();
    }
}
