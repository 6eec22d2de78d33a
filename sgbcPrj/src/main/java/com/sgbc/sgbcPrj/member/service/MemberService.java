package com.sgbc.sgbcPrj.member.service;

import com.sgbc.sgbcPrj.access.dto.ActorContext;
import com.sgbc.sgbcPrj.access.policy.AccessPolicy;
import com.sgbc.sgbcPrj.access.policy.Operation;
import com.sgbc.sgbcPrj.audit.service.AuditLogService;
import com.sgbc.sgbcPrj.domain.Role;
import com.sgbc.sgbcPrj.domain.UserDTO;
import com.sgbc.sgbcPrj.exception.CirculationException;
import com.sgbc.sgbcPrj.exception.ErrorCode;
import com.sgbc.sgbcPrj.inventory.service.InventoryService;
import com.sgbc.sgbcPrj.member.dto.CoordinatorCreateDTO;
import com.sgbc.sgbcPrj.member.dto.MemberViewDTO;
import com.sgbc.sgbcPrj.member.dto.ReaderCreateDTO;
import com.sgbc.sgbcPrj.member.mapper.MemberMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Readers and staff accounts.
 * USERS.EMAIL is unique across the whole network, readers included.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemberService {

    private final MemberMapper mapper;
    private final InventoryService inventoryService;
    private final AccessPolicy accessPolicy;
    private final AuditLogService auditLogService;
    private final PasswordEncoder passwordEncoder;

    /** Reader is bound to the coordinator's home library. */
    @Transactional
    public MemberViewDTO registerReader(ReaderCreateDTO dto, ActorContext actor) {
        accessPolicy.requireRoleCapable(actor, Operation.MANAGE_READERS);
        Long libraryId = actor.getHomeLibraryId();
        accessPolicy.require(actor, Operation.MANAGE_READERS, libraryId);

        requireText(dto.getName(), "reader name");
        requireText(dto.getEmail(), "reader contact");
        if (!dto.isPrivacyConsent()) {
            throw CirculationException.invalid("privacy consent is required to register a reader");
        }

        UserDTO reader = new UserDTO();
        reader.setName(dto.getName().trim());
        reader.setEmail(dto.getEmail().trim());
        reader.setDocument(dto.getDocument());
        reader.setPhone(dto.getPhone());
        reader.setRole(Role.READER);
        reader.setLibraryId(libraryId);
        reader.setActive(true);
        insert(reader);

        auditLogService.record(AuditLogService.REGISTER_READER, actor, "reader " + reader.getId() + " library " + libraryId);
        log.info("reader registered id={} libraryId={}", reader.getId(), libraryId);
        return MemberViewDTO.of(reader);
    }

    @Transactional
    public MemberViewDTO registerCoordinator(CoordinatorCreateDTO dto, ActorContext actor) {
        accessPolicy.require(actor, Operation.MANAGE_STAFF, null);

        requireText(dto.getName(), "coordinator name");
        requireText(dto.getEmail(), "coordinator email");
        requireText(dto.getPassword(), "initial password");
        if (dto.getLibraryId() == null) throw CirculationException.invalid("libraryId is required");
        inventoryService.getLibrary(dto.getLibraryId());

        UserDTO coordinator = new UserDTO();
        coordinator.setName(dto.getName().trim());
        coordinator.setEmail(dto.getEmail().trim());
        coordinator.setPassword(passwordEncoder.encode(dto.getPassword()));
        coordinator.setRole(Role.LOCAL_COORDINATOR);
        coordinator.setLibraryId(dto.getLibraryId());
        coordinator.setActive(true);
        insert(coordinator);

        auditLogService.record(AuditLogService.REGISTER_COORDINATOR, actor,
                "coordinator " + coordinator.getId() + " library " + dto.getLibraryId());
        log.info("coordinator registered id={} libraryId={}", coordinator.getId(), dto.getLibraryId());
        return MemberViewDTO.of(coordinator);
    }

    @Transactional(readOnly = true)
    public List<MemberViewDTO> listReaders(Long libraryId, ActorContext actor) {
        accessPolicy.require(actor, Operation.VIEW_LOCAL_INVENTORY, libraryId);
        return mapper.selectByLibraryAndRole(libraryId, Role.READER).stream()
                .map(MemberViewDTO::of)
                .collect(Collectors.toList());
    }

    private void insert(UserDTO user) {
        try {
            mapper.insertUser(user);
        } catch (DuplicateKeyException e) {
            throw new CirculationException(ErrorCode.VALIDATION_FAILED, "Email already registered: " + user.getEmail(), e);
        }
    }

    private void requireText(String value, String field) {
        if (value == null || value.trim().isEmpty()) {
            throw CirculationException.invalid(field + " is required");
        }
    }
}
