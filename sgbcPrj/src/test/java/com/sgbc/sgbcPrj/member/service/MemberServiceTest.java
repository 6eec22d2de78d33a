package com.sgbc.sgbcPrj.member.service;

import com.sgbc.sgbcPrj.access.dto.ActorContext;
import com.sgbc.sgbcPrj.access.policy.AccessPolicy;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MemberServiceTest {

    @Mock
    private MemberMapper mapper;
    @Mock
    private InventoryService inventoryService;
    @Mock
    private AuditLogService auditLogService;
    @Mock
    private PasswordEncoder passwordEncoder;

    private MemberService service;
    private final ActorContext admin = new ActorContext(1L, Role.NETWORK_ADMIN, null);
    private final ActorContext coordinator = new ActorContext(10L, Role.LOCAL_COORDINATOR, 2L);

    @BeforeEach
    void setUp() {
        service = new MemberService(mapper, inventoryService, new AccessPolicy(), auditLogService, passwordEncoder);
    }

    @Test
    void coordinatorPasswordIsStoredHashed() {
        when(passwordEncoder.encode("s3nha")).thenReturn("$2a$hash");

        MemberViewDTO view = service.registerCoordinator(new CoordinatorCreateDTO(" Ana ", "ana@rede.com", "s3nha", 2L), admin);

        ArgumentCaptor<UserDTO> saved = ArgumentCaptor.forClass(UserDTO.class);
        verify(mapper).insertUser(saved.capture());
        assertThat(saved.getValue().getPassword()).isEqualTo("$2a$hash");
        assertThat(saved.getValue().getName()).isEqualTo("Ana");
        assertThat(view.getRole()).isEqualTo(Role.LOCAL_COORDINATOR);
        verify(inventoryService).getLibrary(2L);
        verify(auditLogService).record(eq(AuditLogService.REGISTER_COORDINATOR), eq(admin), any());
    }

    @Test
    void onlyAdminRegistersCoordinators() {
        assertThatThrownBy(() -> service.registerCoordinator(new CoordinatorCreateDTO("Ana", "a@r.com", "x", 2L), coordinator))
                .isInstanceOf(CirculationException.class)
                .extracting(e -> ((CirculationException) e).getCode())
                .isEqualTo(ErrorCode.FORBIDDEN);
        verifyNoInteractions(mapper, passwordEncoder);
    }

    @Test
    void readerWithoutConsentIsRejected() {
        assertThatThrownBy(() -> service.registerReader(new ReaderCreateDTO("Capitu", "c@x.com", null, null, false), coordinator))
                .extracting(e -> ((CirculationException) e).getCode())
                .isEqualTo(ErrorCode.VALIDATION_FAILED);
        verify(mapper, never()).insertUser(any());
    }

    @Test
    void duplicateEmailBecomesValidationFailure() {
        doThrow(new DuplicateKeyException("uk_users_email")).when(mapper).insertUser(any());

        assertThatThrownBy(() -> service.registerReader(new ReaderCreateDTO("Capitu", "c@x.com", null, null, true), coordinator))
                .extracting(e -> ((CirculationException) e).getCode())
                .isEqualTo(ErrorCode.VALIDATION_FAILED);
        verifyNoInteractions(auditLogService);
    }

    @Test
    void readerIsBoundToCoordinatorHomeLibrary() {
        MemberViewDTO view = service.registerReader(new ReaderCreateDTO("Capitu", "c@x.com", "123", null, true), coordinator);

        assertThat(view.getLibraryId()).isEqualTo(2L);
        assertThat(view.getRole()).isEqualTo(Role.READER);
        assertThat(view.isActive()).isTrue();
    }
}
