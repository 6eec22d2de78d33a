package com.sgbc.sgbcPrj.inventory.service;

import com.sgbc.sgbcPrj.access.dto.ActorContext;
import com.sgbc.sgbcPrj.circulation.mapper.CirculationMapper;
import com.sgbc.sgbcPrj.domain.CopyDTO;
import com.sgbc.sgbcPrj.domain.CopyStatus;
import com.sgbc.sgbcPrj.domain.LibraryDTO;
import com.sgbc.sgbcPrj.domain.Role;
import com.sgbc.sgbcPrj.domain.TitleDTO;
import com.sgbc.sgbcPrj.exception.CirculationException;
import com.sgbc.sgbcPrj.exception.ErrorCode;
import com.sgbc.sgbcPrj.inventory.dto.CopyCreateDTO;
import com.sgbc.sgbcPrj.inventory.dto.LibraryCreateDTO;
import com.sgbc.sgbcPrj.inventory.dto.TitleCreateDTO;
import com.sgbc.sgbcPrj.inventory.mapper.InventoryMapper;
import com.sgbc.sgbcPrj.member.dto.CoordinatorCreateDTO;
import com.sgbc.sgbcPrj.member.dto.MemberViewDTO;
import com.sgbc.sgbcPrj.member.dto.ReaderCreateDTO;
import com.sgbc.sgbcPrj.member.mapper.MemberMapper;
import com.sgbc.sgbcPrj.member.service.MemberService;
import com.sgbc.sgbcPrj.support.CirculationFixtures;
import com.sgbc.sgbcPrj.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(TestClockConfig.class)
class InventoryServiceIntegrationTest {

    @Autowired
    private InventoryService inventoryService;
    @Autowired
    private MemberService memberService;
    @Autowired
    private InventoryMapper inventoryMapper;
    @Autowired
    private MemberMapper memberMapper;
    @Autowired
    private CirculationMapper circulationMapper;
    @Autowired
    private PasswordEncoder passwordEncoder;

    private CirculationFixtures fx;
    private ActorContext admin;

    @BeforeEach
    void setUp() {
        fx = new CirculationFixtures(inventoryMapper, memberMapper, circulationMapper);
        admin = fx.admin();
    }

    @Test
    void adminBuildsNetworkAndCoordinatorStocksShelf() {
        LibraryDTO library = inventoryService.createLibrary(new LibraryCreateDTO("Biblioteca Norte", "Capital", "Rua 1"), admin);
        TitleDTO title = inventoryService.createTitle(
                new TitleCreateDTO("Memórias Póstumas de Brás Cubas", "Machado de Assis", "Romance", "", null, 1881), admin);

        String email = UUID.randomUUID() + "@rede.test";
        MemberViewDTO coordinator = memberService.registerCoordinator(
                new CoordinatorCreateDTO("Coord Norte", email, "s3nha", library.getId()), admin);
        assertThat(coordinator.getRole()).isEqualTo(Role.LOCAL_COORDINATOR);
        assertThat(passwordEncoder.matches("s3nha", memberMapper.selectByEmail(email).getPassword())).isTrue();

        ActorContext coord = new ActorContext(coordinator.getId(), Role.LOCAL_COORDINATOR, library.getId());
        CopyDTO copy = inventoryService.createCopy(new CopyCreateDTO(title.getId(), "BC-001"), coord);

        assertThat(copy.getLibraryId()).isEqualTo(library.getId());
        assertThat(copy.getStatus()).isEqualTo(CopyStatus.AVAILABLE);
        assertThat(copy.getTitle()).isEqualTo("Memórias Póstumas de Brás Cubas");
        assertThat(title.getIsbn()).isNull();
        assertThat(library.isActive()).isTrue();
    }

    @Test
    void duplicateCopyCodeInSameLibraryIsRejected() {
        LibraryDTO library = fx.library("Biblioteca Sul " + System.nanoTime());
        TitleDTO title = fx.title("Iracema", "José de Alencar");
        ActorContext coord = fx.coordinatorOf(library);
        inventoryService.createCopy(new CopyCreateDTO(title.getId(), "IR-1"), coord);

        assertThatThrownBy(() -> inventoryService.createCopy(new CopyCreateDTO(title.getId(), "IR-1"), coord))
                .extracting(e -> ((CirculationException) e).getCode())
                .isEqualTo(ErrorCode.VALIDATION_FAILED);

        // same code at another library is fine
        LibraryDTO other = fx.library("Biblioteca Leste " + System.nanoTime());
        CopyDTO copy = inventoryService.createCopy(new CopyCreateDTO(title.getId(), "IR-1"), fx.coordinatorOf(other));
        assertThat(copy.getId()).isNotNull();
    }

    @Test
    void copyOfUnknownTitleIsNotFound() {
        ActorContext coord = fx.coordinatorOf(fx.library("Biblioteca Oeste " + System.nanoTime()));

        assertThatThrownBy(() -> inventoryService.createCopy(new CopyCreateDTO(987_654L, "X"), coord))
                .extracting(e -> ((CirculationException) e).getCode())
                .isEqualTo(ErrorCode.NOT_FOUND);
    }

    @Test
    void roleBoundariesOnRegistration() {
        LibraryDTO library = fx.library("Biblioteca Centro " + System.nanoTime());
        ActorContext coord = fx.coordinatorOf(library);

        assertThatThrownBy(() -> inventoryService.createTitle(new TitleCreateDTO("T", "A", null, null, null, null), coord))
                .extracting(e -> ((CirculationException) e).getCode())
                .isEqualTo(ErrorCode.FORBIDDEN);
        assertThatThrownBy(() -> inventoryService.createCopy(new CopyCreateDTO(1L, "A-1"), admin))
                .extracting(e -> ((CirculationException) e).getCode())
                .isEqualTo(ErrorCode.FORBIDDEN);
        assertThatThrownBy(() -> inventoryService.createLibrary(new LibraryCreateDTO(" ", null, null), admin))
                .extracting(e -> ((CirculationException) e).getCode())
                .isEqualTo(ErrorCode.VALIDATION_FAILED);
    }

    @Test
    void readersBelongToCoordinatorLibraryAndEmailIsUniqueNetworkWide() {
        LibraryDTO l1 = fx.library("Biblioteca A " + System.nanoTime());
        LibraryDTO l2 = fx.library("Biblioteca B " + System.nanoTime());
        String email = UUID.randomUUID() + "@leitor.test";

        MemberViewDTO reader = memberService.registerReader(
                new ReaderCreateDTO("Capitu", email, null, null, true), fx.coordinatorOf(l1));
        assertThat(reader.getLibraryId()).isEqualTo(l1.getId());
        assertThat(reader.getRole()).isEqualTo(Role.READER);

        assertThatThrownBy(() -> memberService.registerReader(
                new ReaderCreateDTO("Capitu", email, null, null, true), fx.coordinatorOf(l2)))
                .extracting(e -> ((CirculationException) e).getCode())
                .isEqualTo(ErrorCode.VALIDATION_FAILED);

        assertThatThrownBy(() -> memberService.registerReader(
                new ReaderCreateDTO("Bentinho", UUID.randomUUID() + "@x.test", null, null, false), fx.coordinatorOf(l1)))
                .extracting(e -> ((CirculationException) e).getCode())
                .isEqualTo(ErrorCode.VALIDATION_FAILED);

        assertThat(memberService.listReaders(l1.getId(), admin))
                .extracting(MemberViewDTO::getEmail)
                .containsExactly(email);
    }
}
