package com.sgbc.sgbcPrj.config;

import com.sgbc.sgbcPrj.domain.LibraryDTO;
import com.sgbc.sgbcPrj.domain.Role;
import com.sgbc.sgbcPrj.domain.UserDTO;
import com.sgbc.sgbcPrj.inventory.mapper.InventoryMapper;
import com.sgbc.sgbcPrj.member.mapper.MemberMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * First start of an empty network: one admin account and the central library.
 * Skipped once any NETWORK_ADMIN exists.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InitialDataRunner implements ApplicationRunner {

    private final SgbcProperties properties;
    private final MemberMapper memberMapper;
    private final InventoryMapper inventoryMapper;
    private final PasswordEncoder passwordEncoder;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        SgbcProperties.Seed seed = properties.getSeed();
        if (!seed.isEnabled()) {
            return;
        }
        if (memberMapper.countByRole(Role.NETWORK_ADMIN) > 0) {
            log.debug("seed skipped: network admin already present");
            return;
        }

        UserDTO admin = new UserDTO();
        admin.setName(seed.getAdminName());
        admin.setEmail(seed.getAdminEmail());
        admin.setPassword(passwordEncoder.encode(seed.getAdminPassword()));
        admin.setRole(Role.NETWORK_ADMIN);
        admin.setActive(true);
        memberMapper.insertUser(admin);

        LibraryDTO central = new LibraryDTO();
        central.setName(seed.getCentralLibraryName());
        central.setCity(seed.getCentralLibraryCity());
        central.setActive(true);
        inventoryMapper.insertLibrary(central);

        log.info("seeded network admin {} and library id={}", admin.getEmail(), central.getId());
    }
}
