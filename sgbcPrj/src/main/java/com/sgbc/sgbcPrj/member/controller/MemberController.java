package com.sgbc.sgbcPrj.member.controller;

import com.sgbc.sgbcPrj.access.security.Actors;
import com.sgbc.sgbcPrj.member.dto.CoordinatorCreateDTO;
import com.sgbc.sgbcPrj.member.dto.MemberViewDTO;
import com.sgbc.sgbcPrj.member.dto.ReaderCreateDTO;
import com.sgbc.sgbcPrj.member.service.MemberService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class MemberController {

    private final MemberService service;

    @PostMapping("/readers")
    public ResponseEntity<MemberViewDTO> registerReader(@RequestBody ReaderCreateDTO dto, Authentication auth) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.registerReader(dto, Actors.from(auth)));
    }

    @GetMapping("/libraries/{libraryId}/readers")
    public List<MemberViewDTO> readers(@PathVariable Long libraryId, Authentication auth) {
        return service.listReaders(libraryId, Actors.from(auth));
    }

    @PostMapping("/staff/coordinators")
    public ResponseEntity<MemberViewDTO> registerCoordinator(@RequestBody CoordinatorCreateDTO dto, Authentication auth) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.registerCoordinator(dto, Actors.from(auth)));
    }
}
