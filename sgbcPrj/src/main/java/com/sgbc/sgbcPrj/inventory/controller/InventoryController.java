package com.sgbc.sgbcPrj.inventory.controller;

import com.sgbc.sgbcPrj.access.security.Actors;
import com.sgbc.sgbcPrj.domain.CopyDTO;
import com.sgbc.sgbcPrj.domain.LibraryDTO;
import com.sgbc.sgbcPrj.domain.TitleDTO;
import com.sgbc.sgbcPrj.inventory.dto.CopyCreateDTO;
import com.sgbc.sgbcPrj.inventory.dto.LibraryCreateDTO;
import com.sgbc.sgbcPrj.inventory.dto.TitleCreateDTO;
import com.sgbc.sgbcPrj.inventory.service.InventoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class InventoryController {

    private final InventoryService service;

    /** Network admin registers a library */
    @PostMapping("/libraries")
    public ResponseEntity<LibraryDTO> createLibrary(@RequestBody LibraryCreateDTO dto, Authentication auth) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.createLibrary(dto, Actors.from(auth)));
    }

    @GetMapping("/libraries")
    public List<LibraryDTO> libraries() {
        return service.listLibraries();
    }

    @GetMapping("/libraries/{id}")
    public LibraryDTO library(@PathVariable Long id) {
        return service.getLibrary(id);
    }

    @PostMapping("/titles")
    public ResponseEntity<TitleDTO> createTitle(@RequestBody TitleCreateDTO dto, Authentication auth) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.createTitle(dto, Actors.from(auth)));
    }

    @GetMapping("/titles")
    public List<TitleDTO> titles() {
        return service.listTitles();
    }

    @GetMapping("/titles/{id}")
    public TitleDTO title(@PathVariable Long id) {
        return service.getTitle(id);
    }

    /** Coordinator adds a physical copy to the home library's shelf */
    @PostMapping("/copies")
    public ResponseEntity<CopyDTO> createCopy(@RequestBody CopyCreateDTO dto, Authentication auth) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.createCopy(dto, Actors.from(auth)));
    }
}
