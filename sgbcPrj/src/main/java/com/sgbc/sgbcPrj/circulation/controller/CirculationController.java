package com.sgbc.sgbcPrj.circulation.controller;

import com.sgbc.sgbcPrj.access.security.Actors;
import com.sgbc.sgbcPrj.circulation.dto.CheckoutRequestDTO;
import com.sgbc.sgbcPrj.circulation.dto.CheckoutResultDTO;
import com.sgbc.sgbcPrj.circulation.dto.ReturnResultDTO;
import com.sgbc.sgbcPrj.circulation.service.CirculationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

/** Circulation desk: checkout and return. Failures are rendered by GlobalExceptionHandler. */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/circulation")
public class CirculationController {

    private final CirculationService service;

    @PostMapping("/checkout")
    public ResponseEntity<CheckoutResultDTO> checkout(@RequestBody CheckoutRequestDTO request, Authentication auth) {
        CheckoutResultDTO result = service.checkout(request.getReaderId(), request.getCopyId(), Actors.from(auth));
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @PostMapping("/loans/{loanId}/return")
    public ReturnResultDTO returnLoan(@PathVariable Long loanId, Authentication auth) {
        return service.returnLoan(loanId, Actors.from(auth));
    }
}
