package com.sgbc.sgbcPrj.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@AllArgsConstructor
@NoArgsConstructor
@Data
public class LoanDTO {

    private Long id;
    private Long readerId;
    private Long copyId;
    private Long libraryId;      // copy's library, denormalized for scoped queries
    private LocalDateTime loanDate;
    private LocalDateTime dueDate;
    private LocalDateTime returnDate; // null while OPEN
    private LoanStatus status;

    /** Derived, never stored: OPEN and past its due date. */
    public boolean isOverdueAt(LocalDateTime now) {
        return status == LoanStatus.OPEN && dueDate.isBefore(now);
    }
}
