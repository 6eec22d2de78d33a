package com.sgbc.sgbcPrj.circulation.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReturnResultDTO {
    private Long loanId;
    private Long copyId;
    private LocalDateTime returnDate;
    private boolean overdue;   // came back after its due date
}
