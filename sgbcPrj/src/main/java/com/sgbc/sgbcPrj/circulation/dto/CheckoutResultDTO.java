package com.sgbc.sgbcPrj.circulation.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutResultDTO {
    private Long loanId;
    private Long copyId;
    private Long readerId;
    private LocalDateTime loanDate;
    private LocalDateTime dueDate;
}
