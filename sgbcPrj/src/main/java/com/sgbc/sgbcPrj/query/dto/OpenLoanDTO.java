package com.sgbc.sgbcPrj.query.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OpenLoanDTO {
    private Long loanId;
    private Long readerId;
    private String readerName;
    private Long copyId;
    private String copyCode;
    private String title;
    private LocalDateTime loanDate;
    private LocalDateTime dueDate;
    private boolean overdue;   // computed at query time, not a column
}
