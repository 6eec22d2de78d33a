package com.sgbc.sgbcPrj.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/** Physical copy owned by exactly one library for its whole life (COPIES). */
@AllArgsConstructor
@NoArgsConstructor
@Data
public class CopyDTO {

    private Long id;
    private Long titleId;
    private Long libraryId;
    private String code;         // label, unique inside its library
    private CopyStatus status;
    private LocalDate acquiredAt;

    // joined for display, not stored on COPIES
    private String title;
    private String author;
}
