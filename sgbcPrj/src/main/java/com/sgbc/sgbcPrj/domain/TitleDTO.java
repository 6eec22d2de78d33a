package com.sgbc.sgbcPrj.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/** Catalog entry shared by the whole network (TITLES). */
@AllArgsConstructor
@NoArgsConstructor
@Data
public class TitleDTO {

    private Long id;
    private String title;
    private String author;
    private String isbn;         // optional
    private String publisher;
    private String category;
    private Integer pubYear;
    private LocalDateTime createdAt;
}
