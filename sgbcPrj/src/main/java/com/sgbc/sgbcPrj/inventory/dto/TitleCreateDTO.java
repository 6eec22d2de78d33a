package com.sgbc.sgbcPrj.inventory.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TitleCreateDTO {
    private String title;
    private String author;
    private String category;
    private String isbn;
    private String publisher;
    private Integer pubYear;
}
