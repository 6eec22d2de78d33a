package com.sgbc.sgbcPrj.query.dto;

import com.sgbc.sgbcPrj.domain.CopyStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One copy of a matching title, with where it is and whether it is on the shelf. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TitleSearchDTO {
    private Long titleId;
    private String title;
    private String author;
    private String category;
    private Long libraryId;
    private String libraryName;
    private Long copyId;
    private CopyStatus copyStatus;
}
