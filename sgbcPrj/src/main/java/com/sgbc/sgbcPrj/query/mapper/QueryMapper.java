package com.sgbc.sgbcPrj.query.mapper;

import com.sgbc.sgbcPrj.query.dto.OpenLoanDTO;
import com.sgbc.sgbcPrj.query.dto.TitleSearchDTO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface QueryMapper {

    /** OPEN loans of a library joined with reader and title, earliest due date first */
    List<OpenLoanDTO> selectOpenLoansByLibrary(@Param("libraryId") Long libraryId);

    /**
     * @param pattern   lower-case LIKE pattern, wildcards already escaped
     * @param libraryId optional filter, null for the whole network
     */
    List<TitleSearchDTO> searchTitles(@Param("pattern") String pattern,
                                      @Param("libraryId") Long libraryId);
}
