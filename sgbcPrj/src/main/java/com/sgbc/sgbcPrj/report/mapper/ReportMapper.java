package com.sgbc.sgbcPrj.report.mapper;

import com.sgbc.sgbcPrj.report.dto.CountRowDTO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface ReportMapper {

    long countLibraries();

    long countTitles();

    long countOpenLoans();

    List<CountRowDTO> countLoansPerMonth(@Param("libraryId") Long libraryId);

    List<CountRowDTO> countLoansPerStatus(@Param("libraryId") Long libraryId);
}
