package com.sgbc.sgbcPrj.circulation.mapper;

import com.sgbc.sgbcPrj.domain.LoanDTO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;

@Mapper
public interface CirculationMapper {

    int insertLoan(LoanDTO loan);

    LoanDTO selectLoan(@Param("id") Long id);

    /** OPEN -> RETURNED; 0 when the loan was already closed */
    int closeLoan(@Param("id") Long id,
                  @Param("returnDate") LocalDateTime returnDate);

    long countOpenByReader(@Param("readerId") Long readerId);

    long countOverdueByReader(@Param("readerId") Long readerId,
                              @Param("now") LocalDateTime now);

    long countOpenByCopy(@Param("copyId") Long copyId);
}
