package com.sgbc.sgbcPrj.inventory.mapper;

import com.sgbc.sgbcPrj.domain.CopyDTO;
import com.sgbc.sgbcPrj.domain.CopyStatus;
import com.sgbc.sgbcPrj.domain.LibraryDTO;
import com.sgbc.sgbcPrj.domain.TitleDTO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface InventoryMapper {

    // LIBRARIES
    int insertLibrary(LibraryDTO library);

    LibraryDTO selectLibrary(@Param("id") Long id);

    List<LibraryDTO> selectLibraries();

    // TITLES (network catalog)
    int insertTitle(TitleDTO title);

    TitleDTO selectTitle(@Param("id") Long id);

    List<TitleDTO> selectTitles();

    // COPIES
    int insertCopy(CopyDTO copy);

    CopyDTO selectCopy(@Param("id") Long id);

    /** status == null -> every status */
    List<CopyDTO> selectCopiesByLibrary(@Param("libraryId") Long libraryId,
                                        @Param("status") CopyStatus status);

    /**
     * Compare-and-set on COPIES.STATUS.
     * Only the circulation engine calls this; 0 means the copy was not in {@code expected}.
     */
    int compareAndSetCopyStatus(@Param("id") Long id,
                                @Param("expected") CopyStatus expected,
                                @Param("next") CopyStatus next);
}
