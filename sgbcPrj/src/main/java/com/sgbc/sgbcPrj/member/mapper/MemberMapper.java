package com.sgbc.sgbcPrj.member.mapper;

import com.sgbc.sgbcPrj.domain.Role;
import com.sgbc.sgbcPrj.domain.UserDTO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface MemberMapper {

    int insertUser(UserDTO user);

    UserDTO selectById(@Param("id") Long id);

    /** SELECT ... FOR UPDATE: serializes checkouts of the same reader */
    UserDTO selectByIdForUpdate(@Param("id") Long id);

    UserDTO selectByEmail(@Param("email") String email);

    List<UserDTO> selectByLibraryAndRole(@Param("libraryId") Long libraryId,
                                         @Param("role") Role role);

    long countByRole(@Param("role") Role role);
}
