package com.sgbc.sgbcPrj.audit.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface AuditLogMapper {

    int insert(@Param("action") String action,
               @Param("actorId") Long actorId,
               @Param("details") String details);

    long countByAction(@Param("action") String action);
}
