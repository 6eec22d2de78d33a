package com.sgbc.sgbcPrj.audit.service;

import com.sgbc.sgbcPrj.access.dto.ActorContext;
import com.sgbc.sgbcPrj.audit.mapper.AuditLogMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records who did what in AUDIT_LOGS.
 * Joins the caller's transaction, so a rolled back operation leaves no audit row either.
 */
@Service
@RequiredArgsConstructor
public class AuditLogService {

    public static final String LOAN_CREATE = "loan_create";
    public static final String LOAN_RETURN = "loan_return";
    public static final String CREATE_LIBRARY = "create_library";
    public static final String CREATE_TITLE = "create_title";
    public static final String CREATE_COPY = "create_copy";
    public static final String REGISTER_READER = "register_reader";
    public static final String REGISTER_COORDINATOR = "register_coordinator";

    private final AuditLogMapper mapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public void record(String action, ActorContext actor, String details) {
        mapper.insert(action, actor == null ? null : actor.getUserId(), details);
    }
}
