package com.sgbc.sgbcPrj.circulation.service;

import com.sgbc.sgbcPrj.access.dto.ActorContext;
import com.sgbc.sgbcPrj.access.policy.AccessPolicy;
import com.sgbc.sgbcPrj.access.policy.Operation;
import com.sgbc.sgbcPrj.audit.service.AuditLogService;
import com.sgbc.sgbcPrj.circulation.dto.CheckoutResultDTO;
import com.sgbc.sgbcPrj.circulation.dto.ReturnResultDTO;
import com.sgbc.sgbcPrj.circulation.mapper.CirculationMapper;
import com.sgbc.sgbcPrj.config.SgbcProperties;
import com.sgbc.sgbcPrj.domain.CopyDTO;
import com.sgbc.sgbcPrj.domain.CopyStatus;
import com.sgbc.sgbcPrj.domain.LoanDTO;
import com.sgbc.sgbcPrj.domain.LoanStatus;
import com.sgbc.sgbcPrj.domain.Role;
import com.sgbc.sgbcPrj.domain.UserDTO;
import com.sgbc.sgbcPrj.exception.CirculationException;
import com.sgbc.sgbcPrj.exception.ErrorCode;
import com.sgbc.sgbcPrj.inventory.mapper.InventoryMapper;
import com.sgbc.sgbcPrj.member.mapper.MemberMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Checkout / return state machine.
 * The only writer of COPIES.STATUS and of LOANS.
 *
 * <p>Each operation is one transaction. The copy's status flip is a compare-and-set, so two callers
 * racing for the same copy (or the same loan) cannot both win; the loser gets a Conflict and nothing
 * it wrote survives. Nothing is retried here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CirculationService {

    private final CirculationMapper circulationMapper;
    private final InventoryMapper inventoryMapper;
    private final MemberMapper memberMapper;
    private final AccessPolicy accessPolicy;
    private final AuditLogService auditLogService;
    private final SgbcProperties properties;
    private final Clock clock;

    @Transactional
    public CheckoutResultDTO checkout(Long readerId, Long copyId, ActorContext actor) {
        accessPolicy.requireRoleCapable(actor, Operation.CHECKOUT);
        if (readerId == null || copyId == null) {
            throw CirculationException.invalid("readerId and copyId are required");
        }

        // 1) copy + actor scope
        CopyDTO copy = inventoryMapper.selectCopy(copyId);
        if (copy == null) throw CirculationException.notFound("Copy", copyId);
        accessPolicy.require(actor, Operation.CHECKOUT, copy.getLibraryId());

        // 2) reader (row lock keeps the eligibility counts below stable)
        UserDTO reader = memberMapper.selectByIdForUpdate(readerId);
        if (reader == null || reader.getRole() != Role.READER) {
            throw CirculationException.notFound("Reader", readerId);
        }

        // 3) eligibility
        if (!copy.getLibraryId().equals(reader.getLibraryId())) {
            throw reject(ErrorCode.CROSS_LIBRARY_FORBIDDEN,
                    "Reader " + readerId + " belongs to another library than copy " + copyId);
        }
        if (!reader.isActive()) {
            throw reject(ErrorCode.READER_INACTIVE, "Reader " + readerId + " is inactive");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (circulationMapper.countOverdueByReader(readerId, now) > 0) {
            throw reject(ErrorCode.READER_HAS_OVERDUE, "Reader " + readerId + " has overdue loans");
        }
        int limit = properties.getCirculation().getMaxOpenLoansPerReader();
        if (circulationMapper.countOpenByReader(readerId) >= limit) {
            throw reject(ErrorCode.LOAN_LIMIT_REACHED, "Reader " + readerId + " already holds " + limit + " loans");
        }

        // 4) AVAILABLE -> ON_LOAN
        if (copy.getStatus() != CopyStatus.AVAILABLE) {
            throw reject(ErrorCode.NOT_AVAILABLE, "Copy " + copyId + " is " + copy.getStatus());
        }
        if (!transition(copyId, CopyStatus.AVAILABLE, CopyStatus.ON_LOAN)) {
            throw reject(ErrorCode.NOT_AVAILABLE, "Copy " + copyId + " was lent concurrently");
        }

        // 5) OPEN loan
        LoanDTO loan = new LoanDTO();
        loan.setReaderId(readerId);
        loan.setCopyId(copyId);
        loan.setLibraryId(copy.getLibraryId());
        loan.setLoanDate(now);
        loan.setDueDate(now.plusDays(properties.getCirculation().getLoanPeriodDays()));
        loan.setStatus(LoanStatus.OPEN);
        circulationMapper.insertLoan(loan);

        auditLogService.record(AuditLogService.LOAN_CREATE, actor,
                "loan " + loan.getId() + " copy " + copy.getCode() + " reader " + readerId);
        log.info("checkout loanId={} copyId={} readerId={} due={}", loan.getId(), copyId, readerId, loan.getDueDate());

        return new CheckoutResultDTO(loan.getId(), copyId, readerId, loan.getLoanDate(), loan.getDueDate());
    }

    @Transactional
    public ReturnResultDTO returnLoan(Long loanId, ActorContext actor) {
        accessPolicy.requireRoleCapable(actor, Operation.RETURN);

        LoanDTO loan = circulationMapper.selectLoan(loanId);
        if (loan == null) throw CirculationException.notFound("Loan", loanId);
        accessPolicy.require(actor, Operation.RETURN, loan.getLibraryId());

        switch (loan.getStatus()) {
            case OPEN:
                break;
            case RETURNED:
                throw reject(ErrorCode.ALREADY_RETURNED, "Loan " + loanId + " already returned");
            default:
                throw new IllegalStateException("Unhandled loan status: " + loan.getStatus());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        boolean overdue = loan.isOverdueAt(now);

        // 1) OPEN -> RETURNED, guarded against a concurrent return
        int closed;
        try {
            closed = circulationMapper.closeLoan(loanId, now);
        } catch (ConcurrencyFailureException e) {
            throw new CirculationException(ErrorCode.ALREADY_RETURNED, "Loan " + loanId + " returned concurrently", e);
        }
        if (closed == 0) {
            throw reject(ErrorCode.ALREADY_RETURNED, "Loan " + loanId + " returned concurrently");
        }

        // 2) ON_LOAN -> AVAILABLE; anything else means copy and loan disagree, roll everything back
        if (!transition(loan.getCopyId(), CopyStatus.ON_LOAN, CopyStatus.AVAILABLE)) {
            log.error("copy {} is not ON_LOAN while loan {} was OPEN", loan.getCopyId(), loanId);
            throw new IllegalStateException("Copy " + loan.getCopyId() + " not ON_LOAN for open loan " + loanId);
        }

        auditLogService.record(AuditLogService.LOAN_RETURN, actor,
                "loan " + loanId + " copy " + loan.getCopyId() + (overdue ? " overdue" : ""));
        log.info("return loanId={} copyId={} overdue={}", loanId, loan.getCopyId(), overdue);

        return new ReturnResultDTO(loanId, loan.getCopyId(), now, overdue);
    }

    private boolean transition(Long copyId, CopyStatus expected, CopyStatus next) {
        try {
            return inventoryMapper.compareAndSetCopyStatus(copyId, expected, next) == 1;
        } catch (ConcurrencyFailureException e) {
            // the database gave up waiting on the row another transaction is changing
            log.warn("copy {} status {} -> {} lost a concurrent update", copyId, expected, next);
            return false;
        }
    }

    private CirculationException reject(ErrorCode code, String message) {
        log.warn("circulation rejected code={} {}", code, message);
        return new CirculationException(code, message);
    }
}
