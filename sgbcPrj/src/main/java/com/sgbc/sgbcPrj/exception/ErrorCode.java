package com.sgbc.sgbcPrj.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // NotFound
    NOT_FOUND(Kind.NOT_FOUND, HttpStatus.NOT_FOUND),

    // Conflict: copy or loan state changed under the caller
    NOT_AVAILABLE(Kind.CONFLICT, HttpStatus.CONFLICT),
    ALREADY_RETURNED(Kind.CONFLICT, HttpStatus.CONFLICT),

    // Forbidden
    FORBIDDEN(Kind.FORBIDDEN, HttpStatus.FORBIDDEN),
    CROSS_LIBRARY_FORBIDDEN(Kind.FORBIDDEN, HttpStatus.FORBIDDEN),

    // reader eligibility
    READER_INACTIVE(Kind.NOT_ELIGIBLE, HttpStatus.UNPROCESSABLE_ENTITY),
    READER_HAS_OVERDUE(Kind.NOT_ELIGIBLE, HttpStatus.UNPROCESSABLE_ENTITY),
    LOAN_LIMIT_REACHED(Kind.NOT_ELIGIBLE, HttpStatus.UNPROCESSABLE_ENTITY),

    // malformed input, duplicate keys
    VALIDATION_FAILED(Kind.VALIDATION_FAILED, HttpStatus.BAD_REQUEST);

    private final Kind kind;
    private final HttpStatus httpStatus;

    public enum Kind {
        NOT_FOUND,
        CONFLICT,
        FORBIDDEN,
        NOT_ELIGIBLE,
        VALIDATION_FAILED
    }
}
