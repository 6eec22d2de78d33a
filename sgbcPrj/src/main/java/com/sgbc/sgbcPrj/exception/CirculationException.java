package com.sgbc.sgbcPrj.exception;

import lombok.Getter;

/**
 * Typed failure of a circulation, inventory or query operation.
 * Thrown before any write or from inside the transaction, so the caller never sees a partial mutation.
 */
@Getter
public class CirculationException extends RuntimeException {

    private final ErrorCode code;

    public CirculationException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public CirculationException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static CirculationException notFound(String what, Long id) {
        return new CirculationException(ErrorCode.NOT_FOUND, what + " not found: " + id);
    }

    public static CirculationException forbidden(String message) {
        return new CirculationException(ErrorCode.FORBIDDEN, message);
    }

    public static CirculationException invalid(String message) {
        return new CirculationException(ErrorCode.VALIDATION_FAILED, message);
    }
}
