package com.sgbc.sgbcPrj.domain;

/**
 * Availability of a physical copy.
 * AVAILABLE -> ON_LOAN -> AVAILABLE ... (written only by the circulation engine)
 */
public enum CopyStatus {
    AVAILABLE,
    ON_LOAN
}
