package com.sgbc.sgbcPrj.domain;

/** A loan is OPEN until its copy comes back, then RETURNED for good. */
public enum LoanStatus {
    OPEN,
    RETURNED
}
