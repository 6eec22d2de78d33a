package com.sgbc.sgbcPrj.domain;

public enum Role {
    NETWORK_ADMIN,
    LOCAL_COORDINATOR,
    READER
}
