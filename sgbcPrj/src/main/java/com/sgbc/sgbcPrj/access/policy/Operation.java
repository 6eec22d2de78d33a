package com.sgbc.sgbcPrj.access.policy;

public enum Operation {
    CHECKOUT,
    RETURN,
    VIEW_LOCAL_INVENTORY,
    MANAGE_LOCAL_INVENTORY,
    MANAGE_READERS,
    VIEW_LOCAL_REPORTS,
    MANAGE_LIBRARIES,
    MANAGE_CATALOG,
    MANAGE_STAFF,
    VIEW_NETWORK_DASHBOARD,
    SEARCH
}
