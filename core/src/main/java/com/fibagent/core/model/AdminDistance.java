package com.fibagent.core.model;

/**
 * Administrative distance of a route source.
 * <p>
 * Lower values are preferred when several clients program the same prefix.
 * </p>
 */
public enum AdminDistance {
    DIRECTLY_CONNECTED(0),
    STATIC_ROUTE(1),
    OPENR(10),
    EBGP(20),
    IBGP(200),
    MAX_ADMIN_DISTANCE(255);

    private final int value;

    AdminDistance(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }
}
