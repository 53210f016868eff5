package com.fibagent.core.model;

import lombok.Value;

/**
 * Identifier of a routing domain (VRF).
 */
@Value
public class RouterId implements Comparable<RouterId> {
    public static final RouterId DEFAULT = new RouterId(0);

    int id;

    public RouterId(int id) {
        if (id < 0) {
            throw new IllegalArgumentException("Router id must be non-negative: " + id);
        }
        this.id = id;
    }

    public static RouterId of(int id) {
        return id == 0 ? DEFAULT : new RouterId(id);
    }

    @Override
    public int compareTo(RouterId other) {
        return Integer.compare(id, other.id);
    }

    @Override
    public String toString() {
        return "RouterID(" + id + ")";
    }
}
