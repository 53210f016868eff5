package com.fibagent.core.delta;

import com.fibagent.core.model.AddressFamily;
import com.fibagent.core.model.Route;
import com.fibagent.core.model.RoutePrefix;
import com.fibagent.core.model.RouterId;
import lombok.Value;

/**
 * One prefix-level difference between two FIB snapshots.
 */
@Value
public class RouteChange {
    public enum Kind {
        ADDED,
        REMOVED,
        CHANGED
    }

    Kind kind;
    RouterId routerId;
    AddressFamily family;
    RoutePrefix prefix;

    /**
     * Route in the old snapshot; null for {@link Kind#ADDED}.
     */
    Route oldRoute;

    /**
     * Route in the new snapshot; null for {@link Kind#REMOVED}.
     */
    Route newRoute;

    public static RouteChange added(RouterId routerId, Route route) {
        return new RouteChange(Kind.ADDED, routerId, route.getFamily(), route.getPrefix(), null, route);
    }

    public static RouteChange removed(RouterId routerId, Route route) {
        return new RouteChange(Kind.REMOVED, routerId, route.getFamily(), route.getPrefix(), route, null);
    }

    public static RouteChange changed(RouterId routerId, Route oldRoute, Route newRoute) {
        if (!oldRoute.getPrefix().equals(newRoute.getPrefix())) {
            throw new IllegalArgumentException(
                    "Changed routes must share a prefix: " + oldRoute.getPrefix() + " vs " + newRoute.getPrefix());
        }
        return new RouteChange(Kind.CHANGED, routerId, newRoute.getFamily(), newRoute.getPrefix(), oldRoute, newRoute);
    }
}
