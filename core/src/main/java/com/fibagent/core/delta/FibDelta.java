package com.fibagent.core.delta;

import com.fibagent.core.model.Route;
import com.fibagent.core.model.RoutePrefix;
import com.fibagent.core.model.RouterId;
import com.fibagent.core.state.Fib;

import java.util.Iterator;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Differences between two versions of one FIB.
 * <p>
 * Computed by a merge-walk over the two prefix-sorted route maps: each prefix
 * present on either side is visited once. A prefix whose route is the same
 * instance, or an equal value, on both sides yields nothing.
 * </p>
 */
public final class FibDelta {
    private final RouterId routerId;
    private final Fib oldFib;
    private final Fib newFib;

    public FibDelta(RouterId routerId, Fib oldFib, Fib newFib) {
        if (oldFib.getFamily() != newFib.getFamily()) {
            throw new IllegalArgumentException(
                    "Cannot diff a " + oldFib.getFamily() + " FIB against a " + newFib.getFamily() + " FIB");
        }
        this.routerId = routerId;
        this.oldFib = oldFib;
        this.newFib = newFib;
    }

    RouterId getRouterId() {
        return routerId;
    }

    /**
     * Visits every change in prefix order.
     */
    public void forEachChange(Consumer<RouteChange> consumer) {
        if (oldFib == newFib) {
            return;
        }
        Iterator<Map.Entry<RoutePrefix, Route>> oldIt = oldFib.routes().entrySet().iterator();
        Iterator<Map.Entry<RoutePrefix, Route>> newIt = newFib.routes().entrySet().iterator();
        Map.Entry<RoutePrefix, Route> oldEntry = next(oldIt);
        Map.Entry<RoutePrefix, Route> newEntry = next(newIt);

        while (oldEntry != null || newEntry != null) {
            int cmp;
            if (oldEntry == null) {
                cmp = 1;
            } else if (newEntry == null) {
                cmp = -1;
            } else {
                cmp = oldEntry.getKey().compareTo(newEntry.getKey());
            }

            if (cmp < 0) {
                consumer.accept(RouteChange.removed(routerId, oldEntry.getValue()));
                oldEntry = next(oldIt);
            } else if (cmp > 0) {
                consumer.accept(RouteChange.added(routerId, newEntry.getValue()));
                newEntry = next(newIt);
            } else {
                Route oldRoute = oldEntry.getValue();
                Route newRoute = newEntry.getValue();
                if (oldRoute != newRoute && !oldRoute.equals(newRoute)) {
                    consumer.accept(RouteChange.changed(routerId, oldRoute, newRoute));
                }
                oldEntry = next(oldIt);
                newEntry = next(newIt);
            }
        }
    }

    private static Map.Entry<RoutePrefix, Route> next(Iterator<Map.Entry<RoutePrefix, Route>> it) {
        return it.hasNext() ? it.next() : null;
    }
}
