package com.fibagent.agent.ecmp;

import com.google.common.collect.ImmutableMap;

import java.util.HashMap;
import java.util.Map;

/**
 * Number of resolved routes referencing each next-hop group id.
 * <p>
 * Only ids with at least one route have an entry; a missing entry means a
 * population of zero. When a population drops to zero the id is released
 * from the {@link NextHopGroupIdTable} as well.
 * </p>
 */
public class RouteUsageTracker {
    private final NextHopGroupIdTable idTable;
    private final Map<Long, Long> routeUsage = new HashMap<>();

    public RouteUsageTracker(NextHopGroupIdTable idTable) {
        this.idTable = idTable;
    }

    public void increment(long id) {
        if (idTable.lookupNextHops(id).isEmpty()) {
            throw new NextHopGroupInvariantException("Route references unallocated next-hop group id " + id);
        }
        routeUsage.merge(id, 1L, Long::sum);
    }

    /**
     * @return true if this was the last route and the id was released
     */
    public boolean decrement(long id) {
        Long count = routeUsage.get(id);
        if (count == null) {
            throw new NextHopGroupInvariantException("Route usage of next-hop group id " + id + " is already zero");
        }
        if (count > 1) {
            routeUsage.put(id, count - 1);
            return false;
        }
        routeUsage.remove(id);
        idTable.destroy(id);
        return true;
    }

    public long populationOf(long id) {
        return routeUsage.getOrDefault(id, 0L);
    }

    public int size() {
        return routeUsage.size();
    }

    Map<Long, Long> getRouteUsage() {
        return ImmutableMap.copyOf(routeUsage);
    }

    void restore(Map<Long, Long> routeUsageCopy) {
        routeUsage.clear();
        routeUsage.putAll(routeUsageCopy);
    }
}
