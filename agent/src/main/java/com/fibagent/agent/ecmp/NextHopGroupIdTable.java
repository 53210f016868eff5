package com.fibagent.agent.ecmp;

import com.fibagent.core.model.NextHopSet;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bidirectional mapping between next-hop sets and group identifiers.
 * <p>
 * Both directions are plain maps mutated only through {@link #getOrCreate}
 * and {@link #destroy}, so they never disagree. Identifiers come from a
 * counter that starts at 1 and only moves forward; a destroyed identifier is
 * never handed out again.
 * </p>
 * <p>
 * <b>Thread-safety:</b> Not thread-safe; {@link EcmpGroupConsolidator} guards access.
 * </p>
 */
public class NextHopGroupIdTable {
    private static final Logger log = LoggerFactory.getLogger(NextHopGroupIdTable.class);

    private final Map<NextHopSet, Long> nhopsToId = new HashMap<>();
    private final Map<Long, NextHopSet> idToNhops = new HashMap<>();
    private long nextId = 1;

    public Optional<Long> lookup(NextHopSet nextHops) {
        return Optional.ofNullable(nhopsToId.get(nextHops));
    }

    public Optional<NextHopSet> lookupNextHops(long id) {
        return Optional.ofNullable(idToNhops.get(id));
    }

    /**
     * Returns the identifier of the set, allocating the next one if the set is new.
     */
    public long getOrCreate(NextHopSet nextHops) {
        Long existing = nhopsToId.get(nextHops);
        if (existing != null) {
            return existing;
        }
        long id = nextId++;
        nhopsToId.put(nextHops, id);
        idToNhops.put(id, nextHops);
        log.debug("Allocated next-hop group id {} for {} next hops", id, nextHops.size());
        return id;
    }

    /**
     * Drops both directions of the mapping. Called by {@link RouteUsageTracker}
     * once the last route using the group is gone.
     */
    void destroy(long id) {
        NextHopSet nextHops = idToNhops.remove(id);
        if (nextHops == null) {
            throw new NextHopGroupInvariantException("Cannot destroy unknown next-hop group id " + id);
        }
        nhopsToId.remove(nextHops);
        log.debug("Released next-hop group id {}", id);
    }

    public int size() {
        return nhopsToId.size();
    }

    /**
     * Identifier the next allocation will use.
     */
    long getNextId() {
        return nextId;
    }

    public Map<NextHopSet, Long> getNhopsToId() {
        return ImmutableMap.copyOf(nhopsToId);
    }

    Map<Long, NextHopSet> getIdToNhops() {
        return ImmutableMap.copyOf(idToNhops);
    }

    /**
     * Puts the mappings back to a previous copy. The id counter is left where
     * it is, so ids minted since the copy are not reissued.
     */
    void restore(Map<Long, NextHopSet> idToNhopsCopy) {
        nhopsToId.clear();
        idToNhops.clear();
        idToNhopsCopy.forEach((id, nextHops) -> {
            idToNhops.put(id, nextHops);
            nhopsToId.put(nextHops, id);
        });
    }
}
