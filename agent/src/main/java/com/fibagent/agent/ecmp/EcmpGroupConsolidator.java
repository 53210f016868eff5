package com.fibagent.agent.ecmp;

import com.fibagent.core.delta.RouteChange;
import com.fibagent.core.delta.StateDelta;
import com.fibagent.core.metrics.MetricsNames;
import com.fibagent.core.metrics.MetricsTags;
import com.fibagent.core.model.NextHopSet;
import com.fibagent.core.model.Route;
import com.fibagent.core.state.SwitchState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Tracks the distinct next-hop groups used by resolved routes.
 * <p>
 * Each applied {@link StateDelta} is walked prefix by prefix and turned into
 * id allocations and route usage updates:
 * <ul>
 *   <li>added resolved route: allocate or reuse the group id, count the route</li>
 *   <li>removed resolved route: uncount it, releasing the id on the last route</li>
 *   <li>changed route whose forwarding group differs: remove the old, then add the new</li>
 * </ul>
 * Unresolved routes never hold an id. The new snapshot becomes the baseline the
 * next delta must start from.
 * </p>
 * <p>
 * <b>Thread-safety:</b> {@link #apply} holds an exclusive lock for its whole
 * run; queries take the shared lock, so a reader never observes a delta half
 * applied. If applying a delta fails, the table, the usage counts and the
 * baseline are put back as they were before the call.
 * </p>
 */
public class EcmpGroupConsolidator {
    private static final Logger log = LoggerFactory.getLogger(EcmpGroupConsolidator.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final NextHopGroupIdTable idTable;
    private final RouteUsageTracker usageTracker;

    private SwitchState baseline;

    private final Counter appliedOk;
    private final Counter appliedFailed;
    private final Counter invariantViolations;
    private final Counter groupsCreated;
    private final Counter groupsDestroyed;
    private final Timer applyLatency;

    public EcmpGroupConsolidator(MeterRegistry meterRegistry) {
        this(SwitchState.empty(), meterRegistry);
    }

    /**
     * @param baseline snapshot the first delta starts from; its routes must not
     *                 hold any groups yet, so it is normally empty
     */
    public EcmpGroupConsolidator(SwitchState baseline, MeterRegistry meterRegistry) {
        this(baseline, meterRegistry, new NextHopGroupIdTable());
    }

    EcmpGroupConsolidator(SwitchState baseline, MeterRegistry meterRegistry, NextHopGroupIdTable idTable) {
        this.baseline = Objects.requireNonNull(baseline, "baseline");
        this.idTable = idTable;
        this.usageTracker = new RouteUsageTracker(idTable);

        Gauge.builder(MetricsNames.ECMP_GROUPS, this, EcmpGroupConsolidator::getGroupCount)
                .register(meterRegistry);
        appliedOk = Counter.builder(MetricsNames.ECMP_DELTAS_APPLIED_TOTAL)
                .tag(MetricsTags.RESULT, "ok")
                .register(meterRegistry);
        appliedFailed = Counter.builder(MetricsNames.ECMP_DELTAS_APPLIED_TOTAL)
                .tag(MetricsTags.RESULT, "failed")
                .register(meterRegistry);
        invariantViolations = Counter.builder(MetricsNames.ECMP_INVARIANT_VIOLATIONS_TOTAL)
                .register(meterRegistry);
        groupsCreated = Counter.builder(MetricsNames.ECMP_GROUPS_CREATED_TOTAL)
                .register(meterRegistry);
        groupsDestroyed = Counter.builder(MetricsNames.ECMP_GROUPS_DESTROYED_TOTAL)
                .register(meterRegistry);
        applyLatency = Timer.builder(MetricsNames.ECMP_APPLY_LATENCY)
                .register(meterRegistry);
    }

    /**
     * Applies the delta from the current baseline to {@code newState}.
     * <p>
     * After a failed apply the baseline is still the last good snapshot, so
     * calling this with a later snapshot re-derives a fresh delta.
     * </p>
     *
     * @throws NextHopGroupInvariantException if the bookkeeping is inconsistent
     */
    public void consolidate(SwitchState newState) {
        lock.writeLock().lock();
        try {
            applyLocked(new StateDelta(baseline, newState));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Applies a delta whose old state must be the current baseline. Whatever the
     * delta fails with, the table and usage counts are put back before it is rethrown.
     *
     * @throws NextHopGroupInvariantException if the delta does not start at the
     *                                        baseline or the bookkeeping is inconsistent
     */
    public void apply(StateDelta delta) {
        lock.writeLock().lock();
        try {
            applyLocked(delta);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void applyLocked(StateDelta delta) {
        Timer.Sample sample = Timer.start();
        Map<Long, NextHopSet> idsBefore = idTable.getIdToNhops();
        Map<Long, Long> usageBefore = usageTracker.getRouteUsage();
        ApplyStats stats = new ApplyStats();
        try {
            if (delta.getOldState() != baseline) {
                throw new NextHopGroupInvariantException(String.format(
                        "Delta starts at generation %d but the consolidated baseline is generation %d",
                        delta.getOldState().getGeneration(), baseline.getGeneration()));
            }
            delta.forEachChange(change -> processChange(change, stats));
            if (idTable.size() != usageTracker.size()) {
                throw new NextHopGroupInvariantException(String.format(
                        "Next-hop group table holds %d ids but route usage tracks %d",
                        idTable.size(), usageTracker.size()));
            }
        } catch (RuntimeException e) {
            idTable.restore(idsBefore);
            usageTracker.restore(usageBefore);
            if (e instanceof NextHopGroupInvariantException) {
                invariantViolations.increment();
            }
            appliedFailed.increment();
            log.error("Failed to apply {}; keeping generation {} as the consolidated state: {}",
                    delta, baseline.getGeneration(), e.getMessage());
            throw e;
        } finally {
            sample.stop(applyLatency);
        }

        baseline = delta.getNewState();
        appliedOk.increment();
        groupsCreated.increment(stats.created);
        groupsDestroyed.increment(stats.destroyed);
        if (stats.changes > 0) {
            log.info("Applied {}: changes={}, groupsCreated={}, groupsReleased={}, groups={}",
                    delta, stats.changes, stats.created, stats.destroyed, idTable.size());
        }
    }

    private void processChange(RouteChange change, ApplyStats stats) {
        stats.changes++;
        switch (change.getKind()) {
            case ADDED -> routeAdded(change.getNewRoute(), stats);
            case REMOVED -> routeRemoved(change.getOldRoute(), stats);
            case CHANGED -> routeChanged(change.getOldRoute(), change.getNewRoute(), stats);
        }
    }

    private void routeAdded(Route added, ApplyStats stats) {
        Optional<NextHopSet> nextHops = added.forwardNextHops();
        if (nextHops.isEmpty()) {
            return;
        }
        boolean isNew = idTable.lookup(nextHops.get()).isEmpty();
        long id = idTable.getOrCreate(nextHops.get());
        usageTracker.increment(id);
        if (isNew) {
            stats.created++;
            log.debug("Route {} created next-hop group {}", added.getPrefix(), id);
        }
    }

    private void routeRemoved(Route removed, ApplyStats stats) {
        Optional<NextHopSet> nextHops = removed.forwardNextHops();
        if (nextHops.isEmpty()) {
            return;
        }
        long id = idTable.lookup(nextHops.get())
                .orElseThrow(() -> new NextHopGroupInvariantException(
                        "Removed route " + removed.getPrefix() + " points at a next-hop group with no id"));
        if (usageTracker.decrement(id)) {
            stats.destroyed++;
            log.debug("Route {} was the last user of next-hop group {}", removed.getPrefix(), id);
        }
    }

    private void routeChanged(Route oldRoute, Route newRoute, ApplyStats stats) {
        Optional<NextHopSet> oldNextHops = oldRoute.forwardNextHops();
        Optional<NextHopSet> newNextHops = newRoute.forwardNextHops();
        if (oldNextHops.equals(newNextHops)) {
            return;
        }
        // uncount the old group before counting the new one
        routeRemoved(oldRoute, stats);
        routeAdded(newRoute, stats);
    }

    /**
     * @return the group id of the next-hop set, empty if no resolved route uses it
     */
    public Optional<Long> getNhopId(NextHopSet nextHops) {
        lock.readLock().lock();
        try {
            return idTable.lookup(nextHops);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<NextHopSet> getNextHops(long id) {
        lock.readLock().lock();
        try {
            return idTable.lookupNextHops(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return number of resolved routes using the group, 0 for an unknown id
     */
    public long getRouteUsageCount(long id) {
        lock.readLock().lock();
        try {
            return usageTracker.populationOf(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Group with its population and members, read in one consistent view.
     */
    public Optional<NextHopGroupInfo> describeGroup(long id) {
        lock.readLock().lock();
        try {
            return idTable.lookupNextHops(id)
                    .map(nextHops -> new NextHopGroupInfo(id, usageTracker.populationOf(id), nextHops.asList()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the group of the next-hop set, empty if no resolved route uses it
     */
    public Optional<NextHopGroupInfo> describeGroup(NextHopSet nextHops) {
        lock.readLock().lock();
        try {
            return idTable.lookup(nextHops)
                    .map(id -> new NextHopGroupInfo(id, usageTracker.populationOf(id), nextHops.asList()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Copy of the full next-hop set to id mapping.
     */
    public Map<NextHopSet, Long> getNhopsToId() {
        lock.readLock().lock();
        try {
            return idTable.getNhopsToId();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getGroupCount() {
        lock.readLock().lock();
        try {
            return idTable.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getBaselineGeneration() {
        lock.readLock().lock();
        try {
            return baseline.getGeneration();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Consistent view of every group with its population, ordered by id.
     */
    public List<NextHopGroupInfo> describeGroups() {
        lock.readLock().lock();
        try {
            return idTable.getNhopsToId().entrySet().stream()
                    .map(e -> new NextHopGroupInfo(
                            e.getValue(),
                            usageTracker.populationOf(e.getValue()),
                            e.getKey().asList()))
                    .sorted(Comparator.comparingLong(NextHopGroupInfo::id))
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    private static final class ApplyStats {
        int changes;
        int created;
        int destroyed;
    }
}
