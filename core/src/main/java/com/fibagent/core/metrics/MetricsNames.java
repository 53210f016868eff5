package com.fibagent.core.metrics;

/**
 * Micrometer metric names used across the agent.
 * <p>
 * <b>Naming convention:</b> {@code fib.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: Number of distinct next-hop groups holding an identifier.
     */
    public static final String ECMP_GROUPS = "fib.ecmp.groups";

    /**
     * Counter: Next-hop group identifiers allocated.
     */
    public static final String ECMP_GROUPS_CREATED_TOTAL = "fib.ecmp.groups.created.total";

    /**
     * Counter: Next-hop group identifiers reclaimed after their last route went away.
     */
    public static final String ECMP_GROUPS_DESTROYED_TOTAL = "fib.ecmp.groups.destroyed.total";

    /**
     * Counter: State deltas applied to the consolidator.
     * <p>
     * Tags: result (ok/failed)
     * </p>
     */
    public static final String ECMP_DELTAS_APPLIED_TOTAL = "fib.ecmp.deltas.applied.total";

    /**
     * Counter: Bookkeeping invariant violations detected while applying a delta.
     */
    public static final String ECMP_INVARIANT_VIOLATIONS_TOTAL = "fib.ecmp.invariant.violations.total";

    /**
     * Timer: Time spent applying one state delta.
     */
    public static final String ECMP_APPLY_LATENCY = "fib.ecmp.apply.latency";

    /**
     * Counter: Published snapshots the consolidation pipeline could not apply.
     */
    public static final String ECMP_PIPELINE_FAILURES_TOTAL = "fib.ecmp.pipeline.failures.total";

    /**
     * Gauge: Routes in the most recently published switch state.
     */
    public static final String STATE_ROUTES = "fib.state.routes";

    /**
     * Gauge: Generation of the most recently published switch state.
     */
    public static final String STATE_GENERATION = "fib.state.generation";
}
