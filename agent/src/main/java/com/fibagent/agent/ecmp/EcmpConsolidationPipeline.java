package com.fibagent.agent.ecmp;

import com.fibagent.core.metrics.MetricsNames;
import com.fibagent.core.state.SwitchState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

/**
 * Feeds published switch state snapshots into the {@link EcmpGroupConsolidator}.
 * <p>
 * Snapshots are consolidated one at a time in publication order. A snapshot
 * that fails with an invariant violation is reported and skipped without
 * ending the subscription: the consolidator keeps its last good baseline, and
 * the next snapshot is diffed against that baseline.
 * </p>
 */
public class EcmpConsolidationPipeline {
    private static final Logger log = LoggerFactory.getLogger(EcmpConsolidationPipeline.class);

    private final EcmpGroupConsolidator consolidator;
    private final Counter failedSnapshots;

    public EcmpConsolidationPipeline(EcmpGroupConsolidator consolidator, MeterRegistry meterRegistry) {
        this.consolidator = consolidator;
        this.failedSnapshots = Counter.builder(MetricsNames.ECMP_PIPELINE_FAILURES_TOTAL)
                .register(meterRegistry);
    }

    public Disposable start(Flux<SwitchState> states) {
        log.info("ECMP group consolidation started at generation {}", consolidator.getBaselineGeneration());
        return states.subscribe(
                this::consolidate,
                err -> log.error("Switch state stream terminated with error", err),
                () -> log.info("Switch state stream completed"));
    }

    void consolidate(SwitchState state) {
        try {
            consolidator.consolidate(state);
        } catch (NextHopGroupInvariantException e) {
            failedSnapshots.increment();
            log.error("Next-hop group bookkeeping rejected generation {}; consolidated state stays at generation {}",
                    state.getGeneration(), consolidator.getBaselineGeneration(), e);
        }
    }

    public long getFailureCount() {
        return (long) failedSnapshots.count();
    }
}
