package com.fibagent.agent.state;

import com.fibagent.core.metrics.MetricsNames;
import com.fibagent.core.model.Route;
import com.fibagent.core.model.RoutePrefix;
import com.fibagent.core.model.RouterId;
import com.fibagent.core.state.SwitchState;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.function.UnaryOperator;

/**
 * Owns the current switch state and publishes every new snapshot.
 * <p>
 * Updates are serialised: each one is computed from the latest snapshot, and
 * the resulting snapshot is emitted to {@link #publishedStates()} on the
 * updating thread before the next update can start. Subscribers therefore see
 * snapshots one at a time and in generation order.
 * </p>
 */
public class SwitchStateManager {
    private static final Logger log = LoggerFactory.getLogger(SwitchStateManager.class);

    private final Sinks.Many<SwitchState> publishedStates = Sinks.many().multicast().directBestEffort();
    private final Object updateLock = new Object();

    private volatile SwitchState currentState;

    public SwitchStateManager(SwitchState initialState, MeterRegistry meterRegistry) {
        this.currentState = initialState;

        Gauge.builder(MetricsNames.STATE_ROUTES, this, m -> m.currentState.routeCount())
                .register(meterRegistry);
        Gauge.builder(MetricsNames.STATE_GENERATION, this, m -> m.currentState.getGeneration())
                .register(meterRegistry);
    }

    public SwitchState getCurrentState() {
        return currentState;
    }

    /**
     * Snapshots published from now on. Late subscribers do not receive earlier snapshots.
     */
    public Flux<SwitchState> publishedStates() {
        return publishedStates.asFlux();
    }

    /**
     * Derives a new snapshot from the current one and publishes it.
     *
     * @param reason  Human-readable reason for the update
     * @param updater Function from the current snapshot to the new one
     * @return Mono of the resulting snapshot (the current one if nothing changed)
     */
    public Mono<SwitchState> updateState(String reason, UnaryOperator<SwitchState> updater) {
        return Mono.fromCallable(() -> applyUpdate(reason, updater));
    }

    public Mono<SwitchState> addOrUpdateRoute(RouterId routerId, Route route) {
        return updateState("route-updated: " + routerId.getId() + "/" + route.getPrefix(),
                state -> state.modifyFib(routerId, route.getFamily(), fib -> fib.addOrUpdateRoute(route)));
    }

    public Mono<SwitchState> removeRoute(RouterId routerId, RoutePrefix prefix) {
        return updateState("route-removed: " + routerId.getId() + "/" + prefix,
                state -> state.getFibContainer(routerId) == null
                        ? state
                        : state.modifyFib(routerId, prefix.getFamily(), fib -> fib.removeRoute(prefix)));
    }

    private SwitchState applyUpdate(String reason, UnaryOperator<SwitchState> updater) {
        synchronized (updateLock) {
            SwitchState current = currentState;
            SwitchState next = updater.apply(current);
            if (next == current) {
                log.debug("State unchanged at generation {}, reason={}", current.getGeneration(), reason);
                return current;
            }
            currentState = next;
            log.info("State published: generation={}, routes={}, reason={}",
                    next.getGeneration(), next.routeCount(), reason);

            Sinks.EmitResult result = publishedStates.tryEmitNext(next);
            if (result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
                log.debug("No subscribers for generation {}", next.getGeneration());
            } else if (result.isFailure()) {
                log.warn("Failed to publish generation {}: {}", next.getGeneration(), result);
            }
            return next;
        }
    }
}
