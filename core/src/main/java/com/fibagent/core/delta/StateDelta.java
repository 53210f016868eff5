package com.fibagent.core.delta;

import com.fibagent.core.model.AddressFamily;
import com.fibagent.core.model.RouterId;
import com.fibagent.core.state.FibContainer;
import com.fibagent.core.state.SwitchState;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Delta between two switch state snapshots.
 * <p>
 * Covers every router present in either snapshot and both address families;
 * a router present on one side only is diffed against an empty FIB. Both
 * snapshots are immutable, so the delta can be walked any number of times.
 * </p>
 */
public final class StateDelta {
    private final SwitchState oldState;
    private final SwitchState newState;

    public StateDelta(SwitchState oldState, SwitchState newState) {
        this.oldState = Objects.requireNonNull(oldState, "oldState");
        this.newState = Objects.requireNonNull(newState, "newState");
    }

    public SwitchState getOldState() {
        return oldState;
    }

    public SwitchState getNewState() {
        return newState;
    }

    /**
     * Per-router, per-family FIB deltas, ordered by router id then family.
     * Routers whose container is shared between the snapshots are skipped.
     */
    public List<FibDelta> getFibDeltas() {
        List<FibDelta> deltas = new ArrayList<>();
        if (oldState == newState) {
            return deltas;
        }
        TreeSet<RouterId> routerIds = new TreeSet<>(oldState.getRouterIds());
        routerIds.addAll(newState.getRouterIds());
        for (RouterId routerId : routerIds) {
            FibContainer oldContainer = oldState.getFibContainer(routerId);
            FibContainer newContainer = newState.getFibContainer(routerId);
            if (oldContainer != null && oldContainer == newContainer) {
                continue;
            }
            for (AddressFamily family : AddressFamily.values()) {
                deltas.add(new FibDelta(
                        routerId,
                        oldState.getFib(routerId, family),
                        newState.getFib(routerId, family)));
            }
        }
        return deltas;
    }

    public void forEachChange(Consumer<RouteChange> consumer) {
        for (FibDelta fibDelta : getFibDeltas()) {
            fibDelta.forEachChange(consumer);
        }
    }

    public List<RouteChange> getChanges() {
        List<RouteChange> changes = new ArrayList<>();
        forEachChange(changes::add);
        return changes;
    }

    @Override
    public String toString() {
        return "StateDelta{" + oldState.getGeneration() + " -> " + newState.getGeneration() + "}";
    }
}
