package com.fibagent.core.state;

import com.fibagent.core.model.AddressFamily;
import com.fibagent.core.model.RouterId;
import com.google.common.collect.ImmutableSortedMap;

import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Immutable point-in-time view of the switch routing state.
 * <p>
 * A snapshot holds one {@link FibContainer} per router. Modifying a snapshot
 * yields a new one whose generation is one higher; unchanged containers and
 * FIBs are shared with the parent, which lets the diff engine skip them.
 * </p>
 */
public final class SwitchState {
    private final long generation;
    private final ImmutableSortedMap<RouterId, FibContainer> fibs;

    private SwitchState(long generation, ImmutableSortedMap<RouterId, FibContainer> fibs) {
        this.generation = generation;
        this.fibs = fibs;
    }

    public static SwitchState empty() {
        return new SwitchState(0, ImmutableSortedMap.of());
    }

    /**
     * Empty snapshot with a FIB container for each router.
     */
    public static SwitchState withRouters(RouterId... routerIds) {
        ImmutableSortedMap.Builder<RouterId, FibContainer> builder = ImmutableSortedMap.naturalOrder();
        for (RouterId routerId : routerIds) {
            builder.put(routerId, FibContainer.empty(routerId));
        }
        return new SwitchState(0, builder.build());
    }

    public long getGeneration() {
        return generation;
    }

    public Set<RouterId> getRouterIds() {
        return fibs.keySet();
    }

    /**
     * @return the container for the router, or null if the router is unknown
     */
    public FibContainer getFibContainer(RouterId routerId) {
        return fibs.get(routerId);
    }

    /**
     * @return the router's FIB, or an empty FIB if the router is unknown
     */
    public Fib getFib(RouterId routerId, AddressFamily family) {
        FibContainer container = fibs.get(routerId);
        return container != null ? container.getFib(family) : Fib.empty(family);
    }

    /**
     * Returns a new snapshot with one FIB replaced. The router's container is
     * created if absent. Returns this instance if the modifier changes nothing.
     */
    public SwitchState modifyFib(RouterId routerId, AddressFamily family, UnaryOperator<Fib> modifier) {
        FibContainer current = fibs.get(routerId);
        FibContainer base = current != null ? current : FibContainer.empty(routerId);
        FibContainer modified = base.modifyFib(family, modifier);
        if (modified == base && current != null) {
            return this;
        }
        ImmutableSortedMap.Builder<RouterId, FibContainer> builder = ImmutableSortedMap.naturalOrder();
        fibs.forEach((id, container) -> {
            if (!id.equals(routerId)) {
                builder.put(id, container);
            }
        });
        builder.put(routerId, modified);
        return new SwitchState(generation + 1, builder.build());
    }

    public SwitchState removeRouter(RouterId routerId) {
        if (!fibs.containsKey(routerId)) {
            return this;
        }
        ImmutableSortedMap.Builder<RouterId, FibContainer> builder = ImmutableSortedMap.naturalOrder();
        fibs.forEach((id, container) -> {
            if (!id.equals(routerId)) {
                builder.put(id, container);
            }
        });
        return new SwitchState(generation + 1, builder.build());
    }

    /**
     * Total number of routes across all routers and families.
     */
    public int routeCount() {
        return fibs.values().stream().mapToInt(FibContainer::size).sum();
    }

    @Override
    public String toString() {
        return "SwitchState{generation=" + generation + ", routers=" + fibs.keySet() + ", routes=" + routeCount() + "}";
    }
}
