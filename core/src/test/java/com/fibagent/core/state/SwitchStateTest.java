package com.fibagent.core.state;

import com.fibagent.core.model.AddressFamily;
import com.fibagent.core.model.AdminDistance;
import com.fibagent.core.model.NextHopSet;
import com.fibagent.core.model.Route;
import com.fibagent.core.model.RoutePrefix;
import com.fibagent.core.model.RouterId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SwitchStateTest {

    private static final NextHopSet NHOPS = NextHopSet.ofAddresses("100::1", "100::2");

    private static Route route(String prefix) {
        return Route.resolved(RoutePrefix.parse(prefix), NHOPS, AdminDistance.EBGP);
    }

    @Test
    void testModifyFib_LeavesParentUntouched() {
        SwitchState parent = SwitchState.withRouters(RouterId.DEFAULT);
        SwitchState child = parent.modifyFib(RouterId.DEFAULT, AddressFamily.V6,
                fib -> fib.addRoute(route("2601:db00::/64")));

        assertEquals(0, parent.routeCount());
        assertEquals(1, child.routeCount());
        assertEquals(parent.getGeneration() + 1, child.getGeneration());
        assertNull(parent.getFib(RouterId.DEFAULT, AddressFamily.V6).exactMatch(RoutePrefix.parse("2601:db00::/64")));
    }

    @Test
    void testModifyFib_SharesUntouchedContainersAndFibs() {
        RouterId other = RouterId.of(1);
        SwitchState parent = SwitchState.withRouters(RouterId.DEFAULT, other);
        SwitchState child = parent.modifyFib(RouterId.DEFAULT, AddressFamily.V6,
                fib -> fib.addRoute(route("2601:db00::/64")));

        assertSame(parent.getFibContainer(other), child.getFibContainer(other));
        assertSame(parent.getFib(RouterId.DEFAULT, AddressFamily.V4), child.getFib(RouterId.DEFAULT, AddressFamily.V4));
    }

    @Test
    void testNoOpModification_ReturnsSameSnapshot() {
        SwitchState state = SwitchState.withRouters(RouterId.DEFAULT);

        assertSame(state, state.modifyFib(RouterId.DEFAULT, AddressFamily.V4, fib -> fib));
        assertSame(state, state.modifyFib(RouterId.DEFAULT, AddressFamily.V4,
                fib -> fib.removeRoute(RoutePrefix.parse("10.0.0.0/8"))));
    }

    @Test
    void testModifyFib_CreatesUnknownRouter() {
        SwitchState state = SwitchState.empty().modifyFib(RouterId.of(7), AddressFamily.V4,
                fib -> fib.addRoute(route("10.0.0.0/8")));

        assertTrue(state.getRouterIds().contains(RouterId.of(7)));
        assertEquals(1, state.getFib(RouterId.of(7), AddressFamily.V4).size());
    }

    @Test
    void testUnknownRouter_HasEmptyFib() {
        assertTrue(SwitchState.empty().getFib(RouterId.of(3), AddressFamily.V6).isEmpty());
    }

    @Test
    void testFibMutators_EnforcePresence() {
        Fib fib = Fib.empty(AddressFamily.V6).addRoute(route("2601:db00::/64"));

        assertThrows(IllegalStateException.class, () -> fib.addRoute(route("2601:db00::/64")));
        assertThrows(IllegalStateException.class, () -> fib.updateRoute(route("2601:db01::/64")));
        assertEquals(2, fib.addOrUpdateRoute(route("2601:db01::/64")).size());
        assertEquals(1, fib.size());
    }

    @Test
    void testFib_RejectsRouteOfOtherFamily() {
        Fib fib = Fib.empty(AddressFamily.V4);

        assertThrows(IllegalArgumentException.class, () -> fib.addRoute(route("2601:db00::/64")));
    }

    @Test
    void testRemoveRouter() {
        RouterId other = RouterId.of(1);
        SwitchState state = SwitchState.withRouters(RouterId.DEFAULT, other).removeRouter(other);

        assertFalse(state.getRouterIds().contains(other));
        assertSame(state, state.removeRouter(other));
    }
}
