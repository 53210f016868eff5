package com.fibagent.agent.ecmp;

import com.fibagent.agent.state.SwitchStateManager;
import com.fibagent.core.metrics.MetricsNames;
import com.fibagent.core.model.AddressFamily;
import com.fibagent.core.model.AdminDistance;
import com.fibagent.core.model.NextHopSet;
import com.fibagent.core.model.Route;
import com.fibagent.core.model.RoutePrefix;
import com.fibagent.core.model.RouterId;
import com.fibagent.core.state.SwitchState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import static org.junit.jupiter.api.Assertions.*;

class EcmpConsolidationPipelineTest {

    private static final NextHopSet GROUP_A = NextHopSet.ofAddresses("100::1", "100::2");
    private static final NextHopSet GROUP_B = NextHopSet.ofAddresses("100::3", "100::4");

    private SimpleMeterRegistry meterRegistry;
    private SwitchStateManager stateManager;
    private EcmpGroupConsolidator consolidator;
    private EcmpConsolidationPipeline pipeline;
    private Disposable subscription;

    private static Route route(String prefix, NextHopSet nextHops) {
        return Route.resolved(RoutePrefix.parse(prefix), nextHops, AdminDistance.EBGP);
    }

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        stateManager = new SwitchStateManager(SwitchState.withRouters(RouterId.DEFAULT), meterRegistry);
        consolidator = new EcmpGroupConsolidator(meterRegistry);
        pipeline = new EcmpConsolidationPipeline(consolidator, meterRegistry);
        subscription = pipeline.start(Flux.concat(
                Mono.fromSupplier(stateManager::getCurrentState),
                stateManager.publishedStates()));
    }

    @AfterEach
    void tearDown() {
        subscription.dispose();
    }

    @Test
    void testPublishedStates_AreConsolidated() {
        stateManager.addOrUpdateRoute(RouterId.DEFAULT, route("2601:db00::/64", GROUP_A)).block();
        stateManager.addOrUpdateRoute(RouterId.DEFAULT, route("2601:db01::/64", GROUP_A)).block();
        stateManager.addOrUpdateRoute(RouterId.DEFAULT, route("10.1.0.0/16", GROUP_B)).block();

        assertEquals(2, consolidator.getGroupCount());
        assertEquals(2, consolidator.getRouteUsageCount(consolidator.getNhopId(GROUP_A).orElseThrow()));
        assertEquals(stateManager.getCurrentState().getGeneration(), consolidator.getBaselineGeneration());

        stateManager.removeRoute(RouterId.DEFAULT, RoutePrefix.parse("10.1.0.0/16")).block();

        assertEquals(1, consolidator.getGroupCount());
        assertTrue(consolidator.getNhopId(GROUP_B).isEmpty());
        assertEquals(0, pipeline.getFailureCount());
    }

    @Test
    void testFailedSnapshot_DoesNotStopPipeline() {
        SwitchState seeded = SwitchState.withRouters(RouterId.DEFAULT).modifyFib(RouterId.DEFAULT, AddressFamily.V6,
                fib -> fib.addRoute(route("2601:db00::/64", GROUP_A)));
        SimpleMeterRegistry failingRegistry = new SimpleMeterRegistry();
        EcmpGroupConsolidator unseeded = new EcmpGroupConsolidator(seeded, failingRegistry);
        EcmpConsolidationPipeline failing = new EcmpConsolidationPipeline(unseeded, failingRegistry);

        SwitchState removed = seeded.modifyFib(RouterId.DEFAULT, AddressFamily.V6,
                fib -> fib.removeRoute(RoutePrefix.parse("2601:db00::/64")));
        SwitchState added = seeded.modifyFib(RouterId.DEFAULT, AddressFamily.V6,
                fib -> fib.addRoute(route("2601:db01::/64", GROUP_B)));

        Disposable run = failing.start(Flux.just(removed, added));
        try {
            assertEquals(1, failing.getFailureCount());
            assertEquals(1.0, failingRegistry.get(MetricsNames.ECMP_PIPELINE_FAILURES_TOTAL).counter().count());
            assertEquals(added.getGeneration(), unseeded.getBaselineGeneration());
            assertEquals(1, unseeded.getGroupCount());
        } finally {
            run.dispose();
        }
    }
}
