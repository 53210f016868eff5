package com.fibagent.agent;

import com.fibagent.agent.config.AgentConfig;
import com.fibagent.agent.ecmp.EcmpConsolidationPipeline;
import com.fibagent.agent.ecmp.EcmpGroupConsolidator;
import com.fibagent.agent.http.HttpServer;
import com.fibagent.agent.metrics.PrometheusMetricsExporter;
import com.fibagent.agent.state.SwitchStateManager;
import com.fibagent.core.model.RouterId;
import com.fibagent.core.state.SwitchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

public class FibAgentApp {
    private static final Logger log = LoggerFactory.getLogger(FibAgentApp.class);

    public static void main(String[] args) {
        AgentConfig config = AgentConfig.fromEnv();

        log.info("Starting FIB agent");
        log.info("  Node: {}", config.getNodeId());
        log.info("  ECMP group consolidation: {}", config.isConsolidateEcmpGroups());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());

        SwitchStateManager stateManager = new SwitchStateManager(
            SwitchState.withRouters(RouterId.of(config.getDefaultRouterId())),
            metricsExporter.getRegistry()
        );

        // The consolidator only exists while the feature is enabled
        EcmpGroupConsolidator consolidator = null;
        Disposable consolidation = null;
        if (config.isConsolidateEcmpGroups()) {
            consolidator = new EcmpGroupConsolidator(metricsExporter.getRegistry());
            EcmpConsolidationPipeline pipeline = new EcmpConsolidationPipeline(consolidator, metricsExporter.getRegistry());
            consolidation = pipeline.start(Flux.concat(
                Mono.fromSupplier(stateManager::getCurrentState),
                stateManager.publishedStates()
            ));
        }

        HttpServer httpServer = new HttpServer(config, stateManager, consolidator, metricsExporter);
        DisposableServer disposableServer = httpServer.start();

        log.info("FIB agent is ready");

        handleShutDown(consolidation, httpServer);

        disposableServer.onDispose().block();
    }

    private static void handleShutDown(Disposable consolidation, HttpServer httpServer) {
        // Graceful shutdown
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");

            if (consolidation != null) {
                consolidation.dispose();
            }

            httpServer.stop();

            log.info("Shutdown complete");
        }));
    }
}
