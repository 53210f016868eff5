package com.fibagent.agent.metrics;

import com.fibagent.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus registry shared by all agent components.
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        prometheusRegistry.config().commonTags(MetricsTags.NODE_ID, nodeId);
        new JvmMemoryMetrics().bindTo(prometheusRegistry);
        log.info("Metrics exporter initialized for node {}", nodeId);
    }

    public MeterRegistry getRegistry() {
        return prometheusRegistry;
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
