package com.fibagent.agent.http;

import com.fibagent.agent.config.AgentConfig;
import com.fibagent.agent.ecmp.EcmpGroupConsolidator;
import com.fibagent.agent.ecmp.NextHopGroupInfo;
import com.fibagent.agent.metrics.PrometheusMetricsExporter;
import com.fibagent.agent.state.SwitchStateManager;
import com.fibagent.core.model.AddressFamily;
import com.fibagent.core.model.RoutePrefix;
import com.fibagent.core.model.RouterId;
import com.fibagent.core.state.Fib;
import com.fibagent.core.util.JsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP server for agent endpoints: health, metrics, next-hop group queries
 * and route programming.
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final AgentConfig config;
    private final SwitchStateManager stateManager;
    private final EcmpGroupConsolidator consolidator;
    private final PrometheusMetricsExporter metricsExporter;

    private DisposableServer server;

    /**
     * @param consolidator null when next-hop group consolidation is disabled
     */
    public HttpServer(
        AgentConfig config,
        SwitchStateManager stateManager,
        EcmpGroupConsolidator consolidator,
        PrometheusMetricsExporter metricsExporter
    ) {
        this.config = config;
        this.stateManager = stateManager;
        this.consolidator = consolidator;
        this.metricsExporter = metricsExporter;
    }

    /**
     * Starts the HTTP server.
     *
     * @return the bound server
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .route(this::configureRoutes)
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            // Health check
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            // Metrics endpoint
            .get("/metrics", (req, res) ->
                res.addHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.just(metricsExporter.scrape()))
                    .then()
            )
            // All next-hop groups with their route usage
            .get("/api/v1/ecmp/groups", (req, res) -> {
                if (consolidator == null) {
                    return consolidationDisabled(res);
                }
                return sendJson(res, Mono.fromCallable(consolidator::describeGroups));
            })
            // One next-hop group by id
            .get("/api/v1/ecmp/groups/{id}", (req, res) -> {
                if (consolidator == null) {
                    return consolidationDisabled(res);
                }
                long id;
                try {
                    id = Long.parseLong(req.param("id"));
                } catch (NumberFormatException e) {
                    return error(res, HttpResponseStatus.BAD_REQUEST, "Invalid group id: " + req.param("id"));
                }
                Optional<NextHopGroupInfo> group = consolidator.describeGroup(id);
                if (group.isEmpty()) {
                    return error(res, HttpResponseStatus.NOT_FOUND, "Unknown next-hop group " + id);
                }
                return sendJson(res, Mono.just(group.get()));
            })
            // Group id and usage of a next-hop set
            .post("/api/v1/ecmp/lookup", (req, res) -> {
                if (consolidator == null) {
                    return consolidationDisabled(res);
                }
                return req.receive().aggregate().asString()
                    .map(body -> RouteRequest.toNextHopSet(JsonUtils.readValue(
                        body, new TypeReference<List<RouteRequest.NextHopRequest>>() { })))
                    .flatMap(nextHops -> {
                        Optional<NextHopGroupInfo> group = consolidator.describeGroup(nextHops);
                        if (group.isEmpty()) {
                            return Mono.from(error(res, HttpResponseStatus.NOT_FOUND,
                                "No resolved route uses this next-hop set"));
                        }
                        Map<String, Object> response = new LinkedHashMap<>();
                        response.put("id", group.get().id());
                        response.put("population", group.get().population());
                        return Mono.from(sendJson(res, Mono.just(response)));
                    })
                    .onErrorResume(IllegalArgumentException.class, err ->
                        Mono.from(error(res, HttpResponseStatus.BAD_REQUEST, err.getMessage())));
            })
            // Routes of one FIB
            .get("/api/v1/routes", (req, res) -> {
                QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
                RouterId routerId;
                AddressFamily family;
                try {
                    routerId = RouterId.of(intParam(decoder, "routerId", config.getDefaultRouterId()));
                    family = AddressFamily.valueOf(stringParam(decoder, "family", "V6").toUpperCase());
                } catch (IllegalArgumentException e) {
                    return error(res, HttpResponseStatus.BAD_REQUEST, e.getMessage());
                }
                Fib fib = stateManager.getCurrentState().getFib(routerId, family);
                return sendJson(res, Mono.fromCallable(() -> List.copyOf(fib.getRoutes())));
            })
            // Add or update a route
            .post("/api/v1/routes", (req, res) ->
                req.receive().aggregate().asString()
                    .map(body -> JsonUtils.readValue(body, RouteRequest.class))
                    .flatMap(request -> {
                        RouterId routerId = RouterId.of(request.getRouterId() != null
                            ? request.getRouterId()
                            : config.getDefaultRouterId());
                        return stateManager.addOrUpdateRoute(routerId, request.toRoute());
                    })
                    .flatMap(state -> Mono.from(sendJson(res, Mono.just(Map.of("generation", state.getGeneration())))))
                    .onErrorResume(IllegalArgumentException.class, err ->
                        Mono.from(error(res, HttpResponseStatus.BAD_REQUEST, err.getMessage())))
                    .onErrorResume(err -> {
                        log.error("Failed to update route", err);
                        return Mono.from(error(res, HttpResponseStatus.INTERNAL_SERVER_ERROR, "Route update failed"));
                    })
            )
            // Remove a route
            .delete("/api/v1/routes", (req, res) -> {
                QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
                RouterId routerId;
                RoutePrefix prefix;
                try {
                    routerId = RouterId.of(intParam(decoder, "routerId", config.getDefaultRouterId()));
                    prefix = RoutePrefix.parse(stringParam(decoder, "prefix", null));
                } catch (IllegalArgumentException e) {
                    return error(res, HttpResponseStatus.BAD_REQUEST, e.getMessage());
                }
                RoutePrefix removed = prefix;
                return stateManager.removeRoute(routerId, removed)
                    .flatMap(state -> Mono.from(sendJson(res, Mono.just(Map.of("generation", state.getGeneration())))))
                    .onErrorResume(err -> {
                        log.error("Failed to remove route {}", removed, err);
                        return Mono.from(error(res, HttpResponseStatus.INTERNAL_SERVER_ERROR, "Route removal failed"));
                    });
            });
    }

    private Publisher<Void> sendJson(HttpServerResponse res, Mono<?> body) {
        return body
            .map(JsonUtils::writeValueAsString)
            .flatMap(json ->
                res.header("Content-Type", "application/json")
                    .sendString(Mono.just(json)).then()
            )
            .onErrorResume(err -> {
                log.error("Failed to serialize response", err);
                return res.status(HttpResponseStatus.INTERNAL_SERVER_ERROR)
                    .sendString(Mono.just("{\"error\":\"Serialization failed\"}")).then();
            });
    }

    private Publisher<Void> consolidationDisabled(HttpServerResponse res) {
        return error(res, HttpResponseStatus.SERVICE_UNAVAILABLE, "ECMP group consolidation is disabled");
    }

    private Publisher<Void> error(HttpServerResponse res, HttpResponseStatus status, String message) {
        return res.status(status)
            .header("Content-Type", "application/json")
            .sendString(Mono.just(JsonUtils.writeValueAsString(Map.of("error", String.valueOf(message)))))
            .then();
    }

    private static String stringParam(QueryStringDecoder decoder, String name, String defaultValue) {
        List<String> values = decoder.parameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isEmpty()) {
            if (defaultValue == null) {
                throw new IllegalArgumentException("Missing " + name + " parameter");
            }
            return defaultValue;
        }
        return values.get(0);
    }

    private static int intParam(QueryStringDecoder decoder, String name, int defaultValue) {
        String value = stringParam(decoder, name, String.valueOf(defaultValue));
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + " parameter: " + value, e);
        }
    }
}
