package com.fibagent.agent.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fibagent.agent.config.AgentConfig;
import com.fibagent.agent.ecmp.EcmpConsolidationPipeline;
import com.fibagent.agent.ecmp.EcmpGroupConsolidator;
import com.fibagent.agent.metrics.PrometheusMetricsExporter;
import com.fibagent.agent.state.SwitchStateManager;
import com.fibagent.core.model.RouterId;
import com.fibagent.core.state.SwitchState;
import com.fibagent.core.util.JsonUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.DisposableServer;
import reactor.netty.http.client.HttpClient;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the agent's HTTP endpoints over a real socket, with consolidation enabled and disabled.
 */
class HttpServerTest {

    private static final String ROUTE_A = "{\"prefix\":\"2601:db00::/64\","
            + "\"nextHops\":[{\"address\":\"100::1\"},{\"address\":\"100::2\"}]}";
    private static final String ROUTE_B = "{\"prefix\":\"2601:db01::/64\","
            + "\"nextHops\":[{\"address\":\"100::2\"},{\"address\":\"100::1\"}]}";
    private static final String NEXT_HOPS_A = "[{\"address\":\"100::2\"},{\"address\":\"100::1\"}]";

    private HttpServer httpServer;
    private Disposable consolidation;
    private HttpClient client;

    private record Response(int status, String body) {
        JsonNode json() {
            return JsonUtils.readValue(body, JsonNode.class);
        }
    }

    private void startAgent(boolean consolidateEcmpGroups) {
        AgentConfig config = AgentConfig.builder()
                .nodeId("fib-agent-test")
                .httpPort(0)
                .consolidateEcmpGroups(consolidateEcmpGroups)
                .defaultRouterId(0)
                .build();
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        SwitchStateManager stateManager = new SwitchStateManager(
                SwitchState.withRouters(RouterId.DEFAULT), metricsExporter.getRegistry());

        EcmpGroupConsolidator consolidator = null;
        if (consolidateEcmpGroups) {
            consolidator = new EcmpGroupConsolidator(metricsExporter.getRegistry());
            consolidation = new EcmpConsolidationPipeline(consolidator, metricsExporter.getRegistry())
                    .start(Flux.concat(
                            Mono.fromSupplier(stateManager::getCurrentState),
                            stateManager.publishedStates()));
        }

        httpServer = new HttpServer(config, stateManager, consolidator, metricsExporter);
        DisposableServer server = httpServer.start();
        client = HttpClient.create().baseUrl("http://localhost:" + server.port());
    }

    @AfterEach
    void tearDown() {
        if (consolidation != null) {
            consolidation.dispose();
        }
        if (httpServer != null) {
            httpServer.stop();
        }
    }

    private Mono<Response> get(String uri) {
        return client.get().uri(uri)
                .responseSingle((res, body) -> body.asString().defaultIfEmpty("")
                        .map(text -> new Response(res.status().code(), text)));
    }

    private Mono<Response> post(String uri, String json) {
        return client.post().uri(uri)
                .send(ByteBufFlux.fromString(Mono.just(json)))
                .responseSingle((res, body) -> body.asString().defaultIfEmpty("")
                        .map(text -> new Response(res.status().code(), text)));
    }

    private Mono<Response> delete(String uri) {
        return client.delete().uri(uri)
                .responseSingle((res, body) -> body.asString().defaultIfEmpty("")
                        .map(text -> new Response(res.status().code(), text)));
    }

    private void expectStatus(Mono<Response> request, int status) {
        StepVerifier.create(request)
                .assertNext(response -> assertEquals(status, response.status(), response.body()))
                .expectComplete()
                .verify(Duration.ofSeconds(10));
    }

    @Test
    void testHealthAndMetrics() {
        startAgent(false);

        StepVerifier.create(get("/healthz"))
                .assertNext(response -> {
                    assertEquals(200, response.status());
                    assertEquals("OK", response.body());
                })
                .verifyComplete();
        StepVerifier.create(get("/metrics"))
                .assertNext(response -> {
                    assertEquals(200, response.status());
                    assertTrue(response.body().contains("fib_state_generation"));
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Route POST and DELETE are reflected in the group listing")
    void testRouteUpdates_ReflectedInGroups() {
        startAgent(true);

        StepVerifier.create(post("/api/v1/routes", ROUTE_A))
                .assertNext(response -> {
                    assertEquals(200, response.status());
                    assertEquals(1, response.json().get("generation").asLong());
                })
                .verifyComplete();
        expectStatus(post("/api/v1/routes", ROUTE_B), 200);

        StepVerifier.create(get("/api/v1/ecmp/groups"))
                .assertNext(response -> {
                    assertEquals(200, response.status());
                    JsonNode groups = response.json();
                    assertEquals(1, groups.size());
                    assertEquals(1, groups.get(0).get("id").asLong());
                    assertEquals(2, groups.get(0).get("population").asLong());
                    assertEquals("100::1", groups.get(0).get("nextHops").get(0).get("address").asText());
                })
                .verifyComplete();

        StepVerifier.create(post("/api/v1/ecmp/lookup", NEXT_HOPS_A))
                .assertNext(response -> {
                    assertEquals(200, response.status());
                    assertEquals(1, response.json().get("id").asLong());
                    assertEquals(2, response.json().get("population").asLong());
                })
                .verifyComplete();

        StepVerifier.create(get("/api/v1/routes?family=V6"))
                .assertNext(response -> {
                    assertEquals(200, response.status());
                    assertEquals(2, response.json().size());
                })
                .verifyComplete();

        expectStatus(delete("/api/v1/routes?prefix=2601:db00::/64"), 200);
        expectStatus(delete("/api/v1/routes?prefix=2601:db01::/64"), 200);

        StepVerifier.create(get("/api/v1/ecmp/groups"))
                .assertNext(response -> assertEquals(0, response.json().size()))
                .verifyComplete();
        expectStatus(get("/api/v1/ecmp/groups/1"), 404);
    }

    @Test
    void testGroupById() {
        startAgent(true);
        expectStatus(post("/api/v1/routes", ROUTE_A), 200);

        StepVerifier.create(get("/api/v1/ecmp/groups/1"))
                .assertNext(response -> {
                    assertEquals(200, response.status());
                    assertEquals(1, response.json().get("population").asLong());
                    assertEquals(2, response.json().get("nextHops").size());
                })
                .verifyComplete();
    }

    @Test
    void testUnknownGroupOrNextHops_NotFound() {
        startAgent(true);

        expectStatus(get("/api/v1/ecmp/groups/99"), 404);
        expectStatus(post("/api/v1/ecmp/lookup", NEXT_HOPS_A), 404);
    }

    @Test
    void testBadInput_BadRequest() {
        startAgent(true);

        expectStatus(get("/api/v1/ecmp/groups/abc"), 400);
        expectStatus(post("/api/v1/ecmp/lookup", "[]"), 400);
        expectStatus(post("/api/v1/ecmp/lookup", "not json"), 400);
        expectStatus(post("/api/v1/routes", "{\"prefix\":\"2601:db00::/64\""), 400);
        expectStatus(post("/api/v1/routes", "{\"prefix\":\"bogus\",\"nextHops\":[{\"address\":\"100::1\"}]}"), 400);
        expectStatus(delete("/api/v1/routes?prefix=bogus"), 400);
        expectStatus(delete("/api/v1/routes"), 400);
        expectStatus(get("/api/v1/routes?family=V5"), 400);
    }

    @Test
    @DisplayName("ECMP endpoints answer 503 while consolidation is disabled; routes still work")
    void testConsolidationDisabled() {
        startAgent(false);

        expectStatus(post("/api/v1/routes", ROUTE_A), 200);
        expectStatus(get("/api/v1/ecmp/groups"), 503);
        expectStatus(get("/api/v1/ecmp/groups/1"), 503);
        expectStatus(post("/api/v1/ecmp/lookup", NEXT_HOPS_A), 503);
        StepVerifier.create(get("/api/v1/routes"))
                .assertNext(response -> {
                    assertEquals(200, response.status());
                    assertEquals(1, response.json().size());
                })
                .verifyComplete();
    }
}
