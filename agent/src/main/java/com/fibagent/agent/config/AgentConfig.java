package com.fibagent.agent.config;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration for the FIB agent, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class AgentConfig {

    String nodeId;
    int httpPort;

    // Feature gate for next-hop group tracking; off leaves no consolidator state
    boolean consolidateEcmpGroups;

    // Router used by route requests that do not name one
    int defaultRouterId;

    public static AgentConfig fromEnv() {
        return AgentConfig.builder()
            .nodeId(getEnv("NODE_ID", "fib-agent-1"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8090")))
            .consolidateEcmpGroups(Boolean.parseBoolean(getEnv("CONSOLIDATE_ECMP_GROUPS", "false")))
            .defaultRouterId(Integer.parseInt(getEnv("DEFAULT_ROUTER_ID", "0")))
            .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
