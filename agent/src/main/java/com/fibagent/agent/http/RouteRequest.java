package com.fibagent.agent.http;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fibagent.core.model.AdminDistance;
import com.fibagent.core.model.NextHop;
import com.fibagent.core.model.NextHopSet;
import com.fibagent.core.model.Route;
import com.fibagent.core.model.RoutePrefix;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * JSON body of a route add/update request.
 */
@Value
@Builder(toBuilder = true)
public class RouteRequest {
    @JsonProperty("routerId")
    Integer routerId;

    @JsonProperty("prefix")
    String prefix;

    @JsonProperty("adminDistance")
    AdminDistance adminDistance;

    @JsonProperty("nextHops")
    List<NextHopRequest> nextHops;

    /**
     * Whether the route's next hops are resolved; defaults to true.
     */
    @JsonProperty("resolved")
    Boolean resolved;

    @JsonCreator
    public RouteRequest(
        @JsonProperty("routerId") Integer routerId,
        @JsonProperty("prefix") String prefix,
        @JsonProperty("adminDistance") AdminDistance adminDistance,
        @JsonProperty("nextHops") List<NextHopRequest> nextHops,
        @JsonProperty("resolved") Boolean resolved
    ) {
        this.routerId = routerId;
        this.prefix = prefix;
        this.adminDistance = adminDistance;
        this.nextHops = nextHops;
        this.resolved = resolved;
    }

    /**
     * @throws IllegalArgumentException if the prefix or next hops are invalid
     */
    public Route toRoute() {
        RoutePrefix routePrefix = RoutePrefix.parse(prefix);
        NextHopSet nextHopSet = toNextHopSet(nextHops);
        AdminDistance distance = adminDistance != null ? adminDistance : AdminDistance.EBGP;
        return resolved == null || resolved
            ? Route.resolved(routePrefix, nextHopSet, distance)
            : Route.unresolved(routePrefix, nextHopSet, distance);
    }

    public static NextHopSet toNextHopSet(List<NextHopRequest> nextHops) {
        if (nextHops == null || nextHops.isEmpty()) {
            throw new IllegalArgumentException("At least one next hop is required");
        }
        return NextHopSet.of(nextHops.stream()
            .map(NextHopRequest::toNextHop)
            .collect(Collectors.toList()));
    }

    /**
     * One next hop of a request; weight defaults to {@link NextHop#DEFAULT_WEIGHT}.
     */
    @Value
    public static class NextHopRequest {
        @JsonProperty("address")
        String address;

        @JsonProperty("weight")
        Integer weight;

        @JsonCreator
        public NextHopRequest(
            @JsonProperty("address") String address,
            @JsonProperty("weight") Integer weight
        ) {
            this.address = address;
            this.weight = weight;
        }

        public NextHop toNextHop() {
            return NextHop.of(address, weight != null ? weight : NextHop.DEFAULT_WEIGHT);
        }
    }
}
