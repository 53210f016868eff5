package com.fibagent.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Optional;

/**
 * Immutable unicast route as stored in a FIB snapshot.
 * <p>
 * {@code nextHops} is the group a client asked for; {@code resolvedNextHops}
 * is the forwarding information computed for it. A route is <i>resolved</i>
 * only while it carries forwarding information, and only resolved routes
 * count towards a next-hop group's population.
 * </p>
 */
@Value
@With
public class Route {
    RoutePrefix prefix;

    AdminDistance adminDistance;

    /**
     * Next hops requested by the programming client.
     */
    NextHopSet nextHops;

    /**
     * Forwarding next hops, or {@code null} while the route is unresolved.
     */
    NextHopSet resolvedNextHops;

    @Builder(toBuilder = true)
    public Route(RoutePrefix prefix, AdminDistance adminDistance, NextHopSet nextHops, NextHopSet resolvedNextHops) {
        if (prefix == null) {
            throw new IllegalArgumentException("Route prefix is required");
        }
        if (nextHops == null) {
            throw new IllegalArgumentException("Route " + prefix + " has no next hops");
        }
        checkFamily(prefix, nextHops);
        if (resolvedNextHops != null) {
            checkFamily(prefix, resolvedNextHops);
        }
        this.prefix = prefix;
        this.adminDistance = adminDistance != null ? adminDistance : AdminDistance.MAX_ADMIN_DISTANCE;
        this.nextHops = nextHops;
        this.resolvedNextHops = resolvedNextHops;
    }

    /**
     * Creates a route resolved to exactly the next hops it requests.
     */
    public static Route resolved(RoutePrefix prefix, NextHopSet nextHops, AdminDistance adminDistance) {
        return new Route(prefix, adminDistance, nextHops, nextHops);
    }

    /**
     * Creates a route whose next hops have not been resolved.
     */
    public static Route unresolved(RoutePrefix prefix, NextHopSet nextHops, AdminDistance adminDistance) {
        return new Route(prefix, adminDistance, nextHops, null);
    }

    public boolean isResolved() {
        return resolvedNextHops != null;
    }

    /**
     * Next-hop set this route contributes to, empty when unresolved.
     */
    public Optional<NextHopSet> forwardNextHops() {
        return Optional.ofNullable(resolvedNextHops);
    }

    public Route resolve() {
        return withResolvedNextHops(nextHops);
    }

    public Route clearForward() {
        return withResolvedNextHops(null);
    }

    public AddressFamily getFamily() {
        return prefix.getFamily();
    }

    private static void checkFamily(RoutePrefix prefix, NextHopSet nextHops) {
        // v4 over v6 next hops is legal (RFC 5549), the reverse is not
        if (prefix.getFamily() == AddressFamily.V6) {
            for (NextHop nextHop : nextHops) {
                if (nextHop.getFamily() != AddressFamily.V6) {
                    throw new IllegalArgumentException(
                            "IPv6 route " + prefix + " cannot use IPv4 next hop " + nextHop.getAddress());
                }
            }
        }
    }
}
