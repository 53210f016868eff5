package com.fibagent.core.state;

import com.fibagent.core.model.AddressFamily;
import com.fibagent.core.model.Route;
import com.fibagent.core.model.RoutePrefix;

import java.util.Collection;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Immutable forwarding information base of one router and one address family.
 * <p>
 * Every mutator returns a new instance and leaves this one untouched, so a
 * published snapshot can be read (and diffed) while newer snapshots are built.
 * Routes are kept sorted by prefix.
 * </p>
 * <p>
 * <b>Thread-safety:</b> Immutable after construction; safe for concurrent reads.
 * </p>
 */
public final class Fib {
    private final AddressFamily family;
    private final NavigableMap<RoutePrefix, Route> routes;

    private Fib(AddressFamily family, NavigableMap<RoutePrefix, Route> routes) {
        this.family = family;
        this.routes = routes;
    }

    public static Fib empty(AddressFamily family) {
        return new Fib(family, Collections.emptyNavigableMap());
    }

    public AddressFamily getFamily() {
        return family;
    }

    /**
     * @return the route for exactly this prefix, or null
     */
    public Route exactMatch(RoutePrefix prefix) {
        return routes.get(prefix);
    }

    public int size() {
        return routes.size();
    }

    public boolean isEmpty() {
        return routes.isEmpty();
    }

    /**
     * Read-only view of the routes, sorted by prefix.
     */
    public NavigableMap<RoutePrefix, Route> routes() {
        return routes;
    }

    public Collection<Route> getRoutes() {
        return routes.values();
    }

    /**
     * @throws IllegalStateException if a route for the prefix already exists
     */
    public Fib addRoute(Route route) {
        checkFamily(route);
        if (routes.containsKey(route.getPrefix())) {
            throw new IllegalStateException("Route already present for " + route.getPrefix());
        }
        return with(route);
    }

    /**
     * @throws IllegalStateException if no route for the prefix exists
     */
    public Fib updateRoute(Route route) {
        checkFamily(route);
        if (!routes.containsKey(route.getPrefix())) {
            throw new IllegalStateException("No route to update for " + route.getPrefix());
        }
        return with(route);
    }

    public Fib addOrUpdateRoute(Route route) {
        checkFamily(route);
        return with(route);
    }

    /**
     * Removes the route for a prefix; returns this instance if there is none.
     */
    public Fib removeRoute(RoutePrefix prefix) {
        if (!routes.containsKey(prefix)) {
            return this;
        }
        TreeMap<RoutePrefix, Route> copy = new TreeMap<>(routes);
        copy.remove(prefix);
        return new Fib(family, Collections.unmodifiableNavigableMap(copy));
    }

    private Fib with(Route route) {
        if (routes.get(route.getPrefix()) == route) {
            return this;
        }
        TreeMap<RoutePrefix, Route> copy = new TreeMap<>(routes);
        copy.put(route.getPrefix(), route);
        return new Fib(family, Collections.unmodifiableNavigableMap(copy));
    }

    private void checkFamily(Route route) {
        if (route.getFamily() != family) {
            throw new IllegalArgumentException(
                    "Route " + route.getPrefix() + " does not belong in the " + family + " FIB");
        }
    }

    @Override
    public String toString() {
        return "Fib{" + family + ", routes=" + routes.size() + "}";
    }
}
