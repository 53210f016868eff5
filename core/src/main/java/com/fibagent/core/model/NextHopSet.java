package com.fibagent.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableSortedSet;
import lombok.EqualsAndHashCode;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable, unordered set of weighted next hops forming one ECMP group.
 * <p>
 * Members are held sorted, so two sets built from the same (address, weight)
 * pairs in any order are equal and hash alike. Instances are used directly as
 * the lookup key for next-hop group identifiers.
 * </p>
 */
@EqualsAndHashCode
public final class NextHopSet implements Iterable<NextHop> {
    private final ImmutableSortedSet<NextHop> nextHops;

    private NextHopSet(ImmutableSortedSet<NextHop> nextHops) {
        this.nextHops = nextHops;
    }

    public static NextHopSet of(Collection<NextHop> nextHops) {
        ImmutableSortedSet<NextHop> sorted = ImmutableSortedSet.copyOf(nextHops);
        if (sorted.isEmpty()) {
            throw new IllegalArgumentException("Next hop set must not be empty");
        }
        return new NextHopSet(sorted);
    }

    public static NextHopSet of(NextHop... nextHops) {
        return of(List.of(nextHops));
    }

    /**
     * Builds a set of default-weight next hops from address literals.
     */
    public static NextHopSet ofAddresses(String... addresses) {
        ImmutableSortedSet.Builder<NextHop> builder = ImmutableSortedSet.naturalOrder();
        for (String address : addresses) {
            builder.add(NextHop.of(address));
        }
        return of(builder.build());
    }

    /**
     * Returns a copy of this set without the given member.
     *
     * @throws IllegalArgumentException if the result would be empty
     */
    public NextHopSet without(NextHop nextHop) {
        return of(nextHops.stream()
                .filter(nh -> !nh.equals(nextHop))
                .collect(Collectors.toList()));
    }

    public NextHop first() {
        return nextHops.first();
    }

    public int size() {
        return nextHops.size();
    }

    @JsonValue
    public List<NextHop> asList() {
        return nextHops.asList();
    }

    @Override
    public Iterator<NextHop> iterator() {
        return nextHops.iterator();
    }

    @Override
    public String toString() {
        return nextHops.toString();
    }
}
