package com.fibagent.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.net.InetAddresses;
import lombok.Value;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.Comparator;

/**
 * A single weighted next hop of an ECMP/UCMP group.
 * <p>
 * The address is kept in canonical text form so that {@code 100::01} and
 * {@code 100::1} name the same next hop.
 * </p>
 */
@Value
public class NextHop implements Comparable<NextHop> {
    /**
     * Weight used when a client does not specify one (plain ECMP).
     */
    public static final int DEFAULT_WEIGHT = 0;

    private static final Comparator<NextHop> ORDER = Comparator
            .comparing(NextHop::getAddress)
            .thenComparingInt(NextHop::getWeight);

    String address;
    int weight;

    private NextHop(String address, int weight) {
        this.address = address;
        this.weight = weight;
    }

    public static NextHop of(String address) {
        return of(address, DEFAULT_WEIGHT);
    }

    public static NextHop of(String address, int weight) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Next hop address is required");
        }
        if (weight < 0) {
            throw new IllegalArgumentException("Next hop weight must be non-negative: " + weight);
        }
        InetAddress parsed;
        try {
            parsed = InetAddresses.forString(address.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid next hop address: " + address, e);
        }
        return new NextHop(InetAddresses.toAddrString(parsed), weight);
    }

    @JsonIgnore
    public AddressFamily getFamily() {
        return InetAddresses.forString(address) instanceof Inet4Address ? AddressFamily.V4 : AddressFamily.V6;
    }

    @Override
    public int compareTo(NextHop other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return address + "@" + weight;
    }
}
