package com.fibagent.core.model;

import com.google.common.net.InetAddresses;
import com.google.common.primitives.UnsignedBytes;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Comparator;
import java.util.Objects;

/**
 * Destination prefix of a route: a network address and a mask length.
 * <p>
 * Host bits are cleared on construction, so {@code 10.0.0.7/24} and
 * {@code 10.0.0.0/24} are the same prefix. Prefixes order by family, then by
 * network bytes (unsigned), then by mask length, which is the iteration order
 * of a {@link com.fibagent.core.state.Fib}.
 * </p>
 */
public final class RoutePrefix implements Comparable<RoutePrefix> {
    private static final Comparator<byte[]> BYTES = UnsignedBytes.lexicographicalComparator();

    private final InetAddress network;
    private final int length;

    private RoutePrefix(InetAddress network, int length) {
        this.network = network;
        this.length = length;
    }

    public static RoutePrefix of(String address, int length) {
        InetAddress parsed;
        try {
            parsed = InetAddresses.forString(address.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid prefix address: " + address, e);
        }
        byte[] bytes = parsed.getAddress();
        int maxLength = bytes.length * 8;
        if (length < 0 || length > maxLength) {
            throw new IllegalArgumentException(
                    "Mask length " + length + " out of range for " + address + " (max " + maxLength + ")");
        }
        try {
            return new RoutePrefix(InetAddress.getByAddress(mask(bytes, length)), length);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Invalid prefix address: " + address, e);
        }
    }

    /**
     * Parses {@code "address/length"}.
     */
    public static RoutePrefix parse(String cidr) {
        if (cidr == null) {
            throw new IllegalArgumentException("Prefix is required");
        }
        int slash = cidr.indexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException("Prefix must be in address/length form: " + cidr);
        }
        int length;
        try {
            length = Integer.parseInt(cidr.substring(slash + 1).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid mask length in prefix: " + cidr, e);
        }
        return of(cidr.substring(0, slash), length);
    }

    public String getNetwork() {
        return InetAddresses.toAddrString(network);
    }

    public int getLength() {
        return length;
    }

    public AddressFamily getFamily() {
        return network instanceof Inet4Address ? AddressFamily.V4 : AddressFamily.V6;
    }

    @Override
    public int compareTo(RoutePrefix other) {
        int byFamily = getFamily().compareTo(other.getFamily());
        if (byFamily != 0) {
            return byFamily;
        }
        int byNetwork = BYTES.compare(network.getAddress(), other.network.getAddress());
        if (byNetwork != 0) {
            return byNetwork;
        }
        return Integer.compare(length, other.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoutePrefix)) return false;
        RoutePrefix other = (RoutePrefix) o;
        return length == other.length && network.equals(other.network);
    }

    @Override
    public int hashCode() {
        return Objects.hash(network, length);
    }

    @Override
    public String toString() {
        return getNetwork() + "/" + length;
    }

    private static byte[] mask(byte[] bytes, int length) {
        byte[] masked = bytes.clone();
        for (int i = 0; i < masked.length; i++) {
            int bitsInByte = Math.max(0, Math.min(8, length - i * 8));
            masked[i] = (byte) (masked[i] & (0xFF << (8 - bitsInByte)));
        }
        return masked;
    }
}
