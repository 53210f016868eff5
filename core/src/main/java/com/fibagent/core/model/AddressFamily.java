package com.fibagent.core.model;

/**
 * IP address family of a prefix or next hop.
 */
public enum AddressFamily {
    V4,
    V6
}
