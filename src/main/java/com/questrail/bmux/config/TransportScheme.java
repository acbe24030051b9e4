package com.questrail.bmux.config;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;

/**
 * Stream transport a server listens on.
 */
public enum TransportScheme
{
    /** TCP on whatever address family the bind address resolves to. */
    TCP,

    /** TCP restricted to IPv4 bind addresses. */
    TCP4,

    /** TCP restricted to IPv6 bind addresses. */
    TCP6;

    public boolean accepts(InetAddress address)
    {
        return switch (this) {
            case TCP -> true;
            case TCP4 -> address instanceof Inet4Address;
            case TCP6 -> address instanceof Inet6Address;
        };
    }
}
