package com.questrail.bmux.transport;

import com.questrail.bmux.config.BmuxServerConfig;
import com.questrail.bmux.error.ConfigurationException;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;

/**
 * Resolves the configured bind address without opening any socket.
 */
public final class ListenAddresses
{
    private ListenAddresses() {}

    /**
     * @throws ConfigurationException if the address does not resolve or does
     *         not belong to the configured scheme's address family
     */
    public static InetSocketAddress resolve(BmuxServerConfig config)
    {
        final InetAddress address;
        try {
            address = InetAddress.getByName(config.address());
        }
        catch (UnknownHostException e) {
            throw new ConfigurationException("Cannot resolve bind address '" + config.address() + "'", e);
        }

        if (!config.scheme().accepts(address)) {
            throw new ConfigurationException(
                    "Bind address " + address.getHostAddress() + " is not valid for scheme " + config.scheme());
        }
        return new InetSocketAddress(address, config.port());
    }
}
