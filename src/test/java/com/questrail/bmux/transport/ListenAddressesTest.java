package com.questrail.bmux.transport;

import com.questrail.bmux.config.BmuxServerConfig;
import com.questrail.bmux.config.TransportScheme;
import com.questrail.bmux.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;

import static org.junit.jupiter.api.Assertions.*;

final class ListenAddressesTest
{
    @Test
    void resolvesLiteralAddressAndPort()
    {
        InetSocketAddress a = ListenAddresses.resolve(BmuxServerConfig.builder()
                .withAddress("127.0.0.1")
                .withPort(4567)
                .build());

        assertEquals("127.0.0.1", a.getAddress().getHostAddress());
        assertEquals(4567, a.getPort());
    }

    @Test
    void schemeMismatchIsAConfigurationError()
    {
        BmuxServerConfig config = BmuxServerConfig.builder()
                .withAddress("127.0.0.1")
                .withScheme(TransportScheme.TCP6)
                .build();

        assertThrows(ConfigurationException.class, () -> ListenAddresses.resolve(config));
    }

    @Test
    void unresolvableHostIsAConfigurationError()
    {
        BmuxServerConfig config = BmuxServerConfig.builder()
                .withAddress("no-such-host.invalid")
                .build();

        assertThrows(ConfigurationException.class, () -> ListenAddresses.resolve(config));
    }
}
