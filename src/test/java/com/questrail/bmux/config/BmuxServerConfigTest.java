package com.questrail.bmux.config;

import com.questrail.bmux.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class BmuxServerConfigTest
{
    @Test
    void defaultsMatchDocumentedValues()
    {
        BmuxServerConfig c = BmuxServerConfig.defaults();

        assertEquals("0.0.0.0", c.address());
        assertEquals(30000, c.port());
        assertEquals(TransportScheme.TCP, c.scheme());
        assertEquals(ConcurrencyModel.EVENT_LOOP, c.concurrencyModel());
        assertEquals(3, c.headerPrefixSize());
        assertEquals(1024, c.maxConnections());
        assertEquals(Duration.ofSeconds(15), c.readTimeout());
        assertEquals(Duration.ZERO, c.writeTimeout());
        assertEquals(Duration.ZERO, c.idleTimeout());
        assertEquals(Duration.ofSeconds(15), c.shutdownTimeout());
        assertTrue(c.keepAlive());
        assertTrue(c.multicore());
        assertFalse(c.experimental());
        assertFalse(c.packetLogging());
    }

    @Test
    void toBuilderRoundTripsEveryField()
    {
        BmuxServerConfig c = BmuxServerConfig.builder()
                .withAddress("127.0.0.1")
                .withPort(0)
                .withScheme(TransportScheme.TCP4)
                .withConcurrencyModel(ConcurrencyModel.BLOCKING)
                .withMaxConnections(2)
                .withReadTimeout(Duration.ofMillis(250))
                .withWriteTimeout(Duration.ofSeconds(1))
                .withIdleTimeout(Duration.ofSeconds(30))
                .withShutdownTimeout(Duration.ZERO)
                .withKeepAlive(false)
                .withMulticore(false)
                .withExperimental(true)
                .withPacketLogging(true)
                .build();

        assertEquals(c, c.toBuilder().build());
    }

    @Test
    void headerPrefixSizeOtherThanThreeIsRejected()
    {
        assertThrows(ConfigurationException.class,
                () -> BmuxServerConfig.builder().withHeaderPrefixSize(4).build());
    }

    @Test
    void nonPositiveConnectionCapIsRejected()
    {
        assertThrows(ConfigurationException.class,
                () -> BmuxServerConfig.builder().withMaxConnections(0).build());
    }

    @Test
    void negativeTimeoutIsRejected()
    {
        assertThrows(ConfigurationException.class,
                () -> BmuxServerConfig.builder().withReadTimeout(Duration.ofMillis(-1)).build());
        assertThrows(ConfigurationException.class,
                () -> BmuxServerConfig.builder().withShutdownTimeout(null).build());
    }

    @Test
    void portOutOfRangeIsRejected()
    {
        assertThrows(ConfigurationException.class, () -> BmuxServerConfig.builder().withPort(70000).build());
    }

    @Test
    void schemeRestrictsAddressFamily() throws Exception
    {
        java.net.InetAddress v4 = java.net.InetAddress.getByName("127.0.0.1");
        java.net.InetAddress v6 = java.net.InetAddress.getByName("::1");

        assertTrue(TransportScheme.TCP.accepts(v4));
        assertTrue(TransportScheme.TCP.accepts(v6));
        assertTrue(TransportScheme.TCP4.accepts(v4));
        assertFalse(TransportScheme.TCP4.accepts(v6));
        assertTrue(TransportScheme.TCP6.accepts(v6));
        assertFalse(TransportScheme.TCP6.accepts(v4));
    }
}
