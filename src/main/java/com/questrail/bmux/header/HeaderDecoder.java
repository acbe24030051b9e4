package com.questrail.bmux.header;

import com.questrail.bmux.error.BmuxException;
import com.questrail.bmux.error.ConfigurationException;
import com.questrail.bmux.error.HeaderDecodeException;

/**
 * HeaderDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary between framed header bytes and a typed header.
 *
 * <p>The decoder owns one {@link HeaderSchema}, chosen at server assembly.
 * It guarantees that every failure surfaces as a
 * {@link com.questrail.bmux.error.BmuxException}: exceptions thrown by
 * application code inside a schema (a field setter, a Jackson-bound
 * constructor) are reported as decode failures, so a single bad header can
 * only ever close its own connection.</p>
 */
public final class HeaderDecoder<H>
{
    private final HeaderSchema<H> schema;

    public HeaderDecoder(HeaderSchema<H> schema)
    {
        if (schema == null) {
            throw new ConfigurationException("Header schema must not be null");
        }
        this.schema = schema;
    }

    public HeaderSchema<H> schema()
    {
        return schema;
    }

    public DecodedHeader<H> decode(byte[] rawHead)
    {
        try {
            return schema.decode(rawHead);
        }
        catch (BmuxException e) {
            throw e;
        }
        catch (RuntimeException e) {
            throw new HeaderDecodeException("Header schema failed: " + e.getMessage(), e);
        }
    }
}
