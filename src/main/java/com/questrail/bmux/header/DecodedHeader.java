package com.questrail.bmux.header;

import java.util.Objects;

/**
 * Result of decoding one header: the resolved message id and the
 * schema-typed header value.
 */
public record DecodedHeader<H>(int messageId, H header)
{
    public DecodedHeader
    {
        Objects.requireNonNull(header, "header");
    }
}
