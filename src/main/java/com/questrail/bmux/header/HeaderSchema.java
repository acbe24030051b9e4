package com.questrail.bmux.header;

/**
 * HeaderSchema
 * =============================================================================
 * Describes how raw header bytes become an application header value and which
 * part of that value is the message identifier.
 *
 * <h2>Variants</h2>
 * Exactly two strategies exist and they are mutually exclusive per registered
 * type:
 * <ul>
 *   <li>{@link SelfDescribingSchema} - the payload carries its own structure
 *       (JSON). The identifier is found by field name.</li>
 *   <li>{@link FixedLayoutSchema} - an explicit, ordered list of fixed-width
 *       big-endian integer fields. The identifier is the field registered with
 *       the message-id role.</li>
 * </ul>
 *
 * <p>The strategy is chosen once, when the schema is handed to the server, and
 * never re-evaluated per message.</p>
 *
 * <p>Implementations must be safe for concurrent use: the same schema decodes
 * headers for every connection.</p>
 */
public sealed interface HeaderSchema<H>
        permits SelfDescribingSchema, FixedLayoutSchema {

    /**
     * Decode one header.
     *
     * @param rawHead header bytes exactly as framed on the wire
     * @return the message id and a freshly populated header value
     * @throws com.questrail.bmux.error.HeaderDecodeException if the bytes do not
     *         match the schema or the id is not a 32-bit integer
     * @throws com.questrail.bmux.error.HeaderSchemaException if no id field can be
     *         resolved
     */
    DecodedHeader<H> decode(byte[] rawHead);
}
