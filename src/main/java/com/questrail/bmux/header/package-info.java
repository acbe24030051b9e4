/**
 * Header decoding.
 *
 * <p>Turns framed header bytes into an application-defined header value plus
 * a 32-bit message id. Two schema variants are provided, both described
 * explicitly at registration time rather than discovered by reflection:
 * {@link com.questrail.bmux.header.FixedLayoutSchema} and
 * {@link com.questrail.bmux.header.SelfDescribingSchema}.</p>
 *
 * <p>Identifier rules are fixed per variant: the fixed layout uses the field
 * registered with the message-id role, the self-describing variant uses the
 * field whose normalized name is {@code msgid}.</p>
 */
package com.questrail.bmux.header;
