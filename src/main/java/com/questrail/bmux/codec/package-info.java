/**
 * bmux Codec - Envelope Framing
 * =============================================================================
 *
 * <p>This package implements the wire-level framing of the bmux protocol:</p>
 *
 * <pre>
 *   byte 0       : header length H (0..255)
 *   bytes 1-2    : body length L (0..65535), big-endian
 *   bytes 3..3+H : header payload
 *   next L bytes : body payload
 * </pre>
 *
 * <h2>Byte order</h2>
 * <p>The 16-bit body length is always written and read in network byte order
 * (big-endian), the same order the fixed-layout header codec uses for its
 * integer fields. There is no little-endian mode.</p>
 *
 * <h2>Boundaries</h2>
 * <ul>
 *   <li>Framing never interprets header or body content.</li>
 *   <li>The blocking {@link com.questrail.bmux.codec.EnvelopeReader} serves the
 *       thread-per-connection engine; the event-loop engine uses its own
 *       accumulating decoder in {@code com.questrail.bmux.transport.netty}.</li>
 * </ul>
 */
package com.questrail.bmux.codec;
