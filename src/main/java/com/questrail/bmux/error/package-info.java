/**
 * Error taxonomy of the bmux core.
 *
 * <p>Per-connection failures ({@link com.questrail.bmux.error.FramingException},
 * {@link com.questrail.bmux.error.HeaderDecodeException},
 * {@link com.questrail.bmux.error.HeaderSchemaException}) close the offending
 * connection and never the server. A dispatch miss is not an error at all and
 * is reported through the observability sink instead.</p>
 */
package com.questrail.bmux.error;
