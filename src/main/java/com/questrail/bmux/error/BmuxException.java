package com.questrail.bmux.error;

/**
 * Base type for every runtime failure raised by the bmux core.
 *
 * <p>Subclasses map one-to-one onto the failure kinds the server reacts to:</p>
 * <ul>
 *   <li>{@link FramingException} - the byte stream could not be cut into an envelope</li>
 *   <li>{@link HeaderDecodeException} - header bytes did not match the schema</li>
 *   <li>{@link HeaderSchemaException} - the schema cannot resolve a message id</li>
 *   <li>{@link ConfigurationException} - the server was assembled incorrectly</li>
 * </ul>
 *
 * <p>The first three terminate only the connection they occur on.
 * {@link ConfigurationException} is fatal at startup.</p>
 */
public abstract class BmuxException extends RuntimeException
{
    protected BmuxException(String message)
    {
        super(message);
    }

    protected BmuxException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
