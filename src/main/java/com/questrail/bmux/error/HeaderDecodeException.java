package com.questrail.bmux.error;

/**
 * Indicates that raw header bytes could not be decoded into the registered
 * header schema.
 *
 * This typically reflects:
 * <ul>
 *   <li>A field kind the fixed-layout codec does not support</li>
 *   <li>A header shorter than the declared layout</li>
 *   <li>A malformed self-describing payload</li>
 *   <li>A message id that is not an integer or does not fit in 32 bits</li>
 * </ul>
 */
public final class HeaderDecodeException extends BmuxException
{
    public HeaderDecodeException(String message)
    {
        super(message);
    }

    public HeaderDecodeException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
