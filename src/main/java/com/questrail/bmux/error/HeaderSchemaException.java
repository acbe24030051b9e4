package com.questrail.bmux.error;

/**
 * Indicates that a header schema has no resolvable message id field.
 */
public final class HeaderSchemaException extends BmuxException
{
    public HeaderSchemaException(String message)
    {
        super(message);
    }
}
