package com.questrail.bmux.error;

/**
 * Indicates an invalid server assembly: a missing collaborator, an out of
 * range configuration value, or an address that does not match the
 * configured transport scheme.
 *
 * <p>Always raised before any socket is opened.</p>
 */
public final class ConfigurationException extends BmuxException
{
    public ConfigurationException(String message)
    {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
