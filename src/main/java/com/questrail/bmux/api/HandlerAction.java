package com.questrail.bmux.api;

/**
 * Outcome of handling one message.
 */
public enum HandlerAction
{
    /** Keep the connection open and read the next message. */
    CONTINUE,

    /** Close the connection once the handler returns. */
    CLOSE
}
