package com.questrail.bmux.api;

/**
 * Wraps a handler with additional behaviour.
 *
 * <p>The returned handler decides whether and when to call {@code next};
 * not calling it short-circuits the rest of the chain.</p>
 */
@FunctionalInterface
public interface HandlerTransform<H>
{
    MessageHandler<H> wrap(MessageHandler<H> next);
}
