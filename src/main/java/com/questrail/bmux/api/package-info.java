/**
 * Public handler-facing types of bmux.
 *
 * <p>Application code implements {@link com.questrail.bmux.api.MessageHandler}
 * and {@link com.questrail.bmux.api.HandlerTransform}, and receives a
 * {@link com.questrail.bmux.api.MessageContext} per message. Transport types
 * (sockets, Netty channels and buffers) never appear in this package.</p>
 */
package com.questrail.bmux.api;
