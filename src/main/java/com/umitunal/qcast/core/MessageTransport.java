package com.umitunal.qcast.core;

/**
 * Outbound delivery to the messaging provider.
 *
 * Implementations report failures through {@link SendResult}. A runtime
 * exception escaping {@link #send} is treated as a transient error.
 */
@FunctionalInterface
public interface MessageTransport {

    /**
     * Send {@code text} to a single recipient.
     *
     * @param recipientId provider-side recipient identifier
     * @param text message body, delivered verbatim
     * @return the outcome of this attempt
     */
    SendResult send(String recipientId, String text);
}
