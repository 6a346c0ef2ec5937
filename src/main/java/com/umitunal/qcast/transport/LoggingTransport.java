package com.umitunal.qcast.transport;

import com.umitunal.qcast.core.MessageTransport;
import com.umitunal.qcast.core.SendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Dry-run transport: logs each message instead of sending it.
 */
public class LoggingTransport implements MessageTransport {
    private static final Logger log = LoggerFactory.getLogger(LoggingTransport.class);

    private final AtomicLong sent = new AtomicLong(0);

    @Override
    public SendResult send(String recipientId, String text) {
        sent.incrementAndGet();
        log.info("[dry-run] to {}: {}", recipientId, text);
        return SendResult.delivered();
    }

    public long getSentCount() {
        return sent.get();
    }
}
