package com.ivamare.agentqueue.handler.impl;

import com.ivamare.agentqueue.handler.HandlerContext;
import com.ivamare.agentqueue.handler.MessageHandler;
import com.ivamare.agentqueue.model.RequestMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handles messages whose type has no registered handler.
 *
 * <p>Completes with a diagnostic result describing what was received, so unknown
 * types are visible to the caller instead of cycling through retries.
 */
public class DiagnosticFallbackHandler implements MessageHandler {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticFallbackHandler.class);

    @Override
    public Object handle(RequestMessage message, HandlerContext context) {
        log.warn("No handler for type={} (messageId={}), completing with diagnostic result",
            message.type(), message.messageId());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("handled", false);
        result.put("reason", "no_handler");
        result.put("type", message.type());
        result.put("context_keys", message.context().keySet());
        return result;
    }
}
