package com.ivamare.agentqueue.handler;

import com.ivamare.agentqueue.model.MessageType;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Registry for message handlers.
 *
 * <p>Maps each {@link MessageType} to a handler. Types without a handler, and type
 * strings outside the known set, resolve to the fallback handler.
 */
public interface HandlerRegistry {

    /**
     * Register a handler for a message type.
     *
     * @param type The message type
     * @param handler The handler function
     * @throws com.ivamare.agentqueue.exception.HandlerAlreadyRegisteredException if a handler exists
     */
    void register(MessageType type, MessageHandler handler);

    Optional<MessageHandler> get(MessageType type);

    /**
     * Resolve the handler for a raw type string, falling back for unknown types.
     *
     * @param type The {@code type} field of a message
     * @return Registered handler, or the fallback handler
     */
    MessageHandler resolve(String type);

    MessageHandler fallback();

    boolean hasHandler(MessageType type);

    Set<MessageType> registeredTypes();

    /**
     * Remove all handlers. Useful for testing.
     */
    void clear();

    /**
     * Scan a bean for @Handler annotated methods and register them.
     *
     * @param bean The bean to scan
     * @return Registered message types
     */
    List<MessageType> registerBean(Object bean);
}
