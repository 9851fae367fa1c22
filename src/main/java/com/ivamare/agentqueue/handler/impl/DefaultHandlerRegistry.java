package com.ivamare.agentqueue.handler.impl;

import com.ivamare.agentqueue.exception.HandlerAlreadyRegisteredException;
import com.ivamare.agentqueue.handler.Handler;
import com.ivamare.agentqueue.handler.HandlerContext;
import com.ivamare.agentqueue.handler.HandlerRegistry;
import com.ivamare.agentqueue.handler.MessageHandler;
import com.ivamare.agentqueue.model.MessageType;
import com.ivamare.agentqueue.model.RequestMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.BeanPostProcessor;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Default implementation of HandlerRegistry.
 *
 * <p>Implements BeanPostProcessor to discover and register handlers from Spring
 * beans with @Handler methods.
 */
public class DefaultHandlerRegistry implements HandlerRegistry, BeanPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(DefaultHandlerRegistry.class);

    private final Map<MessageType, MessageHandler> handlers = new EnumMap<>(MessageType.class);
    private final MessageHandler fallback;

    public DefaultHandlerRegistry() {
        this(new DiagnosticFallbackHandler());
    }

    public DefaultHandlerRegistry(MessageHandler fallback) {
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    @Override
    public synchronized void register(MessageType type, MessageHandler handler) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        if (handlers.containsKey(type)) {
            throw new HandlerAlreadyRegisteredException(type);
        }
        handlers.put(type, handler);
        log.debug("Registered handler for {}", type.getValue());
    }

    @Override
    public synchronized Optional<MessageHandler> get(MessageType type) {
        return Optional.ofNullable(handlers.get(type));
    }

    @Override
    public MessageHandler resolve(String type) {
        return MessageType.find(type)
            .flatMap(this::get)
            .orElse(fallback);
    }

    @Override
    public MessageHandler fallback() {
        return fallback;
    }

    @Override
    public synchronized boolean hasHandler(MessageType type) {
        return handlers.containsKey(type);
    }

    @Override
    public synchronized Set<MessageType> registeredTypes() {
        return Set.copyOf(handlers.keySet());
    }

    @Override
    public synchronized void clear() {
        handlers.clear();
    }

    @Override
    public List<MessageType> registerBean(Object bean) {
        List<MessageType> registered = new ArrayList<>();

        for (Method method : bean.getClass().getMethods()) {
            Handler annotation = method.getAnnotation(Handler.class);
            if (annotation == null) {
                continue;
            }

            validateHandlerMethod(method);

            MessageType type = annotation.value();
            MessageHandler handler = (message, context) -> method.invoke(bean, message, context);

            register(type, handler);
            registered.add(type);

            log.info("Discovered handler {}.{}() for {}",
                bean.getClass().getSimpleName(), method.getName(), type.getValue());
        }

        return registered;
    }

    /**
     * BeanPostProcessor callback - scans beans for @Handler methods.
     */
    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        boolean hasHandlers = Arrays.stream(bean.getClass().getMethods())
            .anyMatch(m -> m.isAnnotationPresent(Handler.class));

        if (hasHandlers) {
            registerBean(bean);
        }

        return bean;
    }

    private void validateHandlerMethod(Method method) {
        Class<?>[] params = method.getParameterTypes();
        if (params.length != 2
            || !params[0].equals(RequestMessage.class)
            || !params[1].equals(HandlerContext.class)) {

            throw new IllegalArgumentException(
                "Handler method " + method.getName() + " must have signature: "
                    + "Object methodName(RequestMessage message, HandlerContext context)"
            );
        }
    }
}
