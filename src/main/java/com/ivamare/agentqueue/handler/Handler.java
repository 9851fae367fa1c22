package com.ivamare.agentqueue.handler;

import com.ivamare.agentqueue.model.MessageType;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as a message handler.
 *
 * <p>Methods annotated with @Handler on Spring beans are discovered and registered
 * by the {@link HandlerRegistry}. They must have the signature:
 * <pre>
 * Object handleXxx(RequestMessage message, HandlerContext context)
 * </pre>
 *
 * <p>Example:
 * <pre>
 * {@literal @}Component
 * public class ToolHandlers {
 *
 *     {@literal @}Handler(MessageType.TOOL_CALL)
 *     public Map&lt;String, Object&gt; callTool(RequestMessage message, HandlerContext context) {
 *         context.acknowledge();
 *         return Map.of("tool", message.context().get("tool"), "ok", true);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Handler {

    /**
     * The message type this handler processes.
     *
     * @return message type
     */
    MessageType value();
}
