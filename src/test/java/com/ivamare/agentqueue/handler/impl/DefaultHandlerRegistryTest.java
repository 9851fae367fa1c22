package com.ivamare.agentqueue.handler.impl;

import com.ivamare.agentqueue.TestMessages;
import com.ivamare.agentqueue.exception.HandlerAlreadyRegisteredException;
import com.ivamare.agentqueue.handler.Handler;
import com.ivamare.agentqueue.handler.HandlerContext;
import com.ivamare.agentqueue.handler.MessageHandler;
import com.ivamare.agentqueue.model.MessageType;
import com.ivamare.agentqueue.model.RequestMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DefaultHandlerRegistryTest {

    private DefaultHandlerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultHandlerRegistry();
    }

    private HandlerContext createTestContext(RequestMessage message) {
        return new HandlerContext(message, "key", "planner", null);
    }

    @Nested
    class RegisterTests {

        @Test
        void shouldRegisterHandler() {
            MessageHandler handler = (msg, ctx) -> "result";

            registry.register(MessageType.TOOL_CALL, handler);

            assertTrue(registry.hasHandler(MessageType.TOOL_CALL));
            assertEquals(Set.of(MessageType.TOOL_CALL), registry.registeredTypes());
        }

        @Test
        void shouldThrowOnDuplicateRegistration() {
            MessageHandler handler = (msg, ctx) -> "result";
            registry.register(MessageType.TOOL_CALL, handler);

            HandlerAlreadyRegisteredException e = assertThrows(HandlerAlreadyRegisteredException.class, () ->
                registry.register(MessageType.TOOL_CALL, handler));
            assertEquals(MessageType.TOOL_CALL, e.getMessageType());
        }

        @Test
        void shouldClearHandlers() {
            registry.register(MessageType.TOOL_CALL, (msg, ctx) -> null);

            registry.clear();

            assertFalse(registry.hasHandler(MessageType.TOOL_CALL));
            assertTrue(registry.registeredTypes().isEmpty());
        }
    }

    @Nested
    class ResolveTests {

        @Test
        void shouldResolveRegisteredHandler() {
            MessageHandler handler = (msg, ctx) -> "result";
            registry.register(MessageType.MODEL_CALL, handler);

            assertSame(handler, registry.resolve("model_call"));
            assertEquals(handler, registry.get(MessageType.MODEL_CALL).orElseThrow());
        }

        @Test
        void shouldFallBackForUnregisteredType() {
            assertSame(registry.fallback(), registry.resolve("memory_save"));
            assertTrue(registry.get(MessageType.MEMORY_SAVE).isEmpty());
        }

        @Test
        void shouldFallBackForUnknownTypeString() {
            assertSame(registry.fallback(), registry.resolve("telepathy"));
            assertSame(registry.fallback(), registry.resolve(null));
        }

        @Test
        void shouldReturnDiagnosticResultFromFallback() throws Exception {
            RequestMessage message = TestMessages.message("acme", MessageType.AGENT_SPAWN);

            Object result = registry.fallback().handle(message, createTestContext(message));

            @SuppressWarnings("unchecked")
            Map<String, Object> diagnostic = (Map<String, Object>) result;
            assertEquals(false, diagnostic.get("handled"));
            assertEquals("no_handler", diagnostic.get("reason"));
            assertEquals("agent_spawn", diagnostic.get("type"));
            assertEquals(Set.of("prompt"), diagnostic.get("context_keys"));
        }

        @Test
        void shouldUseCustomFallback() {
            MessageHandler custom = (msg, ctx) -> "custom";
            DefaultHandlerRegistry withCustom = new DefaultHandlerRegistry(custom);

            assertSame(custom, withCustom.resolve("tool_call"));
        }
    }

    @Nested
    class BeanScanningTests {

        @Test
        void shouldRegisterAnnotatedMethods() throws Exception {
            ToolHandlers bean = new ToolHandlers();

            List<MessageType> registered = registry.registerBean(bean);

            assertThat(registered).containsExactlyInAnyOrder(MessageType.TOOL_CALL, MessageType.MEMORY_RETRIEVE);
            RequestMessage message = TestMessages.message("acme", MessageType.TOOL_CALL);
            assertEquals(Map.of("ok", true), registry.resolve("tool_call").handle(message, createTestContext(message)));
        }

        @Test
        void shouldRegisterFromPostProcessor() {
            registry.postProcessAfterInitialization(new ToolHandlers(), "toolHandlers");

            assertTrue(registry.hasHandler(MessageType.TOOL_CALL));
        }

        @Test
        void shouldIgnoreBeansWithoutHandlers() {
            Object bean = new Object();

            assertSame(bean, registry.postProcessAfterInitialization(bean, "plain"));
            assertTrue(registry.registeredTypes().isEmpty());
        }

        @Test
        void shouldRejectInvalidSignature() {
            assertThrows(IllegalArgumentException.class, () -> registry.registerBean(new InvalidHandlers()));
        }
    }

    public static class ToolHandlers {

        @Handler(MessageType.TOOL_CALL)
        public Map<String, Object> callTool(RequestMessage message, HandlerContext context) {
            return Map.of("ok", true);
        }

        @Handler(MessageType.MEMORY_RETRIEVE)
        public Object retrieve(RequestMessage message, HandlerContext context) {
            return List.of();
        }
    }

    public static class InvalidHandlers {

        @Handler(MessageType.MODEL_CALL)
        public Object wrong(RequestMessage message) {
            return null;
        }
    }
}
