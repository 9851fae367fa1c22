package com.ivamare.agentqueue.exception;

import com.ivamare.agentqueue.model.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.InvocationTargetException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ErrorClassifier")
class ErrorClassifierTest {

    @Test
    @DisplayName("should report the kind carried by agent queue exceptions")
    void shouldReportOwnKind() {
        assertEquals(ErrorKind.VALIDATION, ErrorClassifier.classify(new MessageValidationException("bad")));
        assertEquals(ErrorKind.RATE_LIMITED, ErrorClassifier.classify(new RateLimitedException("llm", "slow down")));
        assertEquals(ErrorKind.TRANSIENT, ErrorClassifier.classify(new TransientMessageException("TIMEOUT", "late")));
    }

    @Test
    @DisplayName("should treat unknown exceptions as transient")
    void shouldTreatUnknownAsTransient() {
        assertEquals(ErrorKind.TRANSIENT, ErrorClassifier.classify(new IllegalStateException("boom")));
    }

    @Test
    @DisplayName("should unwrap reflective invocation wrappers")
    void shouldUnwrapInvocationTargetException() {
        RateLimitedException cause = new RateLimitedException("search", "quota");
        InvocationTargetException wrapped = new InvocationTargetException(new InvocationTargetException(cause));

        assertSame(cause, ErrorClassifier.unwrap(wrapped));
        assertEquals(ErrorKind.RATE_LIMITED, ErrorClassifier.classify(wrapped));
    }

    @Test
    @DisplayName("should keep an invocation wrapper without a cause")
    void shouldKeepWrapperWithoutCause() {
        InvocationTargetException empty = new InvocationTargetException(null);

        assertSame(empty, ErrorClassifier.unwrap(empty));
    }

    @Test
    @DisplayName("should use the kind name or the simple class name as error type")
    void shouldDeriveErrorType() {
        assertEquals("VALIDATION", ErrorClassifier.errorType(new MessageValidationException("bad")));
        assertEquals("IllegalArgumentException", ErrorClassifier.errorType(new IllegalArgumentException("x")));
        assertEquals("IllegalStateException",
            ErrorClassifier.errorType(new InvocationTargetException(new IllegalStateException("y"))));
    }

    @Test
    @DisplayName("should expose code and details of transient failures")
    void shouldExposeTransientDetails() {
        TransientMessageException ex = new TransientMessageException("UPSTREAM_503", "unavailable",
            Map.of("service", "search"));

        assertEquals("[UPSTREAM_503] unavailable", ex.getMessage());
        assertEquals("UPSTREAM_503", ex.getCode());
        assertEquals("unavailable", ex.getErrorMessage());
        assertEquals("search", ex.getDetails().get("service"));
        assertTrue(new TransientMessageException("X", "y", null).getDetails().isEmpty());
    }
}
