package com.ivamare.agentqueue.exception;

import com.ivamare.agentqueue.model.ErrorKind;

import java.lang.reflect.InvocationTargetException;

/**
 * Maps handler failures onto an {@link ErrorKind}.
 *
 * <p>Agent queue exceptions report their own kind; anything else is treated as transient.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    public static ErrorKind classify(Throwable error) {
        Throwable current = unwrap(error);
        if (current instanceof AgentQueueException aqe) {
            return aqe.getErrorKind();
        }
        return ErrorKind.TRANSIENT;
    }

    /**
     * Strips reflective invocation wrappers added by annotated handler dispatch.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof InvocationTargetException ite && ite.getCause() != null) {
            current = ite.getCause();
        }
        return current;
    }

    /**
     * Short error type for audit rows and error payloads.
     */
    public static String errorType(Throwable error) {
        Throwable current = unwrap(error);
        if (current instanceof AgentQueueException aqe) {
            return aqe.getErrorKind().name();
        }
        return current.getClass().getSimpleName();
    }
}
