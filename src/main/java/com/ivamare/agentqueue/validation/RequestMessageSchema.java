package com.ivamare.agentqueue.validation;

import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * JSON Schema (2020-12) of the request message, for producers outside the JVM.
 */
public final class RequestMessageSchema {

    public static final String CLASSPATH_LOCATION = "schema/request-message.schema.json";

    private RequestMessageSchema() {
    }

    /**
     * @return the schema document as JSON text
     */
    public static String document() {
        try (InputStream in = new ClassPathResource(CLASSPATH_LOCATION).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + CLASSPATH_LOCATION, e);
        }
    }
}
