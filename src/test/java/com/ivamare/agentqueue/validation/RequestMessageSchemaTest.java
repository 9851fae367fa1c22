package com.ivamare.agentqueue.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ivamare.agentqueue.TestMessages;
import com.ivamare.agentqueue.model.MessageType;
import com.ivamare.agentqueue.model.Priority;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RequestMessageSchema")
class RequestMessageSchemaTest {

    private JsonSchema schema;

    @BeforeEach
    void setUp() {
        schema = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012)
            .getSchema(RequestMessageSchema.document());
    }

    @Test
    @DisplayName("should accept messages serialized by the producer")
    void shouldAcceptSerializedMessages() {
        JsonNode json = TestMessages.MAPPER.valueToTree(
            TestMessages.message("acme", MessageType.MEMORY_SAVE, Priority.P0, 0, 10).withDefaults());

        Set<ValidationMessage> errors = schema.validate(json);

        assertThat(errors).isEmpty();
    }

    @Test
    @DisplayName("should reject unknown types and out-of-range priorities")
    void shouldRejectUnknownTypeAndPriority() {
        ObjectNode json = TestMessages.MAPPER.valueToTree(TestMessages.message("acme", MessageType.TOOL_CALL));
        json.put("type", "telepathy");
        json.put("priority", 7);

        Set<ValidationMessage> errors = schema.validate(json);

        assertThat(errors).hasSizeGreaterThanOrEqualTo(2);
    }

    @Test
    @DisplayName("should require the originator")
    void shouldRequireCreatedBy() {
        ObjectNode json = TestMessages.MAPPER.valueToTree(TestMessages.message("acme", MessageType.TOOL_CALL));
        json.remove("created_by");

        assertThat(schema.validate(json)).isNotEmpty();
    }
}
