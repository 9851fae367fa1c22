package com.ivamare.agentqueue.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Originator of a request message.
 *
 * @param type Originator kind: user, agent or system
 * @param id Originator identifier; doubles as the user rate-limit key
 */
public record CreatedBy(
    @JsonProperty("type")
    @NotBlank
    @Pattern(regexp = "user|agent|system", message = "must be one of user, agent, system")
    String type,

    @JsonProperty("id")
    @NotBlank
    String id
) {
    public static CreatedBy user(String id) {
        return new CreatedBy("user", id);
    }

    public static CreatedBy agent(String id) {
        return new CreatedBy("agent", id);
    }

    public static CreatedBy system(String id) {
        return new CreatedBy("system", id);
    }
}
