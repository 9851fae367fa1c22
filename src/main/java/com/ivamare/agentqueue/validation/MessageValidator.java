package com.ivamare.agentqueue.validation;

import com.ivamare.agentqueue.exception.MessageValidationException;
import com.ivamare.agentqueue.model.RequestMessage;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Structural validation of submitted request messages.
 *
 * <p>Field constraints live on {@link RequestMessage} as Bean Validation
 * annotations; this class adds the cross-field rules and turns violations
 * into a {@link MessageValidationException}.
 */
public class MessageValidator {

    private final Validator validator;

    public MessageValidator(Validator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public static MessageValidator createDefault() {
        return new MessageValidator(Validation.buildDefaultValidatorFactory().getValidator());
    }

    /**
     * Validate a message bound for the given organization.
     *
     * @param orgId Target organization
     * @param message Message to validate
     * @throws MessageValidationException listing every violation found
     */
    public void validate(String orgId, RequestMessage message) {
        List<String> violations = violations(orgId, message);
        if (!violations.isEmpty()) {
            throw new MessageValidationException(violations);
        }
    }

    /**
     * Collect violations without throwing, sorted by property path.
     */
    public List<String> violations(String orgId, RequestMessage message) {
        List<String> violations = new ArrayList<>();
        if (orgId == null || orgId.isBlank()) {
            violations.add("target org_id must not be blank");
        }
        if (message == null) {
            violations.add("message must not be null");
            return violations;
        }

        validator.validate(message).stream()
            .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
            .map(MessageValidator::describe)
            .forEach(violations::add);

        if (orgId != null && message.orgId() != null && !orgId.equals(message.orgId())) {
            violations.add("org_id: does not match target organization " + orgId);
        }
        if (message.retryCount() != null && message.maxRetries() != null
                && message.retryCount() > message.maxRetries()) {
            violations.add("retry_count: must not exceed max_retries");
        }
        return violations;
    }

    private static String describe(ConstraintViolation<RequestMessage> violation) {
        return violation.getPropertyPath() + ": " + violation.getMessage();
    }
}
