package io.schemagate.core.error;

import io.schemagate.core.model.RejectionKind;
import io.schemagate.core.model.ValidationOutcome;
import java.util.Objects;

/**
 * The payload does not satisfy the constraint tree. Disclosed in full only to callers holding
 * read access to the module. URN: {@code urn:schema-gate:error:validation-failed}
 */
public final class ValidationException extends CallException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:schema-gate:error:validation-failed";

    private final RejectionKind rejectionKind;

    public ValidationException(RejectionKind rejectionKind, String path, String message) {
        super(message, path);
        this.rejectionKind = Objects.requireNonNull(rejectionKind, "rejectionKind must not be null");
    }

    /**
     * Creates the exception from a rejected outcome.
     *
     * @throws IllegalArgumentException if the outcome was accepted
     */
    public static ValidationException from(ValidationOutcome outcome) {
        if (!outcome.isRejected()) {
            throw new IllegalArgumentException("outcome is not a rejection: " + outcome);
        }
        return new ValidationException(outcome.kind(), outcome.path(), outcome.detail());
    }

    public RejectionKind rejectionKind() {
        return rejectionKind;
    }

    @Override
    public String kind() {
        return rejectionKind.token();
    }

    @Override
    public String urn() {
        return URN;
    }
}
