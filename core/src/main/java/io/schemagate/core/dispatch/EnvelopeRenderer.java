package io.schemagate.core.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemagate.core.error.AuthorizationException;
import io.schemagate.core.error.CallbackException;
import io.schemagate.core.error.SchemaResolutionException;
import io.schemagate.core.error.ValidationException;
import io.schemagate.core.model.ResponseEnvelope;
import java.util.Locale;

/**
 * Renders a {@link ResponseEnvelope} for the caller. Failures become a Problem Details style
 * object ({@code type}, {@code title}, {@code detail}, {@code instance}) with a URN per status;
 * successes carry the callback payload.
 *
 * <p>Audit fields are never rendered. Thread-safe and stateless.
 */
public final class EnvelopeRenderer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ObjectNode render(ResponseEnvelope envelope) {
        ObjectNode out = MAPPER.createObjectNode();
        if (envelope.isOk()) {
            out.put("status", "ok");
            out.put("callId", envelope.callId());
            out.put("instance", envelope.path());
            if (envelope.payload() != null) {
                out.set("payload", envelope.payload());
            } else {
                out.putNull("payload");
            }
            return out;
        }
        out.put("type", urn(envelope.status()));
        out.put("title", title(envelope.status()));
        out.put("status", envelope.status().name().toLowerCase(Locale.ROOT).replace('_', '-'));
        out.put("detail", envelope.detail());
        out.put("instance", envelope.path());
        out.put("callId", envelope.callId());
        return out;
    }

    private static String urn(ResponseEnvelope.Status status) {
        return switch (status) {
            case NOT_FOUND -> SchemaResolutionException.URN;
            case VALIDATION_FAILED -> ValidationException.URN;
            case ACCESS_DENIED -> AuthorizationException.URN;
            case CALLBACK_ERROR -> CallbackException.URN;
            case OK -> throw new IllegalArgumentException("OK has no problem type");
        };
    }

    private static String title(ResponseEnvelope.Status status) {
        return switch (status) {
            case NOT_FOUND -> "Path Not Found";
            case VALIDATION_FAILED -> "Validation Failed";
            case ACCESS_DENIED -> "Access Denied";
            case CALLBACK_ERROR -> "Callback Failed";
            case OK -> "OK";
        };
    }
}
