package io.schemagate.core.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemagate.core.error.AuthorizationException;
import io.schemagate.core.model.CallState;
import io.schemagate.core.model.ResponseEnvelope;
import io.schemagate.core.model.ResponseEnvelope.Status;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class EnvelopeRendererTest {

    private final EnvelopeRenderer renderer = new EnvelopeRenderer();

    @Test
    void okCarriesPayload() {
        ObjectNode body = renderer.render(ResponseEnvelope.ok("s1-1", "/system/load", IntNode.valueOf(7), List.of()));

        assertThat(body.get("status").asText()).isEqualTo("ok");
        assertThat(body.get("callId").asText()).isEqualTo("s1-1");
        assertThat(body.get("instance").asText()).isEqualTo("/system/load");
        assertThat(body.get("payload")).isEqualTo(IntNode.valueOf(7));
    }

    @Test
    void okWithoutPayloadRendersNull() {
        ObjectNode body = renderer.render(ResponseEnvelope.ok("s1-1", "/system", null, List.of()));

        assertThat(body.get("payload").isNull()).isTrue();
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource({
        "NOT_FOUND, NOT_FOUND, urn:schema-gate:error:not-found, not-found",
        "VALIDATION_FAILED, REJECTED, urn:schema-gate:error:validation-failed, validation-failed",
        "ACCESS_DENIED, DENIED, urn:schema-gate:error:access-denied, access-denied",
        "CALLBACK_ERROR, CALLBACK_ERROR, urn:schema-gate:error:callback-failed, callback-error"
    })
    @DisplayName("failures render as problem objects")
    void failures(Status status, CallState state, String urn, String token) {
        ResponseEnvelope envelope =
                ResponseEnvelope.failure(status, state, "s1-2", "/system/load", "caller text", "kind", "/audit", "secret");

        ObjectNode body = renderer.render(envelope);

        assertThat(body.get("type").asText()).isEqualTo(urn);
        assertThat(body.get("status").asText()).isEqualTo(token);
        assertThat(body.get("detail").asText()).isEqualTo("caller text");
        assertThat(body.get("instance").asText()).isEqualTo("/system/load");
        assertThat(body.has("title")).isTrue();
    }

    @Test
    @DisplayName("audit fields never reach the rendered body")
    void auditFieldsNotRendered() {
        ResponseEnvelope envelope = ResponseEnvelope.failure(Status.ACCESS_DENIED, CallState.REJECTED, "s1-3",
                "/system/token", AuthorizationException.GENERIC_DETAIL, "pattern-mismatch", "/system/token",
                "value does not match pattern '[0-9a-f]{8}'");

        String rendered = renderer.render(envelope).toString();

        assertThat(rendered).doesNotContain("pattern-mismatch").doesNotContain("[0-9a-f]{8}");
    }

    @Test
    void failureEnvelopeRequiresTerminalState() {
        assertThatThrownBy(() -> ResponseEnvelope.failure(
                        Status.CALLBACK_ERROR, CallState.INVOKED, "c", "/p", "d", "k", "/p", "d"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResponseEnvelope.failure(
                        Status.OK, CallState.COMPLETED, "c", "/p", "d", "k", "/p", "d"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
