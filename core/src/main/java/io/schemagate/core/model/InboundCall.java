package io.schemagate.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * A call as handed over by the transport layer, before any resolution or validation.
 *
 * @param kind    what the caller wants to do
 * @param path    absolute target path, optionally with list-key predicates
 * @param payload raw value; {@code null} for {@link CallKind#DATA_READ}
 */
public record InboundCall(CallKind kind, String path, JsonNode payload) {

    public InboundCall {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(path, "path must not be null");
        if (kind.carriesPayload() && payload == null) {
            throw new IllegalArgumentException(kind + " call requires a payload");
        }
    }

    public static InboundCall write(String path, JsonNode payload) {
        return new InboundCall(CallKind.CONFIG_WRITE, path, payload);
    }

    public static InboundCall read(String path) {
        return new InboundCall(CallKind.DATA_READ, path, null);
    }

    public static InboundCall rpc(String path, JsonNode input) {
        return new InboundCall(CallKind.RPC, path, input);
    }

    public static InboundCall notification(String path, JsonNode content) {
        return new InboundCall(CallKind.NOTIFICATION, path, content);
    }
}
