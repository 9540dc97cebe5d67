package io.schemagate.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemagate.core.model.CallKind;
import io.schemagate.core.model.Principal;
import java.util.Map;

/**
 * Input handed to a {@link CallbackHandler}.
 *
 * @param callId     dispatcher-assigned call identifier
 * @param path       canonical instance path of the target
 * @param schemaPath canonical schema path of the target (no predicates)
 * @param keys       key values of the addressed list entry, empty otherwise
 * @param value      normalized, validated value; {@code null} for data reads
 * @param caller     the session's principal
 * @param kind       what the caller asked for
 */
public record CallbackRequest(
        String callId,
        String path,
        String schemaPath,
        Map<String, String> keys,
        JsonNode value,
        Principal caller,
        CallKind kind) {}
