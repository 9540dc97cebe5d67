package io.schemagate.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * What a {@link CallbackHandler} returns: a success payload (may be {@code null}) or an
 * application error with a code and message.
 */
public final class CallbackResult {

    private final boolean success;
    private final JsonNode payload;
    private final String errorCode;
    private final String errorMessage;

    private CallbackResult(boolean success, JsonNode payload, String errorCode, String errorMessage) {
        this.success = success;
        this.payload = payload;
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }

    public static CallbackResult success(JsonNode payload) {
        return new CallbackResult(true, payload, null, null);
    }

    public static CallbackResult success() {
        return new CallbackResult(true, null, null, null);
    }

    public static CallbackResult error(String code, String message) {
        Objects.requireNonNull(code, "code must not be null");
        return new CallbackResult(false, null, code, message);
    }

    public boolean isSuccess() {
        return success;
    }

    public JsonNode payload() {
        return payload;
    }

    public String errorCode() {
        return errorCode;
    }

    public String errorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return success ? "CallbackResult[success]" : "CallbackResult[error=" + errorCode + "]";
    }
}
