package io.schemagate.core.spi;

/**
 * Application code behind a schema path. Registered with the dispatcher's handler registry and
 * invoked only after the call has been validated and authorized.
 *
 * <p>Handlers run on the dispatcher's worker pool and may be interrupted when their call times
 * out or is cancelled; they should respond to interruption promptly. Returning
 * {@link CallbackResult#error(String, String)} and throwing are both reported to the caller as a
 * callback error.
 */
@FunctionalInterface
public interface CallbackHandler {

    CallbackResult handle(CallbackRequest request) throws Exception;
}
