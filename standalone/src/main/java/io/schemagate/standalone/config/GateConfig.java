package io.schemagate.standalone.config;

import io.schemagate.core.dispatch.DispatcherConfig;
import io.schemagate.core.dispatch.LockGranularity;
import io.schemagate.core.dispatch.UnconstrainedValueMode;

/**
 * Root configuration of the standalone host.
 *
 * <p>All fields have defaults except {@code schemaPath}, which is required. Use
 * {@link #builder()} to construct instances.
 *
 * @param schemaPath             compiled-schema document to load at startup
 * @param policyPath             access policy document; {@code null} runs with the deny-all policy
 * @param policyReloadEnabled    watch the policy file and reload it on change
 * @param policyReloadDebounceMs debounce period for policy file change events
 * @param callbackTimeoutMs      maximum callback run time
 * @param lockTimeoutMs          maximum wait for a datastore lock
 * @param workerThreads          callback worker pool size
 * @param lockGranularity        datastore lock scope
 * @param unconstrained          handling of values accepted without constraint
 * @param loggingFormat          json or text
 * @param loggingLevel           root log level
 */
public record GateConfig(
        String schemaPath,
        String policyPath,
        boolean policyReloadEnabled,
        int policyReloadDebounceMs,
        long callbackTimeoutMs,
        long lockTimeoutMs,
        int workerThreads,
        LockGranularity lockGranularity,
        UnconstrainedValueMode unconstrained,
        String loggingFormat,
        String loggingLevel) {

    public static Builder builder() {
        return new Builder();
    }

    /** The dispatcher settings carried by this configuration. */
    public DispatcherConfig dispatcherConfig() {
        return new DispatcherConfig(callbackTimeoutMs, lockTimeoutMs, workerThreads, lockGranularity, unconstrained);
    }

    /** Builder for {@link GateConfig}. All fields have defaults except {@code schemaPath}. */
    public static final class Builder {
        private String schemaPath;
        private String policyPath;
        private boolean policyReloadEnabled = true;
        private int policyReloadDebounceMs = 500;
        private long callbackTimeoutMs = DispatcherConfig.DEFAULT.callbackTimeoutMs();
        private long lockTimeoutMs = DispatcherConfig.DEFAULT.lockTimeoutMs();
        private int workerThreads = DispatcherConfig.DEFAULT.workerThreads();
        private LockGranularity lockGranularity = LockGranularity.MODULE;
        private UnconstrainedValueMode unconstrained = UnconstrainedValueMode.AUDIT;
        private String loggingFormat = "json";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder schemaPath(String schemaPath) {
            this.schemaPath = schemaPath;
            return this;
        }

        public Builder policyPath(String policyPath) {
            this.policyPath = policyPath;
            return this;
        }

        public Builder policyReloadEnabled(boolean policyReloadEnabled) {
            this.policyReloadEnabled = policyReloadEnabled;
            return this;
        }

        public Builder policyReloadDebounceMs(int policyReloadDebounceMs) {
            this.policyReloadDebounceMs = policyReloadDebounceMs;
            return this;
        }

        public Builder callbackTimeoutMs(long callbackTimeoutMs) {
            this.callbackTimeoutMs = callbackTimeoutMs;
            return this;
        }

        public Builder lockTimeoutMs(long lockTimeoutMs) {
            this.lockTimeoutMs = lockTimeoutMs;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder lockGranularity(LockGranularity lockGranularity) {
            this.lockGranularity = lockGranularity;
            return this;
        }

        public Builder unconstrained(UnconstrainedValueMode unconstrained) {
            this.unconstrained = unconstrained;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws ConfigLoadException if {@code schemaPath} is missing
         */
        public GateConfig build() {
            if (schemaPath == null || schemaPath.isBlank()) {
                throw new ConfigLoadException("schema.path is required");
            }
            return new GateConfig(
                    schemaPath,
                    policyPath,
                    policyReloadEnabled,
                    policyReloadDebounceMs,
                    callbackTimeoutMs,
                    lockTimeoutMs,
                    workerThreads,
                    lockGranularity,
                    unconstrained,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
