package io.schemagate.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.schemagate.core.dispatch.LockGranularity;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EnvVarOverlayTest {

    @TempDir
    Path tempDir;

    private Path configFile;

    @BeforeEach
    void setUp() throws Exception {
        configFile = tempDir.resolve("schema-gate.yaml");
        Files.writeString(configFile, """
                schema:
                  path: schema.yaml
                policy:
                  path: policy.yaml
                dispatch:
                  callback-timeout-ms: 5000
                """);
    }

    @Test
    void environmentOverridesFile() {
        Map<String, String> env = Map.of(
                "SCHEMAGATE_POLICY_PATH", "/run/policy.yaml",
                "SCHEMAGATE_CALLBACK_TIMEOUT_MS", "750",
                "SCHEMAGATE_POLICY_RELOAD_ENABLED", "false",
                "SCHEMAGATE_LOCK_GRANULARITY", "subtree");

        GateConfig config = ConfigLoader.load(configFile, env::get);

        assertThat(config.schemaPath()).isEqualTo("schema.yaml");
        assertThat(config.policyPath()).isEqualTo("/run/policy.yaml");
        assertThat(config.callbackTimeoutMs()).isEqualTo(750);
        assertThat(config.policyReloadEnabled()).isFalse();
        assertThat(config.lockGranularity()).isEqualTo(LockGranularity.SUBTREE);
    }

    @Test
    void blankVariableKeepsFileValue() {
        Map<String, String> env = Map.of("SCHEMAGATE_POLICY_PATH", "   ", "SCHEMAGATE_LOG_LEVEL", " debug ");

        GateConfig config = ConfigLoader.load(configFile, env::get);

        assertThat(config.policyPath()).isEqualTo("policy.yaml");
        assertThat(config.loggingLevel()).isEqualTo("debug");
    }

    @Test
    void nonNumericVariableIsReported() {
        Map<String, String> env = Map.of("SCHEMAGATE_WORKER_THREADS", "many");

        assertThatThrownBy(() -> ConfigLoader.load(configFile, env::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("SCHEMAGATE_WORKER_THREADS must be a number");
    }
}
