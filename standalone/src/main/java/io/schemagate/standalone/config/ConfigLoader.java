package io.schemagate.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.schemagate.core.dispatch.LockGranularity;
import io.schemagate.core.dispatch.UnconstrainedValueMode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Loads {@link GateConfig} from a YAML file with an environment variable overlay.
 *
 * <p>Without arguments the loader reads {@code schema-gate.yaml} from the working directory;
 * {@code --config <path>} selects another file.
 *
 * <pre>
 * schema:
 *   path: schema.yaml
 * policy:
 *   path: policy.yaml
 *   reload:
 *     enabled: true
 *     debounce-ms: 500
 * dispatch:
 *   callback-timeout-ms: 5000
 *   lock-timeout-ms: 1000
 *   worker-threads: 8
 *   lock-granularity: module     # module | subtree
 *   unconstrained: audit         # audit | reject
 * logging:
 *   format: json                 # json | text
 *   level: INFO
 * </pre>
 *
 * <p>Every key can be overridden by a {@code SCHEMAGATE_*} environment variable, which takes
 * precedence over the file. A variable is "set" only if it is defined and non-blank after
 * trimming; blank values leave the file value in place.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "schema-gate.yaml";
    static final String ENV_PREFIX = "SCHEMAGATE_";

    private ConfigLoader() {
        // utility class
    }

    /** Loads the file, overlaying {@link System#getenv}. */
    public static GateConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the file, overlaying variables from {@code envLookup} (returns {@code null} for
     * undefined variables).
     *
     * @throws ConfigLoadException if the file is missing, unparsable or a value is invalid
     */
    public static GateConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the config file path from command-line arguments.
     *
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static GateConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        GateConfig.Builder builder = GateConfig.builder();

        JsonNode schema = root.path("schema");
        if (schema.has("path")) builder.schemaPath(schema.get("path").asText());

        JsonNode policy = root.path("policy");
        if (policy.has("path")) builder.policyPath(policy.get("path").asText());
        JsonNode reload = policy.path("reload");
        if (reload.has("enabled")) builder.policyReloadEnabled(reload.get("enabled").asBoolean());
        if (reload.has("debounce-ms")) builder.policyReloadDebounceMs(reload.get("debounce-ms").asInt());

        JsonNode dispatch = root.path("dispatch");
        if (dispatch.has("callback-timeout-ms"))
            builder.callbackTimeoutMs(dispatch.get("callback-timeout-ms").asLong());
        if (dispatch.has("lock-timeout-ms")) builder.lockTimeoutMs(dispatch.get("lock-timeout-ms").asLong());
        if (dispatch.has("worker-threads")) builder.workerThreads(dispatch.get("worker-threads").asInt());
        if (dispatch.has("lock-granularity"))
            builder.lockGranularity(granularity(dispatch.get("lock-granularity").asText()));
        if (dispatch.has("unconstrained")) builder.unconstrained(unconstrained(dispatch.get("unconstrained").asText()));

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(GateConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "SCHEMA_PATH", builder::schemaPath);
        envString(envLookup, "POLICY_PATH", builder::policyPath);
        envBool(envLookup, "POLICY_RELOAD_ENABLED", builder::policyReloadEnabled);
        envInt(envLookup, "POLICY_RELOAD_DEBOUNCE_MS", builder::policyReloadDebounceMs);
        envLong(envLookup, "CALLBACK_TIMEOUT_MS", builder::callbackTimeoutMs);
        envLong(envLookup, "LOCK_TIMEOUT_MS", builder::lockTimeoutMs);
        envInt(envLookup, "WORKER_THREADS", builder::workerThreads);
        envString(envLookup, "LOCK_GRANULARITY", value -> builder.lockGranularity(granularity(value)));
        envString(envLookup, "UNCONSTRAINED", value -> builder.unconstrained(unconstrained(value)));
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
    }

    private static LockGranularity granularity(String value) {
        try {
            return LockGranularity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(
                    "Invalid dispatch.lock-granularity '" + value + "': expected module or subtree", e);
        }
    }

    private static UnconstrainedValueMode unconstrained(String value) {
        try {
            return UnconstrainedValueMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid dispatch.unconstrained '" + value + "': expected audit or reject", e);
        }
    }

    // --- Env var helpers ---

    /** Returns the trimmed value if the variable is defined and non-blank, otherwise {@code null}. */
    private static String lookup(Function<String, String> envLookup, String key) {
        String value = envLookup.apply(ENV_PREFIX + key);
        return value != null && !value.trim().isEmpty() ? value.trim() : null;
    }

    private static void envString(Function<String, String> envLookup, String key, Consumer<String> setter) {
        String value = lookup(envLookup, key);
        if (value != null) {
            setter.accept(value);
        }
    }

    private static void envInt(Function<String, String> envLookup, String key, IntConsumer setter) {
        String value = lookup(envLookup, key);
        if (value != null) {
            setter.accept(parseNumber(key, value).intValue());
        }
    }

    private static void envLong(Function<String, String> envLookup, String key, LongConsumer setter) {
        String value = lookup(envLookup, key);
        if (value != null) {
            setter.accept(parseNumber(key, value));
        }
    }

    private static void envBool(Function<String, String> envLookup, String key, Consumer<Boolean> setter) {
        String value = lookup(envLookup, key);
        if (value != null) {
            setter.accept(Boolean.parseBoolean(value));
        }
    }

    private static Long parseNumber(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(ENV_PREFIX + key + " must be a number, got '" + value + "'", e);
        }
    }
}
