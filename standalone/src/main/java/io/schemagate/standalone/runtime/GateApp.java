package io.schemagate.standalone.runtime;

import io.schemagate.core.access.PolicyStore;
import io.schemagate.core.dispatch.Dispatcher;
import io.schemagate.core.dispatch.HandlerRegistry;
import io.schemagate.core.error.SchemaLoadException;
import io.schemagate.core.model.AccessPolicy;
import io.schemagate.core.document.CompiledSchema;
import io.schemagate.core.document.PolicyParser;
import io.schemagate.core.document.SchemaDocumentParser;
import io.schemagate.core.spi.AuditListener;
import io.schemagate.standalone.config.ConfigLoader;
import io.schemagate.standalone.config.GateConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup sequence of the standalone host.
 *
 * <ol>
 * <li>Load configuration from YAML plus environment overlay</li>
 * <li>Configure logging</li>
 * <li>Load the compiled schema (any error is fatal)</li>
 * <li>Load the access policy (any error is fatal at startup)</li>
 * <li>Build the dispatcher</li>
 * <li>Start the policy file watcher, if enabled</li>
 * </ol>
 *
 * <p>After startup a bad policy file never replaces a good one: a failed reload is logged and the
 * previous policy stays in force. Host integrations register their callbacks on
 * {@link #handlers()} and hand sessions to {@link #dispatcher()}.
 */
public final class GateApp implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(GateApp.class);

    private final GateConfig config;
    private final CompiledSchema schema;
    private final PolicyStore policies;
    private final PolicyParser policyParser;
    private final Path policyPath;
    private final HandlerRegistry handlers;
    private final Dispatcher dispatcher;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private FileWatcher policyWatcher;

    private GateApp(
            GateConfig config,
            CompiledSchema schema,
            PolicyStore policies,
            PolicyParser policyParser,
            Path policyPath,
            HandlerRegistry handlers,
            Dispatcher dispatcher) {
        this.config = config;
        this.schema = schema;
        this.policies = policies;
        this.policyParser = policyParser;
        this.policyPath = policyPath;
        this.handlers = handlers;
        this.dispatcher = dispatcher;
    }

    /**
     * Runs the full startup sequence. Relative paths in the configuration are resolved against
     * the configuration file's directory.
     *
     * @param args command-line arguments, e.g. {@code --config path/to/schema-gate.yaml}
     * @throws SchemaLoadException if the schema or policy cannot be loaded
     * @throws IOException         if the policy watcher cannot be started
     */
    public static GateApp start(String[] args) throws IOException {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        GateConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);
        Path baseDir = configPath.toAbsolutePath().getParent();
        return start(config, baseDir, null);
    }

    /**
     * Starts from an already loaded configuration. Logging is left as configured.
     *
     * @param baseDir  directory relative paths are resolved against
     * @param listener optional audit listener
     */
    public static GateApp start(GateConfig config, Path baseDir, AuditListener listener) throws IOException {
        long startTime = System.nanoTime();

        Path schemaPath = baseDir.resolve(config.schemaPath());
        CompiledSchema schema = new SchemaDocumentParser().parse(schemaPath);

        PolicyStore policies = new PolicyStore(listener);
        PolicyParser policyParser = new PolicyParser(schema.tree());
        Path policyPath = config.policyPath() != null ? baseDir.resolve(config.policyPath()) : null;
        if (policyPath != null) {
            policies.reload(policyParser.parse(policyPath), policyPath.toString());
        } else {
            LOG.warn("No policy.path configured: every call will be denied");
        }

        HandlerRegistry handlers = new HandlerRegistry();
        Dispatcher dispatcher = Dispatcher.builder()
                .tree(schema.tree())
                .policies(policies)
                .handlers(handlers)
                .config(config.dispatcherConfig())
                .listener(listener)
                .build();

        GateApp app = new GateApp(config, schema, policies, policyParser, policyPath, handlers, dispatcher);
        if (policyPath != null && config.policyReloadEnabled()) {
            app.policyWatcher = new FileWatcher(policyPath, config.policyReloadDebounceMs(), app::reloadPolicy);
            try {
                app.policyWatcher.start();
            } catch (IOException e) {
                dispatcher.close();
                throw e;
            }
        }

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "schema-gate started: modules={}, nodes={}, identities={}, policy_version={}, reload={}, startupMs={}",
                schema.tree().modules().size(),
                schema.tree().size(),
                schema.identities().size(),
                policies.snapshot().version(),
                app.policyWatcher != null,
                elapsedMs);
        return app;
    }

    /**
     * Re-reads the policy file and installs it. A file that fails to parse leaves the current
     * policy in force.
     *
     * @return {@code true} if a new policy was installed
     */
    public boolean reloadPolicy() {
        if (policyPath == null) {
            return false;
        }
        try {
            AccessPolicy parsed = policyParser.parse(policyPath);
            policies.reload(parsed, policyPath.toString());
            return true;
        } catch (SchemaLoadException e) {
            LOG.error(
                    "policy.reload_failed source={} kept_version={} detail={}",
                    policyPath,
                    policies.snapshot().version(),
                    e.getMessage());
            return false;
        }
    }

    public GateConfig config() {
        return config;
    }

    public CompiledSchema schema() {
        return schema;
    }

    public PolicyStore policies() {
        return policies;
    }

    public HandlerRegistry handlers() {
        return handlers;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    /** True if the policy file is being watched. */
    public boolean isWatchingPolicy() {
        return policyWatcher != null && policyWatcher.isRunning();
    }

    /** Blocks until {@link #stop()} has run. */
    public void awaitStop() throws InterruptedException {
        stopped.await();
    }

    /** Stops the policy watcher and the dispatcher's worker pool. Idempotent. */
    public void stop() {
        if (stopped.getCount() == 0) {
            return;
        }
        if (policyWatcher != null) {
            policyWatcher.stop();
        }
        dispatcher.close();
        stopped.countDown();
        LOG.info("schema-gate stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
