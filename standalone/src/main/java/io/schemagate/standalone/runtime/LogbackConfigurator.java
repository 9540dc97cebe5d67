package io.schemagate.standalone.runtime;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import org.slf4j.LoggerFactory;

/**
 * Reconfigures the Logback root logger at startup from {@code logging.format} and
 * {@code logging.level}. JSON mode uses Logback's {@link JsonEncoder}, which includes the MDC
 * ({@code sessionId}, {@code callId}); text mode uses a pattern that prints both MDC keys.
 */
public final class LogbackConfigurator {

    static final String TEXT_PATTERN =
            "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} [%X{sessionId:-}/%X{callId:-}] - %msg%n";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * @param format {@code json} or {@code text}
     * @param level  root level name; unknown names fall back to INFO
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.toLevel(level, Level.INFO));
        root.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName("STDOUT");

        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder encoder = new JsonEncoder();
            encoder.setContext(context);
            encoder.start();
            appender.setEncoder(encoder);
        } else {
            PatternLayoutEncoder encoder = new PatternLayoutEncoder();
            encoder.setContext(context);
            encoder.setPattern(TEXT_PATTERN);
            encoder.start();
            appender.setEncoder(encoder);
        }
        appender.start();
        root.addAppender(appender);

        context.getLogger("com.networknt").setLevel(Level.WARN);
    }
}
