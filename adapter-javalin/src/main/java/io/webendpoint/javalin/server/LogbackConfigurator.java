package io.webendpoint.javalin.server;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.webendpoint.javalin.config.StandaloneConfig;
import java.util.Map;
import org.slf4j.LoggerFactory;

/**
 * Programmatic Logback setup for the standalone process.
 *
 * <p>
 * Replaces the root logger's appenders with a single console appender: {@code json} uses
 * Logback's {@link JsonEncoder}, anything else the human-readable {@link #TEXT_PATTERN}. The
 * server libraries are capped at WARN so the listener start and stop lines come from the
 * endpoint loggers only.
 */
public final class LogbackConfigurator {

    static final String APPENDER_NAME = "CONSOLE";
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    private static final Map<String, Level> SERVER_LOGGERS =
            Map.of("org.eclipse.jetty", Level.WARN, "io.javalin", Level.WARN);

    private LogbackConfigurator() {
        // utility class
    }

    /** Applies {@code logging.format} and {@code logging.level} of the loaded configuration. */
    public static void configure(StandaloneConfig config) {
        configure(config.loggingFormat(), config.loggingLevel());
    }

    /**
     * @param format "json" or "text"
     * @param level  root level; unknown values fall back to INFO
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.toLevel(level, Level.INFO));
        root.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setContext(context);
        console.setName(APPENDER_NAME);
        console.setEncoder(encoder(context, format));
        console.start();
        root.addAppender(console);

        SERVER_LOGGERS.forEach((name, cap) -> context.getLogger(name).setLevel(cap));
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }
}
