package io.cqstats.common.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigUtil;
import org.slf4j.LoggerFactory;

import static io.cqstats.common.ConfigConstants.LOGGING_LEVEL_KEY;
import static io.cqstats.common.ConfigConstants.LOGGING_LOGGERS_KEY;
import static io.cqstats.common.ConfigConstants.LOGGING_PATTERN_KEY;
import static io.cqstats.common.ConfigConstants.LOGGING_PREFIX;

/**
 * Sets up Logback from the {@code logging} block of application.conf.
 *
 * <pre>
 * logging {
 *     level = "INFO"
 *     pattern = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n"
 *     loggers {
 *         "io.cqstats.collector" = "DEBUG"
 *     }
 * }
 * </pre>
 * Missing keys fall back to {@link #DEFAULTS}; the {@code loggers} objects are merged key by key.
 */
public final class LogbackConfigurator {

    static final Config DEFAULTS = ConfigFactory.parseString("""
            logging {
                level = "INFO"
                pattern = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n"
                loggers {
                    "org.apache.arrow" = "WARN"
                    "io.netty" = "WARN"
                }
            }
            """);

    private LogbackConfigurator() {
    }

    public static void configure() {
        apply(ConfigFactory.load());
    }

    static void apply(Config config) {
        Config logging = config.withOnlyPath(LOGGING_PREFIX).withFallback(DEFAULTS);
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(logging.getString(LOGGING_PATTERN_KEY));
        encoder.start();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setContext(context);
        console.setName("CONSOLE");
        console.setEncoder(encoder);
        console.start();

        var root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.toLevel(logging.getString(LOGGING_LEVEL_KEY)));
        root.addAppender(console);

        Config loggers = logging.getConfig(LOGGING_LOGGERS_KEY);
        // logger names contain dots, read each back as one quoted key
        loggers.root().keySet().forEach(name ->
                context.getLogger(name).setLevel(Level.toLevel(loggers.getString(ConfigUtil.joinPath(name)))));
    }
}
