package org.yangtree.cli.config;

import java.net.URL;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;

/**
 * Applies logging settings from the application configuration to Logback.
 * <p>
 * {@code logging.default-level} sets the root level; {@code logging.levels} maps logger names
 * to levels, e.g. {@code logging.levels { "org.yangtree.compiler.resolve" = DEBUG }}.
 */
public final class LoggingConfigurator {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {
    }

    public static void configure(final Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            log.debug("Logging backend is not Logback, skipping level configuration");
            return;
        }
        if (config.hasPath("logging.default-level")) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                    .setLevel(Level.toLevel(config.getString("logging.default-level"), Level.INFO));
        }
        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
                String loggerName = entry.getKey();
                Level level = Level.toLevel(String.valueOf(entry.getValue().unwrapped()), null);
                if (level == null) {
                    log.warn("Ignoring invalid log level '{}' for logger '{}'", entry.getValue().unwrapped(), loggerName);
                    continue;
                }
                context.getLogger(loggerName).setLevel(level);
            }
        }
    }

    /**
     * Re-reads {@code logback.xml} so that system properties set after startup take effect.
     */
    public static void reload() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
