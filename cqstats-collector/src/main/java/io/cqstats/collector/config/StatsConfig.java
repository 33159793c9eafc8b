package io.cqstats.collector.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

import static io.cqstats.common.ConfigConstants.CONFIG_PATH;
import static io.cqstats.common.ConfigConstants.DEFAULT_FORCED_FLUSH_INTERVAL_MS;
import static io.cqstats.common.ConfigConstants.DEFAULT_NUM_COMBINERS;
import static io.cqstats.common.ConfigConstants.DEFAULT_NUM_WORKERS;
import static io.cqstats.common.ConfigConstants.DEFAULT_TICK_INTERVAL_MS;
import static io.cqstats.common.ConfigConstants.FORCED_FLUSH_INTERVAL_MS_KEY;
import static io.cqstats.common.ConfigConstants.NUM_COMBINERS_KEY;
import static io.cqstats.common.ConfigConstants.NUM_WORKERS_KEY;
import static io.cqstats.common.ConfigConstants.TICK_INTERVAL_MS_KEY;
import static io.cqstats.common.ConfigConstants.TIMER_ENABLED_KEY;

/**
 * Loads collector configuration from HOCON.
 *
 * Sources, later ones override earlier ones:
 * 1. application.conf from the classpath
 * 2. an external file given with -c/--config
 * 3. --conf key=value command line overrides
 * 4. system properties
 */
public class StatsConfig {

    private static final Logger log = LoggerFactory.getLogger(StatsConfig.class);

    private final Config config;

    public StatsConfig() {
        this.config = ConfigFactory.load().resolve();
        log.debug("Configuration loaded from default locations");
    }

    /**
     * @param externalConfigPath path to an external config file, may be null
     * @param overrides          command line overrides, may be empty
     */
    public StatsConfig(String externalConfigPath, Config overrides) {
        Config resultConfig = ConfigFactory.load();

        if (externalConfigPath != null && !externalConfigPath.isEmpty()) {
            File externalFile = new File(externalConfigPath);
            if (externalFile.exists()) {
                log.info("Loading external configuration from: {}", externalConfigPath);
                resultConfig = ConfigFactory.parseFile(externalFile).withFallback(resultConfig);
            } else {
                log.warn("External configuration file not found: {}", externalConfigPath);
            }
        }

        resultConfig = ConfigFactory.systemProperties()
                .withFallback(overrides)
                .withFallback(resultConfig);

        this.config = resultConfig.resolve();
        log.debug("Configuration loaded successfully");
    }

    public StatsConfig(Config config) {
        this.config = config;
    }

    public Config getConfig() {
        return config;
    }

    public long getForcedFlushIntervalMs() {
        return getLong(FORCED_FLUSH_INTERVAL_MS_KEY, DEFAULT_FORCED_FLUSH_INTERVAL_MS);
    }

    public long getTickIntervalMs() {
        return getLong(TICK_INTERVAL_MS_KEY, DEFAULT_TICK_INTERVAL_MS);
    }

    public boolean isTimerEnabled() {
        return getBoolean(TIMER_ENABLED_KEY, true);
    }

    public int getNumWorkers() {
        return getInt(NUM_WORKERS_KEY, DEFAULT_NUM_WORKERS);
    }

    public int getNumCombiners() {
        return getInt(NUM_COMBINERS_KEY, DEFAULT_NUM_COMBINERS);
    }

    /**
     * @throws IllegalArgumentException if a value is out of range
     */
    public StatsProperties toProperties() {
        StatsProperties props = new StatsProperties();
        props.setForcedFlushIntervalMs(getForcedFlushIntervalMs());
        props.setTickIntervalMs(getTickIntervalMs());
        props.setTimerEnabled(isTimerEnabled());
        props.setNumWorkers(getNumWorkers());
        props.setNumCombiners(getNumCombiners());
        return props.validate();
    }

    private long getLong(String path, long defaultValue) {
        String fullPath = CONFIG_PATH + "." + path;
        try {
            if (config.hasPath(fullPath)) {
                return config.getLong(fullPath);
            }
        } catch (ConfigException e) {
            log.warn("Invalid value at {}, using default {}: {}", fullPath, defaultValue, e.getMessage());
        }
        return defaultValue;
    }

    private int getInt(String path, int defaultValue) {
        String fullPath = CONFIG_PATH + "." + path;
        try {
            if (config.hasPath(fullPath)) {
                return config.getInt(fullPath);
            }
        } catch (ConfigException e) {
            log.warn("Invalid value at {}, using default {}: {}", fullPath, defaultValue, e.getMessage());
        }
        return defaultValue;
    }

    private boolean getBoolean(String path, boolean defaultValue) {
        String fullPath = CONFIG_PATH + "." + path;
        try {
            if (config.hasPath(fullPath)) {
                return config.getBoolean(fullPath);
            }
        } catch (ConfigException e) {
            log.warn("Invalid value at {}, using default {}: {}", fullPath, defaultValue, e.getMessage());
        }
        return defaultValue;
    }

    @Override
    public String toString() {
        return "StatsConfig{" +
                "forcedFlushIntervalMs=" + getForcedFlushIntervalMs() +
                ", tickIntervalMs=" + getTickIntervalMs() +
                ", timerEnabled=" + isTimerEnabled() +
                ", numWorkers=" + getNumWorkers() +
                ", numCombiners=" + getNumCombiners() +
                '}';
    }
}
