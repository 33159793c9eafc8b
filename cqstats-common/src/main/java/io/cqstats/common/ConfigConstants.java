package io.cqstats.common;

public class ConfigConstants {

    public static final String CONFIG_PATH = "cqstats";

    // Flush scheduling keys
    public static final String FORCED_FLUSH_INTERVAL_MS_KEY = "forced-flush-interval-ms";
    public static final String TICK_INTERVAL_MS_KEY = "tick-interval-ms";
    public static final String TIMER_ENABLED_KEY = "timer-enabled";

    // Process registry sizing keys
    public static final String NUM_WORKERS_KEY = "num-workers";
    public static final String NUM_COMBINERS_KEY = "num-combiners";

    // Logging keys
    public static final String LOGGING_PREFIX = "logging";
    public static final String LOGGING_LEVEL_KEY = "logging.level";
    public static final String LOGGING_PATTERN_KEY = "logging.pattern";
    public static final String LOGGING_LOGGERS_KEY = "logging.loggers";

    public static final long DEFAULT_FORCED_FLUSH_INTERVAL_MS = 1000;
    public static final long DEFAULT_TICK_INTERVAL_MS = 100;
    public static final int DEFAULT_NUM_WORKERS = 1;
    public static final int DEFAULT_NUM_COMBINERS = 1;
}
