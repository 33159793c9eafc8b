package io.cqstats.collector.demo;

import io.cqstats.collector.StatsCollector;
import io.cqstats.collector.config.StatsConfig;
import io.cqstats.common.config.LogbackConfigurator;
import io.cqstats.common.util.ConfigUtils;

import java.util.List;

/**
 * Runs the synthetic workload against a collector and logs the resulting views.
 *
 * Usage:
 * <pre>
 * java -cp cqstats-collector.jar io.cqstats.collector.demo.Main
 * java -cp cqstats-collector.jar io.cqstats.collector.demo.Main -c /path/to/config.conf --conf cqstats.num-workers=2
 * </pre>
 */
public class Main {

    public static void main(String[] args) throws InterruptedException {
        // Configure logging from .conf before anything else
        LogbackConfigurator.configure();

        var commandLine = ConfigUtils.loadCommandLineConfig(args);
        var properties = new StatsConfig(commandLine.configFile(), commandLine.config()).toProperties();

        try (var collector = new StatsCollector(properties)) {
            collector.start();
            var demo = new Demo(collector,
                    List.of(new Demo.GroupingQuery("test_10_groups", 10),
                            new Demo.GroupingQuery("test_1_group", 1)),
                    System.currentTimeMillis());
            demo.insert("stream", 1000);
            demo.insert("stream", 1000);
            Thread.sleep(properties.getForcedFlushIntervalMs());
            demo.insert("stream", 1000);
            demo.insert("stream", 1000);
            Thread.sleep(properties.getForcedFlushIntervalMs() + properties.getTickIntervalMs());
            demo.report();
        }
    }
}
