package io.cqstats.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfigUtilsTest {

    @Test
    @DisplayName("Should turn --conf arguments into config overrides")
    void parsesConfOverrides() {
        var result = ConfigUtils.loadCommandLineConfig(new String[]{
                "--conf", "cqstats.num-workers=4",
                "--conf", "cqstats.forced-flush-interval-ms=250"
        });

        assertEquals(4, result.config().getInt("cqstats.num-workers"));
        assertEquals(250, result.config().getLong("cqstats.forced-flush-interval-ms"));
        assertNull(result.configFile());
    }

    @Test
    @DisplayName("Should capture external config file and main parameters")
    void parsesConfigFileAndMainParameters() {
        var result = ConfigUtils.loadCommandLineConfig(new String[]{"-c", "/etc/cqstats.conf", "demo"});

        assertEquals("/etc/cqstats.conf", result.configFile());
        assertEquals(java.util.List.of("demo"), result.mainParameters());
        assertTrue(result.config().isEmpty());
    }

    @Test
    @DisplayName("Should return empty config without arguments")
    void emptyArguments() {
        var result = ConfigUtils.loadCommandLineConfig(new String[0]);

        assertTrue(result.config().isEmpty());
        assertNull(result.mainParameters());
    }
}
