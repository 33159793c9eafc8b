package io.cqstats.common.util;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.List;

public class ConfigUtils {

    public record ConfigWithMainParameters(Config config, String configFile, List<String> mainParameters){}

    /**
     * Parses {@code --conf key=value} overrides and an optional {@code -c/--config} file path.
     * The returned config only holds the command line overrides; callers layer it over their defaults.
     */
    public static ConfigWithMainParameters loadCommandLineConfig(String[] args) {
        var argv = new Args();
        JCommander.newBuilder()
                .addObject(argv)
                .build()
                .parse(args);
        var buffer = new StringBuilder();
        if(argv.configs !=null) {
            argv.configs.forEach(c -> {
                buffer.append(c);
                buffer.append("\n");
            });
        }

        return new ConfigWithMainParameters(ConfigFactory.parseString(buffer.toString()), argv.configFile, argv.mainParameters);
    }

    public static class Args {
        @Parameter(names = {"--conf"}, description = "Configurations" )
        private List<String> configs;

        @Parameter(names = {"-c", "--config"}, description = "External HOCON configuration file")
        private String configFile;

        @Parameter
        private List<String>  mainParameters;
    }
}
