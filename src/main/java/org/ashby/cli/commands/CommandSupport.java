package org.ashby.cli.commands;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.ashby.plot.data.DataSourceRegistry;
import org.ashby.plot.generate.ColorTable;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;

/**
 * Builds the collaborators both commands share from the application configuration.
 */
final class CommandSupport {

    private CommandSupport() {
    }

    /**
     * Creates a registry with the built-in sources, the sources under {@code sources} and the
     * {@code name=url} values given on the command line, in that order.
     *
     * @throws IllegalArgumentException if a name is registered twice or a value is malformed
     */
    static DataSourceRegistry dataSources(Config config, List<String> cliSources) {
        Config jdbc = config.hasPath("jdbc") ? config.getConfig("jdbc") : ConfigFactory.empty();
        DataSourceRegistry registry = new DataSourceRegistry(jdbc);
        try {
            if (config.hasPath("sources")) {
                for (Map.Entry<String, ConfigValue> entry : config.getObject("sources").entrySet()) {
                    registry.registerUrl(entry.getKey(), String.valueOf(entry.getValue().unwrapped()));
                }
            }
            if (cliSources != null) {
                for (String spec : cliSources) {
                    registry.registerSpec(spec);
                }
            }
        } catch (IllegalArgumentException e) {
            registry.close();
            throw e;
        }
        return registry;
    }

    static ColorTable colors(Config config) {
        return config.hasPath("colors") ? ColorTable.fromConfig(config.getConfig("colors")) : ColorTable.empty();
    }

    /**
     * Parses repeated {@code key=value} options.
     *
     * @throws IllegalArgumentException if a value has no key or a key repeats
     */
    static Map<String, Object> params(List<String> values) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (values == null) {
            return params;
        }
        for (String value : values) {
            int eq = value.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("param option not valid, use format 'key=value': " + value);
            }
            String key = value.substring(0, eq);
            if (params.containsKey(key)) {
                throw new IllegalArgumentException("duplicate param \"" + key + "\" specified");
            }
            params.put(key, value.substring(eq + 1));
        }
        return params;
    }
}
