package org.ashby.plot.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.ashby.plot.api.data.IDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Named data sources available to plot definitions.
 * <p>
 * Every registry starts with the built-in {@code static} and {@code demo} sources. Further sources
 * are added from {@code name=url} pairs. Closing the registry closes every pooled source.
 * <p>
 * <strong>Thread Safety:</strong> registration happens before generation starts; lookups
 * afterwards are read-only and may happen from any worker.
 */
public class DataSourceRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DataSourceRegistry.class);

    public static final String STATIC_SOURCE = "static";
    public static final String DEMO_SOURCE = "demo";

    private final Map<String, IDataSource> sources = new LinkedHashMap<>();
    private final Config jdbcOptions;

    /**
     * Creates a registry with the built-in sources.
     *
     * @param jdbcOptions pool options handed to every SQL-backed source
     */
    public DataSourceRegistry(Config jdbcOptions) {
        this.jdbcOptions = jdbcOptions;
        sources.put(STATIC_SOURCE, new StaticDataSource());
        sources.put(DEMO_SOURCE, new DemoDataSource());
    }

    public DataSourceRegistry() {
        this(ConfigFactory.empty());
    }

    /**
     * Registers a source under a name.
     *
     * @param name   source name referenced by dataset definitions
     * @param source the source
     * @return this registry
     * @throws IllegalArgumentException if the name is already taken
     */
    public DataSourceRegistry register(String name, IDataSource source) {
        if (sources.containsKey(name)) {
            throw new IllegalArgumentException("duplicate source \"" + name + "\" specified");
        }
        sources.put(name, source);
        return this;
    }

    /**
     * Registers a SQL-backed source from a source URL.
     *
     * @param name source name
     * @param url  {@code postgres://...}, {@code postgresql://...} or any {@code jdbc:} URL
     * @return this registry
     * @throws IllegalArgumentException if the name is taken or the URL scheme is unsupported
     */
    public DataSourceRegistry registerUrl(String name, String url) {
        String jdbcUrl = JdbcDataSource.toJdbcUrl(url);
        register(name, new JdbcDataSource(name, jdbcUrl, jdbcOptions));
        log.debug("Registered SQL source '{}'", name);
        return this;
    }

    /**
     * Registers a source from a {@code name=url} option value.
     *
     * @param spec the option value
     * @return this registry
     * @throws IllegalArgumentException if the value is malformed
     */
    public DataSourceRegistry registerSpec(String spec) {
        int eq = spec.indexOf('=');
        if (eq <= 0) {
            throw new IllegalArgumentException("source option not valid, use format 'name=url'");
        }
        return registerUrl(spec.substring(0, eq), spec.substring(eq + 1));
    }

    /**
     * Looks up a source by name.
     *
     * @param name source name
     * @return the source, or null if none is registered under that name
     */
    public IDataSource get(String name) {
        return sources.get(name);
    }

    /**
     * Returns the built-in fixture source, for registering in-memory datasets.
     *
     * @return the static source
     */
    public StaticDataSource getStaticSource() {
        return (StaticDataSource) sources.get(STATIC_SOURCE);
    }

    public Set<String> getNames() {
        return Collections.unmodifiableSet(sources.keySet());
    }

    @Override
    public void close() {
        for (IDataSource source : sources.values()) {
            if (source instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    log.warn("Failed to close data source: {}", e.getMessage());
                }
            }
        }
    }
}
