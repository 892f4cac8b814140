package org.ashby.plot.data;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.ashby.plot.api.DataAccessException;
import org.ashby.plot.api.data.FieldValue;
import org.ashby.plot.api.data.IDataSet;
import org.ashby.plot.api.data.IDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * SQL-backed source using HikariCP for connection pooling.
 * <p>
 * The pool is created on first use, exactly once per instance. If creation fails, the failure
 * is cached and replayed on every later call: there is no retry. Results are materialized into
 * a {@link StaticDataSet}, so resetting the returned dataset never re-runs the query.
 * <p>
 * Configuration (all optional):
 * <pre>
 * max-pool-size = 4
 * min-idle = 0
 * connection-timeout = 30s
 * </pre>
 */
public class JdbcDataSource implements IDataSource, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JdbcDataSource.class);

    private static final Pattern INTERVAL_PART = Pattern.compile(
        "(-?\\d+)\\s+(year|years|mon|mons|day|days)|(-?)(\\d+):(\\d{2}):(\\d{2})(?:\\.(\\d+))?");

    private final String name;
    private final String jdbcUrl;
    private final Config options;

    private final Object initLock = new Object();
    private volatile boolean initialized;
    private HikariDataSource pool;
    private Exception initFailure;

    public JdbcDataSource(String name, String jdbcUrl, Config options) {
        this.name = name;
        this.jdbcUrl = jdbcUrl;
        this.options = options;
    }

    /**
     * Converts a source URL into a JDBC URL.
     * <p>
     * {@code postgres://user:pw@host:5432/db} becomes {@code jdbc:postgresql://host:5432/db?user=user&password=pw}.
     * URLs that already start with {@code jdbc:} are returned unchanged.
     *
     * @param url the source URL
     * @return the JDBC URL
     * @throws IllegalArgumentException if the URL scheme is not supported
     */
    public static String toJdbcUrl(String url) {
        if (url.startsWith("jdbc:")) {
            return url;
        }
        String rest;
        if (url.startsWith("postgres://")) {
            rest = url.substring("postgres://".length());
        } else if (url.startsWith("postgresql://")) {
            rest = url.substring("postgresql://".length());
        } else {
            throw new IllegalArgumentException("unsupported source url: " + url);
        }

        int at = rest.lastIndexOf('@');
        if (at < 0) {
            return "jdbc:postgresql://" + rest;
        }
        String credentials = rest.substring(0, at);
        String hostAndDb = rest.substring(at + 1);
        String user = credentials;
        String password = null;
        int colon = credentials.indexOf(':');
        if (colon >= 0) {
            user = credentials.substring(0, colon);
            password = credentials.substring(colon + 1);
        }
        StringBuilder sb = new StringBuilder("jdbc:postgresql://").append(hostAndDb);
        sb.append(hostAndDb.contains("?") ? '&' : '?').append("user=").append(user);
        if (password != null) {
            sb.append("&password=").append(password);
        }
        return sb.toString();
    }

    @Override
    public IDataSet getDataSet(String query, Object... params) throws DataAccessException {
        HikariDataSource dataSource = pool();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(query)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                return materialize(rs);
            }
        } catch (SQLException e) {
            throw new DataAccessException("source '" + name + "': execute query: " + e.getMessage(), e);
        }
    }

    private HikariDataSource pool() throws DataAccessException {
        if (!initialized) {
            synchronized (initLock) {
                if (!initialized) {
                    try {
                        pool = createPool();
                        log.debug("Connection pool for source '{}' started", name);
                    } catch (RuntimeException e) {
                        initFailure = e;
                        log.error("Failed to connect source '{}': {}", name, rootMessage(e));
                    }
                    initialized = true;
                }
            }
        }
        if (initFailure != null) {
            throw new DataAccessException(
                "source '" + name + "': unable to connect to database: " + rootMessage(initFailure), initFailure);
        }
        return pool;
    }

    private HikariDataSource createPool() {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setPoolName(name);
        hikariConfig.setMaximumPoolSize(options.hasPath("max-pool-size") ? options.getInt("max-pool-size") : 4);
        hikariConfig.setMinimumIdle(options.hasPath("min-idle") ? options.getInt("min-idle") : 0);
        if (options.hasPath("connection-timeout")) {
            hikariConfig.setConnectionTimeout(options.getDuration("connection-timeout").toMillis());
        }
        hikariConfig.setReadOnly(true);
        return new HikariDataSource(hikariConfig);
    }

    static StaticDataSet materialize(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        String[] names = new String[columnCount];
        for (int i = 0; i < columnCount; i++) {
            names[i] = meta.getColumnLabel(i + 1).toLowerCase(java.util.Locale.ROOT);
        }

        StaticDataSet.Builder builder = StaticDataSet.builder().fields(names);
        while (rs.next()) {
            FieldValue[] row = new FieldValue[columnCount];
            for (int i = 0; i < columnCount; i++) {
                row[i] = readValue(rs, meta, i + 1);
            }
            builder.row(row);
        }
        return builder.build();
    }

    private static FieldValue readValue(ResultSet rs, ResultSetMetaData meta, int column) throws SQLException {
        int type = meta.getColumnType(column);
        switch (type) {
            case Types.BIT, Types.BOOLEAN -> {
                boolean v = rs.getBoolean(column);
                return rs.wasNull() ? FieldValue.absent() : FieldValue.of(v);
            }
            case Types.TINYINT, Types.SMALLINT, Types.INTEGER, Types.BIGINT -> {
                long v = rs.getLong(column);
                return rs.wasNull() ? FieldValue.absent() : FieldValue.of(v);
            }
            case Types.REAL, Types.FLOAT, Types.DOUBLE -> {
                double v = rs.getDouble(column);
                return rs.wasNull() ? FieldValue.absent() : FieldValue.of(v);
            }
            case Types.NUMERIC, Types.DECIMAL -> {
                return fromDecimal(rs.getBigDecimal(column));
            }
            case Types.TIMESTAMP -> {
                LocalDateTime v = rs.getObject(column, LocalDateTime.class);
                return v == null ? FieldValue.absent() : FieldValue.timestamp(v.toInstant(ZoneOffset.UTC));
            }
            case Types.TIMESTAMP_WITH_TIMEZONE -> {
                OffsetDateTime v = rs.getObject(column, OffsetDateTime.class);
                return v == null ? FieldValue.absent() : FieldValue.timestamp(v.toInstant());
            }
            case Types.DATE -> {
                LocalDate v = rs.getObject(column, LocalDate.class);
                return v == null ? FieldValue.absent() : FieldValue.timestamp(v.atStartOfDay(ZoneOffset.UTC).toInstant());
            }
            default -> {
                if ("interval".equalsIgnoreCase(meta.getColumnTypeName(column))) {
                    String text = rs.getString(column);
                    return text == null ? FieldValue.absent() : FieldValue.duration(parseInterval(text));
                }
                return FieldValue.fromObject(rs.getObject(column));
            }
        }
    }

    private static FieldValue fromDecimal(BigDecimal value) {
        if (value == null) {
            return FieldValue.absent();
        }
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() <= 0 && stripped.toBigInteger().bitLength() < 64) {
            return FieldValue.of(stripped.longValueExact());
        }
        return FieldValue.of(value.doubleValue());
    }

    /**
     * Parses an interval in the PostgreSQL default output style, e.g. {@code 1 day 02:03:04.5}.
     * Months count as 30 days and years as 365 days.
     *
     * @param text interval text
     * @return the duration
     */
    static Duration parseInterval(String text) {
        Duration result = Duration.ZERO;
        Matcher m = INTERVAL_PART.matcher(text);
        while (m.find()) {
            if (m.group(1) != null) {
                long n = Long.parseLong(m.group(1));
                String unit = m.group(2);
                if (unit.startsWith("year")) {
                    result = result.plusDays(n * 365);
                } else if (unit.startsWith("mon")) {
                    result = result.plusDays(n * 30);
                } else {
                    result = result.plusDays(n);
                }
            } else {
                Duration time = Duration.ofHours(Long.parseLong(m.group(4)))
                    .plusMinutes(Long.parseLong(m.group(5)))
                    .plusSeconds(Long.parseLong(m.group(6)));
                if (m.group(7) != null) {
                    String fraction = (m.group(7) + "000000000").substring(0, 9);
                    time = time.plusNanos(Long.parseLong(fraction));
                }
                result = "-".equals(m.group(3)) ? result.minus(time) : result.plus(time);
            }
        }
        return result;
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    public String getName() {
        return name;
    }

    /**
     * Closes the connection pool if it was ever created.
     */
    @Override
    public void close() {
        synchronized (initLock) {
            if (pool != null) {
                pool.close();
                log.debug("Connection pool for source '{}' closed", name);
            }
        }
    }
}
