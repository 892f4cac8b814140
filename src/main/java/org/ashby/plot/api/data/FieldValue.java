package org.ashby.plot.api.data;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A single typed value read from a dataset row.
 * <p>
 * The set of kinds is closed. Consumers switch on {@link #getKind()} rather than inspecting
 * the runtime class of the payload. Join and group keys are compared through
 * {@link #canonicalText()}, so an integer {@code 3} and a float {@code 3.0} address the same key,
 * as do a timestamp and its RFC3339 rendering.
 */
public final class FieldValue {

    /**
     * The kind tag of a field value.
     */
    public enum Kind {
        ABSENT,
        BOOLEAN,
        INTEGER,
        FLOATING,
        TEXT,
        TIMESTAMP,
        DURATION,
        ERROR
    }

    private static final FieldValue ABSENT = new FieldValue(Kind.ABSENT, null);
    private static final FieldValue TRUE = new FieldValue(Kind.BOOLEAN, Boolean.TRUE);
    private static final FieldValue FALSE = new FieldValue(Kind.BOOLEAN, Boolean.FALSE);

    private final Kind kind;
    private final Object value;

    private FieldValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static FieldValue absent() {
        return ABSENT;
    }

    public static FieldValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static FieldValue of(long value) {
        return new FieldValue(Kind.INTEGER, value);
    }

    public static FieldValue of(double value) {
        return new FieldValue(Kind.FLOATING, value);
    }

    public static FieldValue text(String value) {
        return value == null ? ABSENT : new FieldValue(Kind.TEXT, value);
    }

    public static FieldValue timestamp(Instant value) {
        return value == null ? ABSENT : new FieldValue(Kind.TIMESTAMP, value);
    }

    public static FieldValue duration(Duration value) {
        return value == null ? ABSENT : new FieldValue(Kind.DURATION, value);
    }

    /**
     * Creates an error value, used as the result of looking up a field that cannot be read.
     *
     * @param message description of the failed lookup
     * @return an error value
     */
    public static FieldValue error(String message) {
        return new FieldValue(Kind.ERROR, Objects.requireNonNull(message, "message"));
    }

    /**
     * Converts a plain Java object into a field value.
     * <p>
     * Integral boxes map to {@link Kind#INTEGER} ({@code BigInteger}s wider than 64 bits to
     * {@link Kind#FLOATING}), {@code Float}, {@code Double} and
     * {@code BigDecimal} to {@link Kind#FLOATING}, temporal instants to {@link Kind#TIMESTAMP}.
     * Anything unrecognised is carried as its string form.
     *
     * @param raw the object to convert, may be null
     * @return the matching field value
     */
    public static FieldValue fromObject(Object raw) {
        if (raw == null) {
            return ABSENT;
        }
        if (raw instanceof FieldValue fv) {
            return fv;
        }
        if (raw instanceof Boolean b) {
            return of(b);
        }
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return of(((Number) raw).longValue());
        }
        if (raw instanceof java.math.BigInteger bi) {
            return bi.bitLength() < Long.SIZE ? of(bi.longValue()) : of(bi.doubleValue());
        }
        if (raw instanceof Number n) {
            return of(n.doubleValue());
        }
        if (raw instanceof String s) {
            return text(s);
        }
        if (raw instanceof Instant i) {
            return timestamp(i);
        }
        if (raw instanceof java.sql.Timestamp ts) {
            return timestamp(ts.toInstant());
        }
        if (raw instanceof java.time.OffsetDateTime odt) {
            return timestamp(odt.toInstant());
        }
        if (raw instanceof java.time.ZonedDateTime zdt) {
            return timestamp(zdt.toInstant());
        }
        if (raw instanceof java.time.LocalDateTime ldt) {
            return timestamp(ldt.toInstant(java.time.ZoneOffset.UTC));
        }
        if (raw instanceof java.sql.Date d) {
            return timestamp(d.toLocalDate().atStartOfDay(java.time.ZoneOffset.UTC).toInstant());
        }
        if (raw instanceof java.time.LocalDate ld) {
            return timestamp(ld.atStartOfDay(java.time.ZoneOffset.UTC).toInstant());
        }
        if (raw instanceof java.util.Date d) {
            return timestamp(d.toInstant());
        }
        if (raw instanceof Duration d) {
            return duration(d);
        }
        return text(raw.toString());
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isAbsent() {
        return kind == Kind.ABSENT;
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }

    public boolean isNumeric() {
        return kind == Kind.INTEGER || kind == Kind.FLOATING;
    }

    public boolean asBoolean() {
        requireKind(Kind.BOOLEAN);
        return (Boolean) value;
    }

    public long asLong() {
        requireKind(Kind.INTEGER);
        return (Long) value;
    }

    public double asDouble() {
        requireKind(Kind.FLOATING);
        return (Double) value;
    }

    public String asText() {
        requireKind(Kind.TEXT);
        return (String) value;
    }

    public Instant asTimestamp() {
        requireKind(Kind.TIMESTAMP);
        return (Instant) value;
    }

    public Duration asDuration() {
        requireKind(Kind.DURATION);
        return (Duration) value;
    }

    public String getErrorMessage() {
        requireKind(Kind.ERROR);
        return (String) value;
    }

    /**
     * Widens a numeric value to a double.
     *
     * @return the numeric value as double
     * @throws IllegalStateException if this value is not numeric
     */
    public double toDouble() {
        return switch (kind) {
            case INTEGER -> (Long) value;
            case FLOATING -> (Double) value;
            default -> throw new IllegalStateException("not a numeric field value: " + kind);
        };
    }

    /**
     * Returns the deterministic text projection used to compare join and group keys.
     * <p>
     * Numbers are rendered without exponent or trailing zeros, timestamps as RFC3339 in UTC
     * with second precision, durations as seconds.
     *
     * @return canonical text, empty for an absent value
     */
    public String canonicalText() {
        return switch (kind) {
            case ABSENT -> "";
            case BOOLEAN -> value.toString();
            case INTEGER -> Long.toString((Long) value);
            case FLOATING -> formatDouble((Double) value);
            case TEXT -> (String) value;
            case TIMESTAMP -> formatTimestamp((Instant) value);
            case DURATION -> formatDouble(durationSeconds((Duration) value));
            case ERROR -> "error: " + value;
        };
    }

    /**
     * Returns the value as a JSON-compatible scalar for the output document. NaN and infinite
     * floats have no JSON form and become null.
     *
     * @return Long, Double, Boolean, String or null
     */
    public Object toJsonValue() {
        return switch (kind) {
            case ABSENT, ERROR -> null;
            case BOOLEAN, INTEGER, TEXT -> value;
            case FLOATING -> Double.isFinite((Double) value) ? value : null;
            case TIMESTAMP -> formatTimestamp((Instant) value);
            case DURATION -> durationSeconds((Duration) value);
        };
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("field value is " + kind + ", not " + expected);
        }
    }

    private static String formatDouble(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Double.toString(d);
        }
        String plain = BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        return "-0".equals(plain) ? "0" : plain;
    }

    private static String formatTimestamp(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }

    private static double durationSeconds(Duration duration) {
        return duration.getSeconds() + duration.getNano() / 1_000_000_000.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldValue other)) {
            return false;
        }
        return kind == other.kind && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind == Kind.ABSENT ? "ABSENT" : kind + "(" + canonicalText() + ")";
    }
}
