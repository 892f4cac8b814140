package org.ashby.plot.batch;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the {@code --basis} option.
 * <p>
 * Accepted forms:
 * <ul>
 *   <li>{@code now}</li>
 *   <li>an offset into the past: {@code -2h}, {@code -4d}, {@code -1w}</li>
 *   <li>unix seconds, e.g. {@code 1683540000}</li>
 *   <li>an RFC3339 time, e.g. {@code 2023-05-08T10:00:00Z}</li>
 * </ul>
 * Absolute times must not lie in the future.
 */
public final class BasisTimeParser {

    private static final Pattern OFFSET = Pattern.compile("^-(\\d+)([hdw])$");

    private BasisTimeParser() {
    }

    public static Instant parse(String basis) {
        return parse(basis, Clock.systemUTC());
    }

    /**
     * Parses a basis time against a clock.
     *
     * @param basis option value
     * @param clock source of "now"
     * @return the basis time
     * @throws IllegalArgumentException if the value is malformed or lies in the future
     */
    public static Instant parse(String basis, Clock clock) {
        Instant now = clock.instant();
        if (basis == null || basis.isEmpty() || "now".equals(basis)) {
            return now;
        }

        Matcher m = OFFSET.matcher(basis);
        if (m.matches()) {
            long n = Long.parseLong(m.group(1));
            Duration offset = switch (m.group(2)) {
                case "h" -> Duration.ofHours(n);
                case "d" -> Duration.ofDays(n);
                case "w" -> Duration.ofDays(7 * n);
                default -> throw new IllegalArgumentException("invalid basis offset unit: \"" + m.group(2) + "\"");
            };
            return now.minus(offset);
        }

        Instant basisTime;
        try {
            basisTime = Instant.ofEpochSecond(Long.parseLong(basis));
        } catch (NumberFormatException notUnix) {
            try {
                basisTime = OffsetDateTime.parse(basis, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("invalid basis time: \"" + basis + "\"", e);
            }
        }
        if (basisTime.isAfter(now)) {
            throw new IllegalArgumentException("basis time should not be in the future: " + basisTime);
        }
        return basisTime;
    }
}
