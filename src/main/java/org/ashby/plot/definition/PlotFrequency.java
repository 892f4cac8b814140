package org.ashby.plot.definition;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How often a plot is regenerated. Governs the granularity of its dated output directory.
 * <p>
 * Weekly plots are placed in day-grained directories, exactly like daily plots.
 */
public enum PlotFrequency {
    @JsonProperty("weekly")
    WEEKLY("weekly", ChronoUnit.DAYS, "yyyy/MM/dd"),

    @JsonProperty("daily")
    DAILY("daily", ChronoUnit.DAYS, "yyyy/MM/dd"),

    @JsonProperty("hourly")
    HOURLY("hourly", ChronoUnit.HOURS, "yyyy/MM/dd/HH");

    private final String key;
    private final ChronoUnit granularity;
    private final DateTimeFormatter directoryFormat;
    private final int directoryDepth;

    PlotFrequency(String key, ChronoUnit granularity, String directoryPattern) {
        this.key = key;
        this.granularity = granularity;
        this.directoryFormat = DateTimeFormatter.ofPattern(directoryPattern).withZone(ZoneOffset.UTC);
        this.directoryDepth = directoryPattern.split("/").length;
    }

    /**
     * Truncates a basis time to this frequency's granularity, in UTC.
     *
     * @param basisTime the basis time
     * @return the truncated time
     */
    public Instant truncate(Instant basisTime) {
        return basisTime.truncatedTo(granularity);
    }

    /**
     * Formats the zero-padded dated directory for a basis time, e.g. {@code 2023/05/08} or
     * {@code 2023/05/08/10}.
     *
     * @param basisTime the basis time
     * @return relative directory path using {@code /} separators
     */
    public String datedDirectory(Instant basisTime) {
        return directoryFormat.format(truncate(basisTime));
    }

    /**
     * Returns the number of path segments in a dated directory of this frequency.
     *
     * @return 3 for day-grained frequencies, 4 for hourly
     */
    public int getDirectoryDepth() {
        return directoryDepth;
    }

    public String getKey() {
        return key;
    }

    @Override
    public String toString() {
        return key;
    }
}
