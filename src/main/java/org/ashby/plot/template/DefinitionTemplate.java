package org.ashby.plot.template;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.ashby.plot.api.PlotConfigurationException;

/**
 * Text transform applied to definition documents before they are parsed.
 * <p>
 * Placeholders have the form <code>{{ Variable | function arg | function }}</code>. The first stage
 * is a variable ({@code Now}, {@code StartOfDay}, {@code Params.region}, ...) or a quoted string;
 * every further stage applies a function to the value of the previous one. A leading dot on
 * variable names is accepted. All times derive from the basis time and are UTC.
 * <p>
 * Times that are substituted without a formatting function render as RFC3339.
 */
public class DefinitionTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{-?\\s*(.*?)\\s*-?}}", Pattern.DOTALL);
    private static final String PARAMS_PREFIX = "Params.";

    private static final DateTimeFormatter PG_TIMESTAMP_TZ =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'Z'").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter PG_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter SIMPLE_DATE =
        DateTimeFormatter.ofPattern("d MMM yyyy", Locale.ENGLISH).withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter ISO_DATE =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX").withZone(ZoneOffset.UTC);

    @FunctionalInterface
    private interface TemplateFunction {
        Object apply(Object input, String argument) throws PlotConfigurationException;
    }

    private final Map<String, Object> variables = new LinkedHashMap<>();
    private final Map<String, Object> params;
    private final Map<String, TemplateFunction> functions = new LinkedHashMap<>();

    /**
     * Creates a template context.
     *
     * @param basisTime reference time for every time variable
     * @param params    template parameters, addressed as {@code Params.key}
     */
    public DefinitionTemplate(Instant basisTime, Map<String, ?> params) {
        this.params = params == null ? Collections.emptyMap() : Collections.unmodifiableMap(params);

        Instant startOfHour = basisTime.truncatedTo(ChronoUnit.HOURS);
        Instant startOfDay = basisTime.truncatedTo(ChronoUnit.DAYS);
        Instant startOfWeek = startOfDay.atZone(ZoneOffset.UTC)
            .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
            .toInstant();

        variables.put("Now", basisTime);
        variables.put("StartOfHour", startOfHour);
        variables.put("StartOfDay", startOfDay);
        variables.put("StartOfWeek", startOfWeek);
        variables.put("EndOfPreviousHour", startOfHour.minusNanos(1));
        variables.put("EndOfPreviousDay", startOfDay.minusNanos(1));
        variables.put("EndOfPreviousWeek", startOfWeek.minusNanos(1));
        variables.put("StartOfPreviousWeek", startOfWeek.minus(Duration.ofDays(7)));

        functions.put("timestamptz", (in, arg) -> "'" + PG_TIMESTAMP_TZ.format(time("timestamptz", in)) + "'::timestamptz");
        functions.put("timestamp", (in, arg) -> "'" + PG_TIMESTAMP.format(time("timestamp", in)) + "'::timestamp");
        functions.put("simpledate", (in, arg) -> SIMPLE_DATE.format(time("simpledate", in)));
        functions.put("isodate", (in, arg) -> ISO_DATE.format(time("isodate", in)));
        functions.put("dayModify", (in, arg) -> time("dayModify", in).plus(Duration.ofDays(count("dayModify", arg))));
        functions.put("weekModify", (in, arg) -> time("weekModify", in).plus(Duration.ofDays(7L * count("weekModify", arg))));
        functions.put("monthModify", (in, arg) -> time("monthModify", in).atZone(ZoneOffset.UTC)
            .plusMonths(count("monthModify", arg)).toInstant());
        functions.put("toUpper", (in, arg) -> asText(in).toUpperCase(Locale.ROOT));
        functions.put("quote", (in, arg) -> "\"" + asText(in).replace("\\", "\\\\").replace("\"", "\\\"") + "\"");
    }

    /**
     * Replaces every placeholder in a definition text.
     *
     * @param source definition text
     * @return the text with all placeholders substituted
     * @throws PlotConfigurationException if a placeholder names an unknown variable or function,
     *                                    or a function receives an unusable value
     */
    public String render(String source) throws PlotConfigurationException {
        Matcher m = PLACEHOLDER.matcher(source);
        StringBuilder out = new StringBuilder(source.length());
        while (m.find()) {
            Object value = evaluate(m.group(1));
            m.appendReplacement(out, Matcher.quoteReplacement(asText(value)));
        }
        m.appendTail(out);
        return out.toString();
    }

    private Object evaluate(String expression) throws PlotConfigurationException {
        List<String> stages = splitStages(expression);
        Object value = resolve(stages.get(0));
        for (int i = 1; i < stages.size(); i++) {
            String stage = stages.get(i);
            int space = stage.indexOf(' ');
            String name = space < 0 ? stage : stage.substring(0, space);
            String argument = space < 0 ? null : unquote(stage.substring(space + 1).trim());
            TemplateFunction function = functions.get(name);
            if (function == null) {
                throw new PlotConfigurationException("template: unknown function \"" + name + "\" in {{ " + expression + " }}");
            }
            value = function.apply(value, argument);
        }
        return value;
    }

    private Object resolve(String term) throws PlotConfigurationException {
        if (term.startsWith("\"") && term.endsWith("\"") && term.length() >= 2) {
            return unquote(term);
        }
        String name = term.startsWith(".") ? term.substring(1) : term;
        if (name.startsWith(PARAMS_PREFIX)) {
            String key = name.substring(PARAMS_PREFIX.length());
            if (!params.containsKey(key)) {
                throw new PlotConfigurationException("template: no value for parameter \"" + key + "\"");
            }
            return params.get(key);
        }
        Object value = variables.get(name);
        if (value == null) {
            throw new PlotConfigurationException("template: unknown variable \"" + term + "\"");
        }
        return value;
    }

    private static List<String> splitStages(String expression) throws PlotConfigurationException {
        List<String> stages = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (char c : expression.toCharArray()) {
            if (c == '"') {
                quoted = !quoted;
            }
            if (c == '|' && !quoted) {
                stages.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        stages.add(current.toString().trim());
        for (String stage : stages) {
            if (stage.isEmpty()) {
                throw new PlotConfigurationException("template: empty expression in {{ " + expression + " }}");
            }
        }
        return stages;
    }

    private static String unquote(String text) {
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    private static Instant time(String function, Object value) throws PlotConfigurationException {
        if (value instanceof Instant instant) {
            return instant;
        }
        throw new PlotConfigurationException("template: " + function + " expects a time, got \"" + asText(value) + "\"");
    }

    private static long count(String function, String argument) throws PlotConfigurationException {
        if (argument == null) {
            throw new PlotConfigurationException("template: " + function + " needs a number argument");
        }
        try {
            return Long.parseLong(argument);
        } catch (NumberFormatException e) {
            throw new PlotConfigurationException("template: " + function + " argument is not a number: \"" + argument + "\"", e);
        }
    }

    private static String asText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Instant instant) {
            return ISO_DATE.format(instant);
        }
        return value.toString();
    }
}
