package org.ashby.plot.generate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

/**
 * Maps friendly color names to hex values.
 * <p>
 * Resolution rules: an empty or missing name means "no color set" (null); a registered name
 * resolves to its hex value; anything else is passed through unchanged, so literal hex values and
 * plotly color names work without registration.
 */
public class ColorTable {

    private final String defaultColor;
    private final Map<String, String> named;

    public ColorTable(String defaultColor, Map<String, String> named) {
        this.defaultColor = defaultColor;
        this.named = Collections.unmodifiableMap(new LinkedHashMap<>(named));
    }

    public static ColorTable empty() {
        return new ColorTable(null, Map.of());
    }

    /**
     * Builds a color table from the {@code ashby.colors} config block.
     *
     * @param colors config with optional {@code default} and {@code named} keys
     * @return the color table
     */
    public static ColorTable fromConfig(Config colors) {
        String defaultColor = colors.hasPath("default") ? colors.getString("default") : null;
        Map<String, String> named = new LinkedHashMap<>();
        if (colors.hasPath("named")) {
            for (Map.Entry<String, ConfigValue> e : colors.getObject("named").entrySet()) {
                named.put(e.getKey(), String.valueOf(e.getValue().unwrapped()));
            }
        }
        return new ColorTable(defaultColor, named);
    }

    /**
     * Resolves a color name.
     *
     * @param name color name or literal, may be null
     * @return hex value, the literal, or null when no color is set
     */
    public String resolve(String name) {
        if (name == null || name.isEmpty()) {
            return null;
        }
        return named.getOrDefault(name, name);
    }

    public String getDefaultColor() {
        return defaultColor;
    }

    public Map<String, String> getNamedColors() {
        return named;
    }
}
