package org.ashby.plot.batch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.typesafe.config.Config;

/**
 * A set of definition files generated together, once per variant.
 * <p>
 * Each variant is a map of template parameters. A profile without variants runs once with no
 * parameters.
 *
 * @param source   definition directory, or a single definition file
 * @param variants template parameters of each run
 */
public record ProcessingProfile(String source, List<Map<String, Object>> variants) {

    public ProcessingProfile {
        variants = variants == null || variants.isEmpty() ? List.of(Map.of()) : List.copyOf(variants);
    }

    public static ProcessingProfile of(String source) {
        return new ProcessingProfile(source, null);
    }

    /**
     * Reads the profiles of {@code ashby.batch.profiles}.
     *
     * @param profiles list of {@code { source, variants }} objects
     * @return the profiles in configured order
     */
    public static List<ProcessingProfile> fromConfig(List<? extends Config> profiles) {
        List<ProcessingProfile> result = new ArrayList<>();
        for (Config p : profiles) {
            List<Map<String, Object>> variants = new ArrayList<>();
            if (p.hasPath("variants")) {
                for (Config v : p.getConfigList("variants")) {
                    variants.add(new LinkedHashMap<>(v.root().unwrapped()));
                }
            }
            result.add(new ProcessingProfile(p.getString("source"), variants));
        }
        return result;
    }
}
