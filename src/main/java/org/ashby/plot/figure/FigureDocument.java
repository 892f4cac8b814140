package org.ashby.plot.figure;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * The generated chart document: traces, layout with annotations, config and echoed parameters.
 * <p>
 * Serialized as
 * <pre>
 * { "data": [...], "layout": {..., "annotations": [...]}, "config": {...}, "params": {...} }
 * </pre>
 */
public class FigureDocument {

    private static final Gson PRETTY = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    private static final Gson COMPACT = new GsonBuilder().disableHtmlEscaping().create();

    public List<Trace> data = new ArrayList<>();
    public Map<String, Object> layout = new LinkedHashMap<>();
    public Map<String, Object> config = new LinkedHashMap<>();
    public Map<String, Object> params;

    /**
     * Creates a document around a copy of the definition's layout and config, so the parsed
     * definition is never modified.
     *
     * @param layout layout passthrough, may be null
     * @param config config passthrough, may be null
     */
    public FigureDocument(Map<String, Object> layout, Map<String, Object> config) {
        if (layout != null) {
            this.layout.putAll(layout);
        }
        if (config != null) {
            this.config.putAll(config);
        }
    }

    /**
     * Replaces the layout annotations. An empty list removes the key.
     *
     * @param annotations cell annotations
     */
    public void setAnnotations(List<Annotation> annotations) {
        if (annotations.isEmpty()) {
            layout.remove("annotations");
        } else {
            layout.put("annotations", annotations);
        }
    }

    /**
     * Serializes the document.
     *
     * @param compact true for single-line output, false for indented output
     * @return the JSON text
     */
    public String toJson(boolean compact) {
        return (compact ? COMPACT : PRETTY).toJson(this);
    }
}
