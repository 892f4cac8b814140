package org.ashby.plot.definition;

import java.nio.file.Path;

import org.ashby.plot.api.PlotConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

/**
 * Parses YAML plot definition documents (after templating) into {@link PlotDefinition}s.
 * <p>
 * Unknown keys are ignored. An empty string for an optional enum-valued key (marker, fill,
 * delta type) means the key is unset. A definition without a name takes the base name of its
 * file.
 */
public class PlotDefinitionParser {

    private static final Logger log = LoggerFactory.getLogger(PlotDefinitionParser.class);

    private final YAMLMapper mapper;

    public PlotDefinitionParser() {
        this.mapper = new YAMLMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
        mapper.coercionConfigFor(LogicalType.Enum)
            .setCoercion(CoercionInputShape.EmptyString, CoercionAction.AsNull);
    }

    /**
     * Parses a definition document.
     *
     * @param fileName name of the file the text came from, used for the default plot name
     * @param content  the templated definition text
     * @return the validated definition
     * @throws PlotConfigurationException if the text is not a valid definition
     */
    public PlotDefinition parse(String fileName, String content) throws PlotConfigurationException {
        log.info("Parsing plot definition file '{}'", fileName);
        PlotDefinition definition;
        try {
            definition = mapper.readValue(content, PlotDefinition.class);
        } catch (InvalidFormatException e) {
            throw new PlotConfigurationException(String.format("%s: unknown %s value \"%s\"",
                fileName, describePath(e), e.getValue()), e);
        } catch (JsonProcessingException e) {
            throw new PlotConfigurationException(fileName + ": failed to read plot definition: "
                + e.getOriginalMessage(), e);
        }
        if (definition == null) {
            throw new PlotConfigurationException(fileName + ": plot definition is empty");
        }

        if (definition.name() == null || definition.name().isEmpty()) {
            definition = definition.withName(plotName(fileName));
        }
        validate(definition);
        return definition;
    }

    /**
     * Derives a plot name from a file name by dropping directories and the extension.
     *
     * @param fileName the file name
     * @return the plot name
     */
    public static String plotName(String fileName) {
        Path fileNamePath = Path.of(fileName).getFileName();
        String base = fileNamePath == null ? fileName : fileNamePath.toString();
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }

    private static void validate(PlotDefinition definition) throws PlotConfigurationException {
        for (DataSetDefinition dataSet : definition.datasets()) {
            if (isEmpty(dataSet.name())) {
                throw new PlotConfigurationException("dataset without a name");
            }
            if (isEmpty(dataSet.source())) {
                throw new PlotConfigurationException("dataset '" + dataSet.name() + "' has no source");
            }
            if (isEmpty(dataSet.query())) {
                throw new PlotConfigurationException("dataset '" + dataSet.name() + "' has no query");
            }
        }
        for (SeriesDefinition series : definition.series()) {
            if (series.type() == null) {
                throw new PlotConfigurationException("unknown series type: \"\" in series '" + series.name() + "'");
            }
        }
        for (ScalarDefinition scalar : definition.scalars()) {
            if (scalar.type() == null) {
                throw new PlotConfigurationException("unknown scalar type: \"\" in scalar '" + scalar.name() + "'");
            }
        }
        for (TableDefinition table : definition.tables()) {
            if (table.type() == null) {
                throw new PlotConfigurationException("unknown table type: \"\" in table '" + table.name() + "'");
            }
        }
        for (ComputedDefinition computed : definition.computed()) {
            if (isEmpty(computed.name())) {
                throw new PlotConfigurationException("computed dataset without a name");
            }
            if (isEmpty(computed.function())) {
                throw new PlotConfigurationException("computed dataset '" + computed.name() + "' has no function");
            }
        }
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }

    private static String describePath(InvalidFormatException e) {
        StringBuilder sb = new StringBuilder();
        for (var ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(ref.getFieldName());
            }
        }
        return sb.length() == 0 ? "field" : sb.toString();
    }
}
