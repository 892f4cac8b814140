package org.ashby.plot.generate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.ashby.plot.api.DataAccessException;
import org.ashby.plot.api.PlotConfigurationException;
import org.ashby.plot.api.PlotException;
import org.ashby.plot.api.data.IDataSet;
import org.ashby.plot.api.data.IDataSource;
import org.ashby.plot.compute.DataSetDeriver;
import org.ashby.plot.compute.DataSetDeriver.ComputeInput;
import org.ashby.plot.compute.JoinPredicates;
import org.ashby.plot.definition.ComputeInputDefinition;
import org.ashby.plot.definition.ComputedDefinition;
import org.ashby.plot.definition.DataSetDefinition;
import org.ashby.plot.definition.PlotDefinition;
import org.ashby.plot.figure.FigureDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a parsed plot definition into a chart document.
 * <p>
 * Datasets are fetched in declaration order, then computed datasets are derived in declaration
 * order (so a computed dataset may use an earlier computed one). Traces follow in three passes:
 * series, scalars, tables. Cancellation is checked before every fetch and every derivation.
 * <p>
 * <strong>Thread Safety:</strong> instances are stateless and may be shared by concurrent
 * generations. The datasets of one generation are never shared.
 */
public class FigureGenerator {

    private static final Logger log = LoggerFactory.getLogger(FigureGenerator.class);

    private final DataSetDeriver deriver;

    public FigureGenerator(JoinPredicates predicates) {
        this.deriver = new DataSetDeriver(predicates);
    }

    public FigureGenerator() {
        this(JoinPredicates.standard());
    }

    /**
     * Generates a document without cancellation support.
     *
     * @param definition the plot definition
     * @param context    sources, colors and template parameters
     * @return the document
     * @throws PlotException if a dataset cannot be fetched or derived, or the definition is inconsistent
     */
    public FigureDocument generate(PlotDefinition definition, PlotContext context) throws PlotException {
        return generate(definition, context, CancellationToken.none());
    }

    /**
     * Generates a document.
     *
     * @param definition   the plot definition
     * @param context      sources, colors and template parameters
     * @param cancellation checked between data source calls
     * @return the document
     * @throws PlotException if a dataset cannot be fetched or derived, the definition is inconsistent,
     *                       or the token was cancelled
     */
    public FigureDocument generate(PlotDefinition definition, PlotContext context, CancellationToken cancellation)
            throws PlotException {
        String plotName = definition.name();
        Map<String, IDataSet> dataSets = new LinkedHashMap<>();

        for (DataSetDefinition ds : definition.datasets()) {
            cancellation.throwIfCancelled(plotName);
            fetch(plotName, ds, context, dataSets);
        }

        for (ComputedDefinition cds : definition.computed()) {
            cancellation.throwIfCancelled(plotName);
            compute(plotName, cds, dataSets);
        }

        FigureDocument figure = new FigureDocument(definition.layout(), definition.config());
        figure.data.addAll(new SeriesTraceBuilder(plotName, context.colors()).build(dataSets, definition.series()));
        figure.data.addAll(new ScalarTraceBuilder(plotName, context.colors()).build(dataSets, definition.scalars()));
        TableTraceBuilder tables = new TableTraceBuilder(plotName);
        figure.data.addAll(tables.build(dataSets, definition.tables()));
        figure.setAnnotations(tables.getAnnotations());

        figure.params = definition.parameters() != null
            ? definition.parameters()
            : new LinkedHashMap<>(context.templateParams());
        log.debug("Plot '{}': generated {} traces", plotName, figure.data.size());
        return figure;
    }

    private void fetch(String plotName, DataSetDefinition ds, PlotContext context, Map<String, IDataSet> dataSets)
            throws PlotException {
        if (dataSets.containsKey(ds.name())) {
            throw new PlotConfigurationException("duplicate dataset name: \"" + ds.name() + "\"");
        }
        IDataSource source = context.sources().get(ds.source());
        if (source == null) {
            throw new PlotConfigurationException("unknown dataset source: \"" + ds.source()
                + "\" for dataset \"" + ds.name() + "\"");
        }
        log.debug("Plot '{}': getting dataset '{}' from source '{}': {}", plotName, ds.name(), ds.source(),
            flatten(ds.query()));
        try {
            dataSets.put(ds.name(), source.getDataSet(ds.query()));
        } catch (DataAccessException e) {
            throw new DataAccessException("failed to get dataset \"" + ds.name() + "\" from source \""
                + ds.source() + "\": " + e.getMessage(), e);
        }
    }

    private void compute(String plotName, ComputedDefinition cds, Map<String, IDataSet> dataSets)
            throws PlotException {
        if (dataSets.containsKey(cds.name())) {
            throw new PlotConfigurationException("computed dataset name conflicts with existing dataset: \""
                + cds.name() + "\"");
        }
        List<ComputeInputDefinition> inputs = cds.datasets();
        if (inputs.size() != 2) {
            throw new PlotConfigurationException("unexpected number of datasets in computed dataset \""
                + cds.name() + "\": " + inputs.size());
        }
        for (ComputeInputDefinition input : inputs) {
            if (!dataSets.containsKey(input.dataset())) {
                throw new PlotConfigurationException("unknown dataset in computed dataset \"" + cds.name()
                    + "\": \"" + input.dataset() + "\"");
            }
        }

        ComputeInputDefinition left = inputs.get(0);
        ComputeInputDefinition right = inputs.get(1);
        log.debug("Plot '{}': computing dataset '{}' with '{}' from '{}' and '{}'", plotName, cds.name(),
            cds.function(), left.dataset(), right.dataset());
        try {
            dataSets.put(cds.name(), deriver.derive(cds.function(),
                new ComputeInput(left.dataset(), dataSets.get(left.dataset()), left.joinField(), left.valueField()),
                new ComputeInput(right.dataset(), dataSets.get(right.dataset()), right.joinField(), right.valueField())));
        } catch (PlotConfigurationException e) {
            throw new PlotConfigurationException("computed dataset \"" + cds.name() + "\": " + e.getMessage(), e);
        } catch (DataAccessException e) {
            throw new DataAccessException("failed to compute dataset \"" + cds.name() + "\": " + e.getMessage(), e);
        }
    }

    private static String flatten(String query) {
        return query == null ? "" : query.replace('\n', ' ');
    }
}
