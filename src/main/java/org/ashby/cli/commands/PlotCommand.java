package org.ashby.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.ashby.cli.CommandLineInterface;
import org.ashby.plot.api.PlotException;
import org.ashby.plot.batch.BasisTimeParser;
import org.ashby.plot.batch.BatchRunner;
import org.ashby.plot.data.DataSourceRegistry;
import org.ashby.plot.definition.PlotDefinition;
import org.ashby.plot.definition.PlotDefinitionParser;
import org.ashby.plot.figure.FigureDocument;
import org.ashby.plot.generate.FigureGenerator;
import org.ashby.plot.generate.PlotContext;
import org.ashby.plot.template.DefinitionTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Generates one figure document from one plot definition file.
 * <p>
 * The document goes to stdout unless {@code --output} names a file; log output always goes to
 * stderr, so stdout can be piped.
 */
@Command(
    name = "plot",
    description = "Generate a single figure document from a plot definition file"
)
public class PlotCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PlotCommand.class);

    @Parameters(index = "0", paramLabel = "FILE", description = "Plot definition file (YAML)")
    private File definitionFile;

    @Option(
        names = {"-s", "--source"},
        paramLabel = "NAME=URL",
        description = "Additional data source, e.g. db=postgres://user@host/db (repeatable)"
    )
    private List<String> sources;

    @Option(
        names = {"-p", "--param"},
        paramLabel = "KEY=VALUE",
        description = "Template parameter, available as {{ Params.KEY }} (repeatable)"
    )
    private List<String> params;

    @Option(
        names = {"--basis"},
        defaultValue = "now",
        description = "Basis time: now, RFC3339, unix seconds or an offset like -2d (default: ${DEFAULT-VALUE})"
    )
    private String basis;

    @Option(
        names = {"-o", "--output"},
        description = "Write the figure document to this file instead of stdout"
    )
    private File output;

    @Option(
        names = {"--compact"},
        description = "Emit single-line JSON (default: plot.compact from configuration)"
    )
    private Boolean compact;

    @Option(
        names = {"--validate"},
        description = "Print the parsed definition and its datasets without running any query"
    )
    private boolean validate;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            Config config = parent.getConfig();
            Map<String, Object> templateParams = CommandSupport.params(params);
            Instant basisTime = BasisTimeParser.parse(basis);

            String text = Files.readString(definitionFile.toPath(), StandardCharsets.UTF_8);
            String rendered = new DefinitionTemplate(basisTime, templateParams).render(text);
            PlotDefinition definition = new PlotDefinitionParser().parse(definitionFile.getName(), rendered);

            if (validate) {
                out.println("Name: " + definition.name());
                out.println("Frequency: " + definition.frequency());
                BatchRunner.printDataSets(out, definition.datasets());
                out.flush();
                return 0;
            }

            boolean compactJson = compact != null ? compact : config.getBoolean("plot.compact");
            String json;
            try (DataSourceRegistry registry = CommandSupport.dataSources(config, sources)) {
                PlotContext context = new PlotContext(basisTime, registry, templateParams, CommandSupport.colors(config));
                FigureDocument document = new FigureGenerator().generate(definition, context);
                json = document.toJson(compactJson);
            }

            if (output != null) {
                Files.writeString(output.toPath(), json + "\n", StandardCharsets.UTF_8);
                log.info("Wrote plot '{}' to {}", definition.name(), output);
            } else {
                out.println(json);
                out.flush();
            }
            return 0;

        } catch (PlotException | IOException | IllegalArgumentException | IllegalStateException | ConfigException e) {
            log.debug("Plot generation failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
