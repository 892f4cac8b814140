package org.ashby.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

import org.ashby.cli.CommandLineInterface;
import org.ashby.plot.api.PlotException;
import org.ashby.plot.batch.BasisTimeParser;
import org.ashby.plot.batch.BatchRunner;
import org.ashby.plot.batch.BatchRunner.Summary;
import org.ashby.plot.batch.ProcessingProfile;
import org.ashby.plot.data.DataSourceRegistry;
import org.ashby.plot.generate.FigureGenerator;
import org.ashby.plot.organize.Organizer;
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
 * Generates every plot definition of one or more directories into a versioned output tree.
 * <p>
 * Without positional arguments the processing profiles under {@code batch.profiles} drive the run.
 * Plots whose output is newer than their definition file are skipped unless {@code --force} is given.
 */
@Command(
    name = "batch",
    description = "Generate all plot definitions of one or more directories into an output tree"
)
public class BatchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BatchCommand.class);

    @Parameters(
        arity = "0..*",
        paramLabel = "DEFINITIONS",
        description = "Definition directories or files (default: batch.profiles from configuration)"
    )
    private List<String> definitions;

    @Option(
        names = {"--out"},
        required = true,
        description = "Base directory of the output tree"
    )
    private File outputDirectory;

    @Option(
        names = {"--basis"},
        defaultValue = "now",
        description = "Basis time: now, RFC3339, unix seconds or an offset like -2d; never in the future (default: ${DEFAULT-VALUE})"
    )
    private String basis;

    @Option(
        names = {"--force"},
        description = "Regenerate plots even when their output is up to date"
    )
    private boolean force;

    @Option(
        names = {"--concurrency"},
        description = "Number of plots generated at once (default: batch.concurrency from configuration)"
    )
    private Integer concurrency;

    @Option(
        names = {"--match"},
        description = "Glob restricting which definition files run (default: " + BatchRunner.DEFAULT_MATCH + ")"
    )
    private String match;

    @Option(
        names = {"--compact"},
        description = "Emit single-line JSON (default: batch.compact from configuration)"
    )
    private Boolean compact;

    @Option(
        names = {"--validate"},
        description = "Print output paths, freshness and datasets of every plot without generating"
    )
    private boolean validate;

    @Option(
        names = {"-s", "--source"},
        paramLabel = "NAME=URL",
        description = "Additional data source, e.g. db=postgres://user@host/db (repeatable)"
    )
    private List<String> sources;

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
            Config batch = config.getConfig("batch");

            List<ProcessingProfile> profiles = definitions != null && !definitions.isEmpty()
                ? BatchRunner.profilesFor(definitions)
                : ProcessingProfile.fromConfig(batch.getConfigList("profiles"));
            if (profiles.isEmpty()) {
                err.println("Error: No plot definitions given and no batch.profiles configured.");
                return 1;
            }

            Instant basisTime = BasisTimeParser.parse(basis);
            Duration heartbeat = batch.getDuration("heartbeat-interval");
            BatchRunner.Options options = new BatchRunner.Options(
                basisTime,
                concurrency != null ? concurrency : batch.getInt("concurrency"),
                force,
                validate,
                compact != null ? compact : batch.getBoolean("compact"),
                match,
                heartbeat);

            Summary summary;
            try (DataSourceRegistry registry = CommandSupport.dataSources(config, sources)) {
                BatchRunner runner = new BatchRunner(options, new Organizer(outputDirectory.toPath()), registry,
                    CommandSupport.colors(config), new FigureGenerator(), out);
                summary = runner.run(profiles);
            }

            if (!validate) {
                out.printf("Generated %d plots, skipped %d up-to-date plots%n", summary.generated(), summary.skipped());
            }
            out.flush();
            return 0;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Error: batch interrupted");
            return 1;
        } catch (PlotException | IOException | IllegalArgumentException | IllegalStateException | ConfigException e) {
            log.debug("Batch failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
