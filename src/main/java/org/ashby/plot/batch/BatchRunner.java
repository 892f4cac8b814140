package org.ashby.plot.batch;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.ashby.plot.api.DataAccessException;
import org.ashby.plot.api.GenerationCancelledException;
import org.ashby.plot.api.PlotConfigurationException;
import org.ashby.plot.api.PlotException;
import org.ashby.plot.data.DataSourceRegistry;
import org.ashby.plot.definition.DataSetDefinition;
import org.ashby.plot.definition.PlotDefinition;
import org.ashby.plot.definition.PlotDefinitionParser;
import org.ashby.plot.figure.FigureDocument;
import org.ashby.plot.generate.CancellationToken;
import org.ashby.plot.generate.ColorTable;
import org.ashby.plot.generate.FigureGenerator;
import org.ashby.plot.generate.PlotContext;
import org.ashby.plot.organize.Organizer;
import org.ashby.plot.template.DefinitionTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates every definition file of a set of processing profiles into a dated output tree.
 * <p>
 * Profiles run one after another, and so do the variants of a profile. The definition files of
 * one variant are generated concurrently by a fixed pool of workers. The first failing file
 * cancels the rest of that variant: files not yet started are skipped, running generations stop at
 * their next checkpoint, and the first failure is rethrown once all workers have finished.
 * <p>
 * In validate mode nothing is generated or written; each file's output path, staleness and
 * datasets are printed instead, one file at a time.
 */
public class BatchRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    public static final String DEFAULT_MATCH = "*.yaml";

    /**
     * Batch settings.
     *
     * @param basisTime         basis time of every plot in the run
     * @param concurrency       number of workers; forced to 1 when validating
     * @param force             regenerate plots even when their output is fresh
     * @param validate          print what would be generated instead of generating
     * @param compact           emit single-line JSON
     * @param matchGlob         file name glob restricting which definitions run, may be null
     * @param heartbeatInterval interval of the "still generating" log line
     */
    public record Options(
            Instant basisTime,
            int concurrency,
            boolean force,
            boolean validate,
            boolean compact,
            String matchGlob,
            Duration heartbeatInterval) {

        public Options {
            if (concurrency < 1) {
                throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency);
            }
            concurrency = validate ? 1 : concurrency;
            heartbeatInterval = heartbeatInterval == null ? Duration.ofMinutes(1) : heartbeatInterval;
        }
    }

    /**
     * Counts of what a run did.
     */
    public record Summary(int generated, int skipped, int validated) {
    }

    private final Options options;
    private final Organizer organizer;
    private final DataSourceRegistry sources;
    private final ColorTable colors;
    private final FigureGenerator generator;
    private final PlotDefinitionParser parser = new PlotDefinitionParser();
    private final PrintWriter validateOut;

    private final AtomicInteger generated = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final AtomicInteger validated = new AtomicInteger();

    public BatchRunner(Options options, Organizer organizer, DataSourceRegistry sources, ColorTable colors,
                       FigureGenerator generator, PrintWriter validateOut) {
        this.options = options;
        this.organizer = organizer;
        this.sources = sources;
        this.colors = colors;
        this.generator = generator;
        this.validateOut = validateOut;
    }

    /**
     * Runs all profiles.
     *
     * @param profiles profiles in run order
     * @return counts of generated, skipped and validated plots
     * @throws PlotException        the first generation failure
     * @throws IOException          if a definition directory cannot be listed or an artifact cannot be written
     * @throws InterruptedException if the calling thread is interrupted while waiting for workers
     */
    public Summary run(List<ProcessingProfile> profiles) throws PlotException, IOException, InterruptedException {
        log.info("Plots will be generated for time {}", options.basisTime());
        log.info("Plot output directory: {}", organizer.getBase());
        log.info("Using concurrency {}", options.concurrency());

        for (ProcessingProfile profile : profiles) {
            List<Path> files = definitionFiles(profile);
            if (files.isEmpty()) {
                log.warn("No plot definitions found for '{}'", profile.source());
                continue;
            }
            for (Map<String, Object> variant : profile.variants()) {
                runVariant(files, variant);
            }
        }

        Summary summary = new Summary(generated.get(), skipped.get(), validated.get());
        log.info("Batch finished: {} generated, {} skipped, {} validated",
            summary.generated(), summary.skipped(), summary.validated());
        return summary;
    }

    private void runVariant(List<Path> files, Map<String, Object> variant)
            throws PlotException, IOException, InterruptedException {
        if (!variant.isEmpty()) {
            log.info("Running variant {}", variant);
        }
        CancellationToken cancellation = new CancellationToken();
        ExecutorService pool = Executors.newFixedThreadPool(options.concurrency());
        CompletionService<Void> completion = new ExecutorCompletionService<>(pool);
        try {
            for (Path file : files) {
                Callable<Void> job = () -> {
                    processFile(file, variant, cancellation);
                    return null;
                };
                completion.submit(job);
            }

            Throwable firstFailure = null;
            for (int i = 0; i < files.size(); i++) {
                try {
                    completion.take().get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (firstFailure == null) {
                        firstFailure = cause;
                        cancellation.cancel();
                        log.error("Cancelling remaining plots after failure: {}", cause.getMessage());
                    } else if (!(cause instanceof GenerationCancelledException)) {
                        log.error("Further failure while cancelling: {}", cause.getMessage());
                    }
                }
            }
            rethrow(firstFailure);
        } catch (InterruptedException e) {
            cancellation.cancel();
            pool.shutdownNow();
            throw e;
        } finally {
            pool.shutdown();
        }
    }

    private static void rethrow(Throwable failure) throws PlotException, IOException {
        if (failure == null) {
            return;
        }
        if (failure instanceof PlotException pe) {
            throw pe;
        }
        if (failure instanceof IOException ioe) {
            throw ioe;
        }
        if (failure instanceof RuntimeException re) {
            throw re;
        }
        if (failure instanceof Error err) {
            throw err;
        }
        throw new IllegalStateException("unexpected batch failure", failure);
    }

    /**
     * Reads, templates, parses and, when needed, generates and writes one definition file.
     */
    void processFile(Path file, Map<String, Object> variant, CancellationToken cancellation)
            throws PlotException, IOException {
        String fileName = file.getFileName().toString();
        cancellation.throwIfCancelled(PlotDefinitionParser.plotName(fileName));

        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IOException("failed to read plot definition \"" + fileName + "\": " + e.getMessage(), e);
        }
        String templated;
        try {
            templated = new DefinitionTemplate(options.basisTime(), variant).render(content);
        } catch (PlotConfigurationException e) {
            throw new PlotConfigurationException("failed to execute templates for plot definition \""
                + fileName + "\": " + e.getMessage(), e);
        }
        PlotDefinition definition = parser.parse(fileName, templated);
        String name = definition.name();
        if (definition.frequency() == null) {
            throw new PlotConfigurationException("plot '" + name + "' has no frequency, expected weekly, daily or hourly");
        }

        Path output = organizer.canonicalPath(name, definition.frequency(), options.basisTime());
        log.debug("Plot '{}': output file {}", name, output);

        boolean missingOrStale = false;
        try {
            Instant definitionModified = Files.getLastModifiedTime(file).toInstant();
            missingOrStale = organizer.isStaleOrMissing(name, definition.frequency(), options.basisTime(),
                definitionModified);
        } catch (IOException e) {
            log.error("Plot '{}': failed to determine if plot file needs writing: {}", name, e.getMessage());
        }
        boolean latest = false;
        try {
            latest = organizer.isLatest(name, definition.frequency(), options.basisTime());
        } catch (IOException e) {
            log.error("Plot '{}': failed to determine if plot file is latest: {}", name, e.getMessage());
        }
        log.debug("Plot '{}': missing or stale {}, latest {}", name, missingOrStale, latest);

        if (options.validate()) {
            printValidation(definition, output, missingOrStale, latest);
            validated.incrementAndGet();
            return;
        }

        if (!options.force() && !missingOrStale) {
            log.info("Skipping plot '{}', output already exists", name);
            skipped.incrementAndGet();
            return;
        }

        log.info("Generating plot '{}'", name);
        PlotContext context = new PlotContext(options.basisTime(), sources, variant, colors);
        FigureDocument figure;
        try (ProgressHeartbeat heartbeat = new ProgressHeartbeat(name, options.heartbeatInterval())) {
            figure = generator.generate(definition, context, cancellation);
        } catch (GenerationCancelledException e) {
            throw e;
        } catch (PlotException e) {
            log.debug("Plot '{}' failed", name, e);
            throw rewrap(name, e);
        }

        byte[] data = (figure.toJson(options.compact()) + "\n").getBytes(StandardCharsets.UTF_8);
        log.info("Writing plot '{}' to {}", name, output);
        try {
            organizer.writeArtifact(data, name, definition.frequency(), options.basisTime());
        } catch (IOException e) {
            throw new IOException("failed to write plot '" + name + "': " + e.getMessage(), e);
        }
        generated.incrementAndGet();
    }

    private static PlotException rewrap(String name, PlotException e) {
        String message = "failed to generate plot '" + name + "': " + e.getMessage();
        if (e instanceof PlotConfigurationException) {
            return new PlotConfigurationException(message, e);
        }
        if (e instanceof DataAccessException) {
            return new DataAccessException(message, e);
        }
        return new PlotException(message, e);
    }

    private void printValidation(PlotDefinition definition, Path output, boolean missingOrStale, boolean latest) {
        synchronized (validateOut) {
            validateOut.println("Name: " + definition.name());
            validateOut.println("Frequency: " + definition.frequency());
            validateOut.println("Output: " + output);
            validateOut.println("Is missing or stale: " + missingOrStale);
            validateOut.println("Is latest version: " + latest);
            printDataSets(validateOut, definition.datasets());
            validateOut.flush();
        }
    }

    /**
     * Prints the dataset block shared by batch and single plot validation.
     *
     * @param out      destination
     * @param datasets dataset definitions
     */
    public static void printDataSets(PrintWriter out, List<DataSetDefinition> datasets) {
        out.println("Datasets:");
        for (DataSetDefinition ds : datasets) {
            out.println("  Name: " + ds.name());
            out.println("  Source: " + ds.source());
            out.println("  Query:");
            out.println(indent(ds.query() == null ? "" : ds.query(), "      "));
        }
    }

    private static String indent(String text, String prefix) {
        return prefix + text.replace("\n", "\n" + prefix);
    }

    private List<Path> definitionFiles(ProcessingProfile profile) throws IOException {
        Path source = Path.of(profile.source());
        Path dir;
        String glob;
        if (Files.isDirectory(source)) {
            log.info("Using plot definitions in {}", source);
            dir = source;
            glob = options.matchGlob() != null ? options.matchGlob() : DEFAULT_MATCH;
        } else {
            dir = source.toAbsolutePath().getParent();
            glob = options.matchGlob() != null ? options.matchGlob() : source.getFileName().toString();
        }
        if (dir == null || !Files.isDirectory(dir)) {
            throw new IOException("failed to read input directory: " + source);
        }

        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                .filter(Files::isRegularFile)
                .filter(p -> matcher.matches(p.getFileName()))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new IOException("failed to read input directory " + dir + ": " + e.getMessage(), e);
        }
    }

    /**
     * Collects the files a single path argument stands for, in the same way profiles do.
     *
     * @param sources definition directories or files
     * @return one profile per source, each without variants
     */
    public static List<ProcessingProfile> profilesFor(List<String> sources) {
        List<ProcessingProfile> result = new ArrayList<>();
        for (String s : sources) {
            result.add(ProcessingProfile.of(s));
        }
        return result;
    }
}
