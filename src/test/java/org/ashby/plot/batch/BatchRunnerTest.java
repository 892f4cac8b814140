package org.ashby.plot.batch;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import org.ashby.plot.api.DataAccessException;
import org.ashby.plot.api.GenerationCancelledException;
import org.ashby.plot.api.PlotConfigurationException;
import org.ashby.plot.data.DataSourceRegistry;
import org.ashby.plot.data.StaticDataSet;
import org.ashby.plot.generate.ColorTable;
import org.ashby.plot.generate.FigureGenerator;
import org.ashby.plot.organize.Organizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests batch runs over a directory of definition files.
 */
@Tag("integration")
class BatchRunnerTest {

    private static final Instant BASIS = Instant.parse("2024-02-14T09:30:00Z");

    private static final String POPULATIONS = """
        frequency: daily
        datasets:
          - {name: pop, source: demo, query: populations}
        series:
          - {type: bar, name: "{{ Params.label | toUpper }}", dataset: pop, labels: creature, values: month1}
        """;

    @TempDir
    Path tempDir;

    private Path definitions;
    private Path output;
    private DataSourceRegistry sources;
    private StringWriter validateOut;

    @BeforeEach
    void setUp() throws Exception {
        definitions = Files.createDirectories(tempDir.resolve("defs"));
        output = tempDir.resolve("out");
        sources = new DataSourceRegistry();
        validateOut = new StringWriter();
    }

    @AfterEach
    void tearDown() {
        sources.close();
    }

    private BatchRunner runner(boolean force, boolean validate, String match) {
        return runner(3, force, validate, match);
    }

    private BatchRunner runner(int concurrency, boolean force, boolean validate, String match) {
        BatchRunner.Options options = new BatchRunner.Options(BASIS, concurrency, force, validate, true, match,
            Duration.ofMinutes(1));
        return new BatchRunner(options, new Organizer(output), sources, ColorTable.empty(), new FigureGenerator(),
            new PrintWriter(validateOut, true));
    }

    private Path writeDefinition(String fileName, String content) throws Exception {
        Path file = definitions.resolve(fileName);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        // Definitions older than any output written by the test.
        Files.setLastModifiedTime(file, FileTime.from(Instant.now().minusSeconds(3600)));
        return file;
    }

    private static List<ProcessingProfile> profile(Path dir, Map<String, Object> variant) {
        return List.of(new ProcessingProfile(dir.toString(), List.of(variant)));
    }

    @Test
    void testGeneratesThenSkipsFreshOutput() throws Exception {
        writeDefinition("pop.yaml", POPULATIONS);
        writeDefinition("notes.txt", "not a definition");

        BatchRunner.Summary first = runner(false, false, null).run(profile(definitions, Map.of("label", "monkeys")));

        assertThat(first.generated()).isEqualTo(1);
        Path dated = output.resolve("2024/02/14/pop.json");
        JsonObject json = JsonParser.parseString(Files.readString(dated)).getAsJsonObject();
        assertThat(json.getAsJsonArray("data").get(0).getAsJsonObject().get("name").getAsString()).isEqualTo("MONKEYS");
        assertThat(json.getAsJsonObject("params").get("label").getAsString()).isEqualTo("monkeys");
        assertThat(Files.readString(output.resolve("latest/pop.json"))).isEqualTo(Files.readString(dated));
        assertThat(Files.readString(dated)).endsWith("}\n");

        BatchRunner.Summary second = runner(false, false, null).run(profile(definitions, Map.of("label", "monkeys")));

        assertThat(second.generated()).isZero();
        assertThat(second.skipped()).isEqualTo(1);

        BatchRunner.Summary forced = runner(true, false, null).run(profile(definitions, Map.of("label", "monkeys")));

        assertThat(forced.generated()).isEqualTo(1);
    }

    @Test
    void testMatchGlobRestrictsFiles() throws Exception {
        writeDefinition("a-pop.yaml", POPULATIONS);
        writeDefinition("b-pop.yaml", POPULATIONS);

        BatchRunner.Summary summary = runner(false, false, "b-*.yaml").run(profile(definitions, Map.of("label", "x")));

        assertThat(summary.generated()).isEqualTo(1);
        assertThat(output.resolve("2024/02/14/b-pop.json")).exists();
        assertThat(output.resolve("2024/02/14/a-pop.json")).doesNotExist();
    }

    @Test
    void testSingleFileProfile() throws Exception {
        Path file = writeDefinition("one.yaml", POPULATIONS);
        writeDefinition("two.yaml", POPULATIONS);

        BatchRunner.Summary summary = runner(false, false, null).run(profile(file, Map.of("label", "x")));

        assertThat(summary.generated()).isEqualTo(1);
        assertThat(output.resolve("2024/02/14/one.json")).exists();
        assertThat(output.resolve("2024/02/14/two.json")).doesNotExist();
    }

    @Test
    void testValidatePrintsWithoutWriting() throws Exception {
        writeDefinition("pop.yaml", POPULATIONS);

        BatchRunner.Summary summary = runner(false, true, null).run(profile(definitions, Map.of("label", "x")));

        assertThat(summary.validated()).isEqualTo(1);
        assertThat(output).doesNotExist();
        assertThat(validateOut.toString())
            .contains("Name: pop")
            .contains("Frequency: daily")
            .contains("Is missing or stale: true")
            .contains("Is latest version: true")
            .contains("Source: demo")
            .contains("populations");
    }

    @Test
    void testVariantsRunSequentially() throws Exception {
        writeDefinition("pop.yaml", """
            name: "pop-{{ Params.region }}"
            frequency: hourly
            datasets:
              - {name: pop, source: demo, query: populations}
            """);
        ProcessingProfile profile = new ProcessingProfile(definitions.toString(),
            List.of(Map.of("region", "north"), Map.of("region", "south")));

        BatchRunner.Summary summary = runner(false, false, null).run(List.of(profile));

        assertThat(summary.generated()).isEqualTo(2);
        assertThat(output.resolve("2024/02/14/09/pop-north.json")).exists();
        assertThat(output.resolve("2024/02/14/09/pop-south.json")).exists();
    }

    @Test
    void testFailureIsReportedWithPlotName() throws Exception {
        writeDefinition("broken.yaml", """
            frequency: daily
            datasets:
              - {name: pop, source: demo, query: weather}
            """);

        assertThatThrownBy(() -> runner(false, false, null).run(profile(definitions, Map.of())))
            .isInstanceOf(DataAccessException.class)
            .hasMessageContaining("broken")
            .hasMessageContaining("weather");
    }

    @Test
    void testFirstFailureCancelsRunningPlots() throws Exception {
        CountDownLatch slowStarted = new CountDownLatch(3);
        CountDownLatch failed = new CountDownLatch(1);
        sources.register("gate", (query, params) -> {
            slowStarted.countDown();
            await(failed);
            try {
                // Gives the batch time to cancel before the next checkpoint.
                Thread.sleep(500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DataAccessException("interrupted", e);
            }
            return StaticDataSet.builder().column("k", "a").build();
        });
        sources.register("failing", (query, params) -> {
            await(slowStarted);
            failed.countDown();
            throw new DataAccessException("database is down");
        });

        writeDefinition("broken.yaml", """
            frequency: daily
            datasets:
              - {name: x, source: failing, query: q}
            """);
        for (int i = 1; i <= 3; i++) {
            writeDefinition("slow-" + i + ".yaml", """
                frequency: daily
                datasets:
                  - {name: first, source: gate, query: q}
                  - {name: second, source: demo, query: populations}
                """);
        }

        assertThatThrownBy(() -> runner(4, false, false, null).run(profile(definitions, Map.of())))
            .isInstanceOf(DataAccessException.class)
            .isNotInstanceOf(GenerationCancelledException.class)
            .hasMessageContaining("broken")
            .hasMessageContaining("database is down");

        if (Files.exists(output)) {
            try (Stream<Path> written = Files.walk(output)) {
                assertThat(written.filter(Files::isRegularFile)).isEmpty();
            }
        }
    }

    private static void await(CountDownLatch latch) throws DataAccessException {
        try {
            if (!latch.await(10, TimeUnit.SECONDS)) {
                throw new DataAccessException("timed out waiting for the other plots");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataAccessException("interrupted", e);
        }
    }

    @Test
    void testMissingFrequency_isConfigurationError() throws Exception {
        writeDefinition("nofreq.yaml", "datasets: []\n");

        assertThatThrownBy(() -> runner(false, false, null).run(profile(definitions, Map.of())))
            .isInstanceOf(PlotConfigurationException.class)
            .hasMessageContaining("frequency");
    }

    @Test
    void testTemplateErrorNamesFile() throws Exception {
        writeDefinition("tpl.yaml", "name: \"{{ Params.missing }}\"\nfrequency: daily\n");

        assertThatThrownBy(() -> runner(false, false, null).run(profile(definitions, Map.of())))
            .isInstanceOf(PlotConfigurationException.class)
            .hasMessageContaining("tpl.yaml");
    }

    @Test
    void testOptionsValidation() {
        assertThatThrownBy(() -> new BatchRunner.Options(BASIS, 0, false, false, false, null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(new BatchRunner.Options(BASIS, 8, false, true, false, null, null).concurrency()).isEqualTo(1);
    }
}
