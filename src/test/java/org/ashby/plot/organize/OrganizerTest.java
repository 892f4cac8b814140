package org.ashby.plot.organize;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.stream.Stream;

import org.ashby.plot.definition.PlotFrequency;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the dated output tree: path layout, staleness and latest-copy handling.
 */
@Tag("unit")
class OrganizerTest {

    private static final Instant MAY_8_10H = Instant.parse("2023-05-08T10:17:00Z");
    private static final Instant MAY_9_10H = Instant.parse("2023-05-09T10:17:00Z");

    @TempDir
    Path tempDir;

    private Organizer organizer;

    @BeforeEach
    void setUp() {
        organizer = new Organizer(tempDir);
    }

    @Test
    void testCanonicalPathLayout() {
        assertThat(organizer.canonicalPath("demo", PlotFrequency.DAILY, MAY_8_10H))
            .isEqualTo(tempDir.resolve("2023/05/08/demo.json"));
        assertThat(organizer.canonicalPath("demo", PlotFrequency.WEEKLY, MAY_8_10H))
            .isEqualTo(tempDir.resolve("2023/05/08/demo.json"));
        assertThat(organizer.canonicalPath("demo", PlotFrequency.HOURLY, MAY_8_10H))
            .isEqualTo(tempDir.resolve("2023/05/08/10/demo.json"));
        assertThat(organizer.latestPath("demo")).isEqualTo(tempDir.resolve("latest/demo.json"));
    }

    @Test
    void testWriteCreatesDatedFileAndLatestCopy() throws Exception {
        organizer.writeArtifact(bytes("v1"), "demo", PlotFrequency.DAILY, MAY_8_10H);

        assertThat(read(tempDir.resolve("2023/05/08/demo.json"))).isEqualTo("v1");
        assertThat(read(tempDir.resolve("latest/demo.json"))).isEqualTo("v1");
        try (Stream<Path> leftovers = Files.walk(tempDir)) {
            assertThat(leftovers.filter(p -> p.toString().endsWith(".tmp"))).isEmpty();
        }
    }

    @Test
    void testOlderArtifactDoesNotReplaceLatest() throws Exception {
        organizer.writeArtifact(bytes("new"), "demo", PlotFrequency.DAILY, MAY_9_10H);
        organizer.writeArtifact(bytes("old"), "demo", PlotFrequency.DAILY, MAY_8_10H);

        assertThat(read(tempDir.resolve("2023/05/08/demo.json"))).isEqualTo("old");
        assertThat(read(tempDir.resolve("latest/demo.json"))).isEqualTo("new");
        assertThat(organizer.isLatest("demo", PlotFrequency.DAILY, MAY_8_10H)).isFalse();
        assertThat(organizer.isLatest("demo", PlotFrequency.DAILY, MAY_9_10H)).isTrue();
    }

    @Test
    void testRegeneratingLatestDateUpdatesLatestCopy() throws Exception {
        organizer.writeArtifact(bytes("first"), "demo", PlotFrequency.HOURLY, MAY_8_10H);
        organizer.writeArtifact(bytes("second"), "demo", PlotFrequency.HOURLY, MAY_8_10H);

        assertThat(read(tempDir.resolve("latest/demo.json"))).isEqualTo("second");
    }

    @Test
    void testOtherNamesDoNotAffectLatest() throws Exception {
        organizer.writeArtifact(bytes("x"), "other", PlotFrequency.DAILY, MAY_9_10H);

        assertThat(organizer.isLatest("demo", PlotFrequency.DAILY, MAY_8_10H)).isTrue();
    }

    @Test
    void testGlobCharactersInNameAreMatchedLiterally() throws Exception {
        organizer.writeArtifact(bytes("new"), "latency[p99]", PlotFrequency.DAILY, MAY_9_10H);

        assertThat(organizer.isLatest("latency[p99]", PlotFrequency.DAILY, MAY_8_10H)).isFalse();
        organizer.writeArtifact(bytes("old"), "latency[p99]", PlotFrequency.DAILY, MAY_8_10H);
        assertThat(read(tempDir.resolve("latest/latency[p99].json"))).isEqualTo("new");

        organizer.writeArtifact(bytes("brace"), "a{b", PlotFrequency.HOURLY, MAY_9_10H);
        assertThat(organizer.isLatest("a{b", PlotFrequency.HOURLY, MAY_8_10H)).isFalse();
        assertThat(organizer.isLatest("a{b", PlotFrequency.HOURLY, MAY_9_10H)).isTrue();
    }

    @Test
    void testIsLatestOnMissingBase() throws Exception {
        Organizer fresh = new Organizer(tempDir.resolve("does-not-exist"));

        assertThat(fresh.isLatest("demo", PlotFrequency.DAILY, MAY_8_10H)).isTrue();
    }

    @Test
    void testStaleness() throws Exception {
        Instant definitionModified = Instant.parse("2023-05-08T12:00:00Z");
        assertThat(organizer.isStaleOrMissing("demo", PlotFrequency.DAILY, MAY_8_10H, definitionModified)).isTrue();

        organizer.writeArtifact(bytes("v1"), "demo", PlotFrequency.DAILY, MAY_8_10H);
        Path dated = organizer.canonicalPath("demo", PlotFrequency.DAILY, MAY_8_10H);

        Files.setLastModifiedTime(dated, FileTime.from(definitionModified.minusSeconds(1)));
        assertThat(organizer.isStaleOrMissing("demo", PlotFrequency.DAILY, MAY_8_10H, definitionModified)).isTrue();

        Files.setLastModifiedTime(dated, FileTime.from(definitionModified));
        assertThat(organizer.isStaleOrMissing("demo", PlotFrequency.DAILY, MAY_8_10H, definitionModified)).isFalse();

        Files.setLastModifiedTime(dated, FileTime.from(definitionModified.plusSeconds(60)));
        assertThat(organizer.isStaleOrMissing("demo", PlotFrequency.DAILY, MAY_8_10H, definitionModified)).isFalse();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String read(Path p) throws Exception {
        return Files.readString(p, StandardCharsets.UTF_8);
    }
}
