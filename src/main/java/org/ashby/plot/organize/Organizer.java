package org.ashby.plot.organize;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.ashby.plot.definition.PlotFrequency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places generated artifacts into a dated directory hierarchy under a base directory.
 * <p>
 * A daily plot called {@code demo} generated for 2023-05-08 is written to
 * {@code base/2023/05/08/demo.json}; an hourly one to {@code base/2023/05/08/10/demo.json}.
 * When the artifact is the most recent dated version of its name, the same bytes are also copied
 * to {@code base/latest/demo.json}.
 * <p>
 * Paths are recomputed on every call; the file tree and its modification times are the only
 * state. The dated write and the latest copy are separate steps: a failure between them leaves a
 * stale latest copy that the next successful run replaces.
 */
public class Organizer {

    private static final Logger log = LoggerFactory.getLogger(Organizer.class);

    public static final String LATEST_DIRECTORY = "latest";
    private static final String EXTENSION = ".json";

    private final Path base;

    public Organizer(Path base) {
        this.base = base.toAbsolutePath().normalize();
    }

    /**
     * Returns the dated path of an artifact.
     *
     * @param name      artifact name
     * @param frequency frequency class of the plot
     * @param basisTime basis time of the run
     * @return {@code base/yyyy/MM/dd[/HH]/name.json}
     */
    public Path canonicalPath(String name, PlotFrequency frequency, Instant basisTime) {
        return base.resolve(frequency.datedDirectory(basisTime)).resolve(name + EXTENSION);
    }

    public Path latestPath(String name) {
        return base.resolve(LATEST_DIRECTORY).resolve(name + EXTENSION);
    }

    /**
     * Checks whether the dated artifact has to be (re)generated.
     *
     * @param name              artifact name
     * @param frequency         frequency class of the plot
     * @param basisTime         basis time of the run
     * @param expectedFreshness the artifact must not be older than this, usually the definition
     *                          file's modification time
     * @return true if the artifact is missing or was modified strictly before {@code expectedFreshness}
     * @throws IOException if the artifact exists but cannot be inspected
     */
    public boolean isStaleOrMissing(String name, PlotFrequency frequency, Instant basisTime, Instant expectedFreshness)
            throws IOException {
        Path path = canonicalPath(name, frequency, basisTime);
        FileTime modified;
        try {
            modified = Files.getLastModifiedTime(path, LinkOption.NOFOLLOW_LINKS);
        } catch (NoSuchFileException e) {
            return true;
        }
        return modified.toInstant().isBefore(expectedFreshness);
    }

    /**
     * Checks whether the artifact for this basis time is the most recent dated version of its name.
     * <p>
     * All existing dated artifacts of the name are listed together with the candidate and sorted by
     * path; the zero-padded date components make that order chronological.
     *
     * @param name      artifact name
     * @param frequency frequency class of the plot
     * @param basisTime basis time of the run
     * @return true if the candidate sorts last
     * @throws IOException if the base directory cannot be listed
     */
    public boolean isLatest(String name, PlotFrequency frequency, Instant basisTime) throws IOException {
        String candidate = relative(canonicalPath(name, frequency, basisTime));
        List<String> paths = new ArrayList<>(existingDatedPaths(name, frequency));
        paths.add(candidate);
        Collections.sort(paths);
        return paths.get(paths.size() - 1).equals(candidate);
    }

    /**
     * Writes an artifact to its dated path and, if it is the latest version, copies it to the
     * latest path.
     *
     * @param data      the serialized artifact
     * @param name      artifact name
     * @param frequency frequency class of the plot
     * @param basisTime basis time of the run
     * @throws IOException if either write fails
     */
    public void writeArtifact(byte[] data, String name, PlotFrequency frequency, Instant basisTime) throws IOException {
        Path dated = canonicalPath(name, frequency, basisTime);
        writeAtomically(dated, data);
        log.debug("Wrote '{}'", dated);

        if (!isLatest(name, frequency, basisTime)) {
            log.debug("Artifact '{}' is not the latest version, leaving '{}' untouched", dated, latestPath(name));
            return;
        }
        Path latest = latestPath(name);
        writeAtomically(latest, data);
        log.debug("Updated latest copy '{}'", latest);
    }

    private List<String> existingDatedPaths(String name, PlotFrequency frequency) throws IOException {
        if (!Files.isDirectory(base)) {
            return List.of();
        }
        // Only the date directories are globbed; the name is compared literally.
        StringBuilder pattern = new StringBuilder("20[0-9][0-9]");
        for (int i = 1; i < frequency.getDirectoryDepth(); i++) {
            pattern.append("/[0-9][0-9]");
        }
        PathMatcher datedDirectory = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        String fileName = name + EXTENSION;

        try (Stream<Path> files = Files.walk(base, frequency.getDirectoryDepth() + 1)) {
            return files
                .filter(p -> p.getFileName() != null && p.getFileName().toString().equals(fileName))
                .filter(Files::isRegularFile)
                .map(base::relativize)
                .filter(p -> p.getParent() != null && datedDirectory.matches(p.getParent()))
                .map(Organizer::toSlashPath)
                .collect(Collectors.toList());
        }
    }

    private String relative(Path path) {
        return toSlashPath(base.relativize(path));
    }

    private static String toSlashPath(Path relativePath) {
        return relativePath.toString().replace('\\', '/');
    }

    private static void writeAtomically(Path target, byte[] data) throws IOException {
        Path parent = target.getParent();
        Files.createDirectories(parent);
        Path temp = parent.resolve(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.write(temp, data);
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after move failure: {}", temp, cleanupEx);
            }
            throw e;
        }
    }

    public Path getBase() {
        return base;
    }
}
