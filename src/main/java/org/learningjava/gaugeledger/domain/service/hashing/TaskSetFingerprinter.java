package org.learningjava.gaugeledger.domain.service.hashing;

import org.learningjava.gaugeledger.domain.error.MalformedTaskPathException;
import org.learningjava.gaugeledger.domain.model.fingerprint.Difficulty;
import org.learningjava.gaugeledger.domain.model.fingerprint.HashedFile;
import org.learningjava.gaugeledger.domain.model.fingerprint.TaskContentHash;
import org.learningjava.gaugeledger.domain.model.fingerprint.TaskSetHash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Computes the comparability key of a task corpus: every manifest, every fixture file that belongs
 * to a task by name, and the shared project descriptor.
 * <p>
 * Fixtures of task {@code T} with difficulty {@code d} are the files
 * {@code <projectRoot>/<fixturesDir>/<d>/T*<fixtureExtension>}. The descriptor is
 * {@code <projectRoot>/<fixturesDir>/<descriptorFile>}.
 */
public class TaskSetFingerprinter {

    private static final Logger log = LoggerFactory.getLogger(TaskSetFingerprinter.class);

    public static final String DEFAULT_FIXTURES_DIR = "tests/al";
    public static final String DEFAULT_FIXTURE_EXTENSION = ".al";
    public static final String DEFAULT_DESCRIPTOR_FILE = "app.json";

    private final Path projectRoot;
    private final String fixturesDir;
    private final String fixtureExtension;
    private final String descriptorFile;
    private final TaskPaths taskPaths;
    private final Clock clock;

    public TaskSetFingerprinter(Path projectRoot) {
        this(projectRoot, DEFAULT_FIXTURES_DIR, DEFAULT_FIXTURE_EXTENSION, DEFAULT_DESCRIPTOR_FILE,
                new TaskPaths(), Clock.systemUTC());
    }

    public TaskSetFingerprinter(Path projectRoot,
                                String fixturesDir,
                                String fixtureExtension,
                                String descriptorFile,
                                TaskPaths taskPaths,
                                Clock clock) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        this.fixturesDir = fixturesDir;
        this.fixtureExtension = fixtureExtension == null ? "" : fixtureExtension;
        this.descriptorFile = descriptorFile;
        this.taskPaths = taskPaths;
        this.clock = clock;
    }

    /** Per-task fingerprint together with the warnings raised while computing it. */
    public record TaskHashResult(TaskContentHash task, List<String> warnings) {
        public TaskHashResult {
            warnings = List.copyOf(warnings);
        }
    }

    /**
     * Hashes one task. A missing manifest or a path that breaks the naming convention fails this
     * task only; a task without fixtures is reported as a warning.
     */
    public TaskHashResult hashTask(Path manifestPath) {
        Path manifest = resolve(manifestPath);
        List<String> warnings = new ArrayList<>();

        String taskId = taskPaths.extractTaskId(manifest.toString());
        Difficulty difficulty = taskPaths.extractDifficulty(manifest.toString());

        String manifestHash;
        try {
            manifestHash = ContentHasher.hashManifest(Files.readString(manifest, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read manifest " + manifest, e);
        }

        Path fixtureDir = projectRoot.resolve(fixturesDir).resolve(difficulty.dirName());
        List<HashedFile> fixtures = new ArrayList<>();
        if (Files.isDirectory(fixtureDir)) {
            try (Stream<Path> files = Files.list(fixtureDir)) {
                files.filter(Files::isRegularFile)
                        .filter(p -> isFixtureOf(taskId, p.getFileName().toString()))
                        .forEach(p -> ContentHasher.hashFile(p)
                                .map(h -> h.withPath(relative(p)))
                                .ifPresent(fixtures::add));
            } catch (IOException | UncheckedIOException e) {
                warnings.add("Error scanning fixture files for " + taskId + ": " + e.getMessage());
            }
        }
        fixtures.sort(Comparator.comparing(HashedFile::path));

        if (fixtures.isEmpty()) {
            warnings.add("No fixture files found for " + taskId + " in " + relative(fixtureDir));
        }

        Map<String, Object> combined = new LinkedHashMap<>();
        combined.put("manifest", manifestHash);
        combined.put("fixtureFiles", fixtures.stream()
                .map(f -> Map.<String, Object>of("path", f.path(), "hash", f.hash()))
                .toList());
        String combinedHash = ContentHasher.shortHashCanonical(combined);

        TaskContentHash task = new TaskContentHash(taskId, difficulty, relative(manifest), manifestHash,
                fixtures, combinedHash);
        log.debug("Hashed task {} ({} fixtures) -> {}", taskId, fixtures.size(), combinedHash);
        return new TaskHashResult(task, warnings);
    }

    /**
     * Fingerprints a whole corpus. The result does not depend on the order of {@code manifestPaths};
     * tasks that cannot be hashed are left out and reported in the warnings.
     */
    public TaskSetHash fingerprint(Collection<Path> manifestPaths) {
        List<TaskContentHash> tasks = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> missingFiles = new ArrayList<>();

        Set<Path> unique = new LinkedHashSet<>();
        for (Path p : manifestPaths) {
            unique.add(resolve(p));
        }

        for (Path manifest : unique) {
            try {
                TaskHashResult r = hashTask(manifest);
                tasks.add(r.task());
                warnings.addAll(r.warnings());
            } catch (MalformedTaskPathException e) {
                log.warn("Skipping task manifest {}: {}", manifest, e.getMessage());
                warnings.add("Failed to hash " + relative(manifest) + ": " + e.getMessage());
            } catch (UncheckedIOException e) {
                log.warn("Skipping task manifest {}: {}", manifest, e.getMessage());
                warnings.add("Failed to hash " + relative(manifest) + ": " + e.getMessage());
                if (e.getCause() instanceof NoSuchFileException) {
                    missingFiles.add(relative(manifest));
                }
            }
        }

        Path descriptor = projectRoot.resolve(fixturesDir).resolve(descriptorFile);
        Optional<HashedFile> descriptorHash = ContentHasher.hashFile(descriptor);
        String descriptorValue = descriptorHash.map(HashedFile::hash).orElse(TaskSetHash.MISSING);
        if (descriptorHash.isEmpty()) {
            warnings.add("Project descriptor not found: " + relative(descriptor));
            missingFiles.add(relative(descriptor));
        }

        tasks.sort(Comparator.comparing(TaskContentHash::taskId));

        Map<String, Object> hashData = new LinkedHashMap<>();
        hashData.put("descriptor", descriptorValue);
        hashData.put("tasks", tasks.stream()
                .map(t -> Map.<String, Object>of("id", t.taskId(), "combined", t.combinedHash()))
                .toList());
        String finalHash = ContentHasher.shortHashCanonical(hashData);

        int totalFiles = descriptorHash.isPresent() ? 1 : 0;
        for (TaskContentHash t : tasks) {
            totalFiles += t.fixtureFiles().size() + 1;
        }

        log.info("Task set fingerprint {} over {} tasks ({} files, {} warnings)",
                finalHash, tasks.size(), totalFiles, warnings.size());

        return new TaskSetHash(finalHash, descriptorValue, clock.instant(), tasks.size(), totalFiles,
                tasks, missingFiles, warnings);
    }

    private boolean isFixtureOf(String taskId, String fileName) {
        return fileName.startsWith(taskId) && fileName.endsWith(fixtureExtension);
    }

    private Path resolve(Path p) {
        return (p.isAbsolute() ? p : projectRoot.resolve(p)).toAbsolutePath().normalize();
    }

    private String relative(Path p) {
        Path abs = p.toAbsolutePath().normalize();
        String rel = abs.startsWith(projectRoot) ? projectRoot.relativize(abs).toString() : abs.toString();
        return ContentHasher.normalizePath(rel);
    }
}
