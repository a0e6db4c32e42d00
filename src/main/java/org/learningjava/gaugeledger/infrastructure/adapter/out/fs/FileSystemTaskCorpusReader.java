package org.learningjava.gaugeledger.infrastructure.adapter.out.fs;

import org.learningjava.gaugeledger.application.port.TaskCorpusPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/** Finds task manifests ({@code *.yml}, {@code *.yaml}) anywhere below the tasks directory. */
public class FileSystemTaskCorpusReader implements TaskCorpusPort {

    private static final Logger log = LoggerFactory.getLogger(FileSystemTaskCorpusReader.class);

    private final Path tasksDir;

    public FileSystemTaskCorpusReader(Path tasksDir) {
        this.tasksDir = tasksDir;
    }

    @Override
    public List<Path> discoverManifests() {
        if (!Files.isDirectory(tasksDir)) {
            log.warn("Tasks directory not found: {}", tasksDir);
            return List.of();
        }
        try (Stream<Path> s = Files.walk(tasksDir)) {
            List<Path> manifests = s.filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(".yml") || name.endsWith(".yaml");
                    })
                    .sorted()
                    .toList();
            log.debug("Discovered {} task manifests under {}", manifests.size(), tasksDir);
            return manifests;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan " + tasksDir, e);
        }
    }
}
