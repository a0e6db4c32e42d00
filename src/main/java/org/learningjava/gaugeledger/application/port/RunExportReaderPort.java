package org.learningjava.gaugeledger.application.port;

import org.learningjava.gaugeledger.domain.model.run.RunExport;

import java.nio.file.Path;
import java.util.List;

public interface RunExportReaderPort {

    /** Run id a file would be imported under, derived from its name only. */
    String runIdFor(Path file);

    /** Export files directly inside {@code dir}, oldest first. */
    List<Path> discoverExports(Path dir);

    /** @throws org.learningjava.gaugeledger.domain.error.MalformedExportException if the content cannot be interpreted */
    RunExport read(Path file, String runId);
}
