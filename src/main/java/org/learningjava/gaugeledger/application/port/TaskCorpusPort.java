package org.learningjava.gaugeledger.application.port;

import java.nio.file.Path;
import java.util.List;

public interface TaskCorpusPort {

    /** Every task manifest of the corpus. */
    List<Path> discoverManifests();
}
