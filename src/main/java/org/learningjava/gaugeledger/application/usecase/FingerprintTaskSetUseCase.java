package org.learningjava.gaugeledger.application.usecase;

import org.learningjava.gaugeledger.application.port.TaskCorpusPort;
import org.learningjava.gaugeledger.domain.model.fingerprint.TaskSetHash;
import org.learningjava.gaugeledger.domain.service.hashing.TaskSetFingerprinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class FingerprintTaskSetUseCase {

    private static final Logger log = LoggerFactory.getLogger(FingerprintTaskSetUseCase.class);

    private final TaskCorpusPort corpus;
    private final TaskSetFingerprinter fingerprinter;

    public FingerprintTaskSetUseCase(TaskCorpusPort corpus, TaskSetFingerprinter fingerprinter) {
        this.corpus = corpus;
        this.fingerprinter = fingerprinter;
    }

    /** Fingerprint of the configured corpus as it is on disk right now. */
    public TaskSetHash fingerprint() {
        TaskSetHash hash = fingerprinter.fingerprint(corpus.discoverManifests());
        for (String w : hash.warnings()) {
            log.warn("Task set fingerprint: {}", w);
        }
        return hash;
    }
}
