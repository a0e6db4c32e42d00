package org.learningjava.gaugeledger.application.usecase;

import org.junit.jupiter.api.Test;
import org.learningjava.gaugeledger.application.port.TaskCorpusPort;
import org.learningjava.gaugeledger.domain.model.fingerprint.TaskSetHash;
import org.learningjava.gaugeledger.domain.service.hashing.TaskSetFingerprinter;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class FingerprintTaskSetUseCaseTest {

    @Test
    void fingerprint_hashesWhatTheCorpusReports() {
        TaskCorpusPort corpus = mock(TaskCorpusPort.class);
        TaskSetFingerprinter fingerprinter = mock(TaskSetFingerprinter.class);
        List<Path> manifests = List.of(Path.of("tasks/easy/CG-AL-E001-a.yml"));
        TaskSetHash expected = new TaskSetHash("0123456789abcdef", TaskSetHash.MISSING, Instant.EPOCH, 1, 1,
                List.of(), List.of("tests/al/app.json"), List.of("Project descriptor not found: tests/al/app.json"));
        when(corpus.discoverManifests()).thenReturn(manifests);
        when(fingerprinter.fingerprint(manifests)).thenReturn(expected);

        TaskSetHash actual = new FingerprintTaskSetUseCase(corpus, fingerprinter).fingerprint();

        assertSame(expected, actual);
        verify(corpus).discoverManifests();
        verify(fingerprinter).fingerprint(manifests);
        verifyNoMoreInteractions(corpus, fingerprinter);
    }
}
