package org.learningjava.gaugeledger.infrastructure.adapter.in.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.gaugeledger.application.port.StorageConflictException;
import org.learningjava.gaugeledger.application.usecase.FingerprintTaskSetUseCase;
import org.learningjava.gaugeledger.application.usecase.ImportRunsUseCase;
import org.learningjava.gaugeledger.application.usecase.ImportRunsUseCase.ImportError;
import org.learningjava.gaugeledger.application.usecase.ImportRunsUseCase.ImportReport;
import org.learningjava.gaugeledger.domain.error.MalformedExportException;
import org.learningjava.gaugeledger.domain.model.fingerprint.TaskSetHash;
import org.mockito.Mockito;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class ImportControllerTest {

    private ImportRunsUseCase importer;
    private FingerprintTaskSetUseCase fingerprints;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        importer = Mockito.mock(ImportRunsUseCase.class);
        fingerprints = Mockito.mock(FingerprintTaskSetUseCase.class);

        ObjectMapper om = new ObjectMapper();
        om.registerModule(new JavaTimeModule());
        om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        mvc = MockMvcBuilders
                .standaloneSetup(new ImportController(importer), new FingerprintController(fingerprints))
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(om))
                .build();
    }

    @Test
    void importDirectory_returnsReport() throws Exception {
        when(importer.importDirectory(Path.of("results"))).thenReturn(new ImportReport(2, 1,
                List.of(new ImportError("results/benchmark-results-3.json", "Invalid JSON"))));

        mvc.perform(post("/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rootDir\":\"results\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.imported", is(2)))
                .andExpect(jsonPath("$.skipped", is(1)))
                .andExpect(jsonPath("$.errors", hasSize(1)))
                .andExpect(jsonPath("$.errors[0].error", is("Invalid JSON")));

        verify(importer).importDirectory(Path.of("results"));
    }

    @Test
    void importDirectory_blankRoot_is400() throws Exception {
        mvc.perform(post("/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rootDir\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", startsWith("rootDir")));

        verifyNoInteractions(importer);
    }

    @Test
    void importDirectory_missingDirectory_is400() throws Exception {
        when(importer.importDirectory(any())).thenThrow(new UncheckedIOException("Results directory not found: x",
                new NoSuchFileException("x")));

        mvc.perform(post("/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rootDir\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("not found")));
    }

    @Test
    void importFile_reportsWhetherStored() throws Exception {
        when(importer.importFile(Path.of("results/benchmark-results-1.json"))).thenReturn(false);

        mvc.perform(post("/import/file")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"results/benchmark-results-1.json\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.imported", is(false)));
    }

    @Test
    void importFile_malformedExport_is400() throws Exception {
        when(importer.importFile(any())).thenThrow(new MalformedExportException("bad.json has no results array"));

        mvc.perform(post("/import/file")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"bad.json\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("bad.json has no results array")));
    }

    @Test
    void importFile_conflict_is409() throws Exception {
        when(importer.importFile(any())).thenThrow(StorageConflictException.duplicateRun("1"));

        mvc.perform(post("/import/file")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"benchmark-results-1.json\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void fingerprint_returnsTaskSetHash() throws Exception {
        when(fingerprints.fingerprint()).thenReturn(new TaskSetHash("0123456789abcdef", TaskSetHash.MISSING,
                Instant.parse("2025-10-19T08:00:00Z"), 0, 0, List.of(), List.of("tests/al/app.json"),
                List.of("Project descriptor not found: tests/al/app.json")));

        mvc.perform(get("/fingerprint/task-set"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hash", is("0123456789abcdef")))
                .andExpect(jsonPath("$.computedAt", is("2025-10-19T08:00:00Z")))
                .andExpect(jsonPath("$.warnings", hasSize(1)));
    }
}
