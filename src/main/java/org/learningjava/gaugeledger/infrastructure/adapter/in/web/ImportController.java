package org.learningjava.gaugeledger.infrastructure.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.learningjava.gaugeledger.application.usecase.ImportRunsUseCase;
import org.learningjava.gaugeledger.application.usecase.ImportRunsUseCase.ImportReport;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;

@RestController
@RequestMapping("/import")
public class ImportController {
    private final ImportRunsUseCase useCase;

    public ImportController(ImportRunsUseCase useCase) {
        this.useCase = useCase;
    }

    @PostMapping
    public ImportReport importDirectory(@Valid @RequestBody ImportRequest req) {
        return useCase.importDirectory(Path.of(req.rootDir()));
    }

    @PostMapping("/file")
    public FileImportResult importFile(@Valid @RequestBody FileImportRequest req) {
        return new FileImportResult(useCase.importFile(Path.of(req.path())));
    }

    public record ImportRequest(@NotBlank String rootDir) {
    }

    public record FileImportRequest(@NotBlank String path) {
    }

    public record FileImportResult(boolean imported) {
    }
}
