package org.learningjava.gaugeledger.infrastructure.adapter.in.web;

import org.learningjava.gaugeledger.application.usecase.FingerprintTaskSetUseCase;
import org.learningjava.gaugeledger.domain.model.fingerprint.TaskSetHash;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/fingerprint")
public class FingerprintController {
    private final FingerprintTaskSetUseCase useCase;

    public FingerprintController(FingerprintTaskSetUseCase useCase) {
        this.useCase = useCase;
    }

    @GetMapping("/task-set")
    public TaskSetHash taskSet() {
        return useCase.fingerprint();
    }
}
