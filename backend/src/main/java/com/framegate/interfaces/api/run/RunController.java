package com.framegate.interfaces.api.run;

import com.framegate.application.run.RunAppService;
import com.framegate.domain.frame.model.RunState;
import com.framegate.infrastructure.pipeline.DiagnosticReport;
import com.framegate.interfaces.api.dto.ReleaseRequest;
import com.framegate.interfaces.api.dto.RunStartedResponse;
import com.framegate.interfaces.api.dto.RunStatusResponse;
import com.framegate.interfaces.api.dto.StartRunRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/runs")
@RequiredArgsConstructor
public class RunController {

    private final RunAppService runAppService;

    @PostMapping
    public ResponseEntity<RunStartedResponse> start(@Valid @RequestBody StartRunRequest request) {
        String runId = runAppService.start(request.toManifest(), request.overrideFingerprint());
        return ResponseEntity.accepted()
                .body(new RunStartedResponse(runId, "/api/v1/runs/" + runId));
    }

    @GetMapping("/{runId}")
    public ResponseEntity<RunStatusResponse> status(@PathVariable String runId) {
        RunState state = runAppService.status(runId);
        return ResponseEntity.ok(RunStatusResponse.from(state, runAppService.isActive(runId)));
    }

    @PostMapping("/{runId}/cancel")
    public ResponseEntity<Void> cancel(@PathVariable String runId) {
        runAppService.cancel(runId);
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/{runId}/diagnostic")
    public ResponseEntity<DiagnosticReport> diagnostic(@PathVariable String runId) {
        return ResponseEntity.ok(runAppService.diagnostic(runId));
    }

    @PostMapping("/{runId}/release")
    public ResponseEntity<RunStatusResponse> release(@PathVariable String runId,
                                                     @RequestBody(required = false) ReleaseRequest request) {
        boolean override = request != null && request.override();
        RunState state = runAppService.release(runId, override);
        return ResponseEntity.ok(RunStatusResponse.from(state, false));
    }
}
