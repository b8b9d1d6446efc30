package io.feedpercolator.api;

import io.feedpercolator.api.dto.PipelineRunSummary;
import io.feedpercolator.api.exception.PipelineException;
import io.feedpercolator.api.service.PipelineService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/pipeline")
public class PipelineController {

    private final PipelineService pipelineService;

    public PipelineController(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "service", "Feed Percolator",
                "timestamp", LocalDateTime.now()
        ));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return pipelineService.getLastRun()
                .<ResponseEntity<Map<String, Object>>>map(summary -> ResponseEntity.ok(Map.of(
                        "state", "COMPLETED",
                        "filters", pipelineService.getFilters().size(),
                        "lastRun", summary
                )))
                .orElseGet(() -> ResponseEntity.ok(Map.of(
                        "state", "NEVER_RUN",
                        "filters", pipelineService.getFilters().size()
                )));
    }

    @PostMapping("/run")
    public ResponseEntity<PipelineRunSummary> run() {
        return ResponseEntity.ok(pipelineService.run());
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<Map<String, Object>> handlePipelineFailure(PipelineException e) {
        HttpStatus status = e.getCategory().isSourceError()
                ? HttpStatus.BAD_GATEWAY
                : HttpStatus.INTERNAL_SERVER_ERROR;

        return ResponseEntity.status(status).body(Map.of(
                "status", "FAILED",
                "category", e.getCategory().name(),
                "message", String.valueOf(e.getMessage())
        ));
    }
}
