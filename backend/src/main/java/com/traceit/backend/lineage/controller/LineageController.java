package com.traceit.backend.lineage.controller;

import com.traceit.backend.config.TraceitProperties;
import com.traceit.backend.exception.PipelineCancelledException;
import com.traceit.backend.lineage.repository.LineageRepository;
import com.traceit.backend.lineage.service.LineagePipelineService;
import com.traceit.backend.model.dto.LineageRecord;
import com.traceit.backend.model.dto.LineageResponse;
import com.traceit.backend.model.dto.LineageResponse.ClaimView;
import com.traceit.backend.model.dto.LineageResponse.PrimaryClaimView;
import com.traceit.backend.model.dto.TraceRequest;
import jakarta.validation.Valid;
import java.util.List;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

@Slf4j
@RestController
@RequestMapping("/api/lineage")
public class LineageController {

    private final LineagePipelineService pipelineService;
    private final LineageRepository lineageRepository;
    private final AsyncTaskExecutor pipelineTaskExecutor;
    private final long timeoutMillis;

    public LineageController(LineagePipelineService pipelineService,
                             LineageRepository lineageRepository,
                             @Qualifier("pipelineTaskExecutor") AsyncTaskExecutor pipelineTaskExecutor,
                             TraceitProperties properties) {
        this.pipelineService = pipelineService;
        this.lineageRepository = lineageRepository;
        this.pipelineTaskExecutor = pipelineTaskExecutor;
        this.timeoutMillis = properties.getPipeline().getTimeoutSeconds() * 1000L;
    }

    /**
     * Run the full pipeline for a URL or raw text. A timeout or dropped connection interrupts the run.
     */
    @PostMapping("/trace")
    public DeferredResult<ResponseEntity<LineageResponse>> trace(@Valid @RequestBody TraceRequest request) {
        log.info("📥 Received trace request from user {}", request.getUserId());

        DeferredResult<ResponseEntity<LineageResponse>> result = new DeferredResult<>(timeoutMillis);
        Future<?> run = pipelineTaskExecutor.submit(() -> {
            try {
                LineageRecord record = pipelineService.runPipeline(request.getUserId(), request.getInput());
                result.setResult(ResponseEntity.ok(LineageResponse.from(record)));
            } catch (Exception e) {
                result.setErrorResult(e);
            }
        });

        result.onTimeout(() -> {
            log.warn("⚠️ Trace request for user {} timed out, cancelling run", request.getUserId());
            run.cancel(true);
            result.setErrorResult(new PipelineCancelledException("Run timed out"));
        });
        result.onError(error -> {
            log.warn("⚠️ Trace request for user {} aborted: {}", request.getUserId(), error.getMessage());
            run.cancel(true);
        });
        return result;
    }

    @GetMapping("/{primaryId}")
    public ResponseEntity<PrimaryClaimView> getClaim(@PathVariable String primaryId) {
        return lineageRepository.getClaim(primaryId)
                .map(PrimaryClaimView::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{primaryId}/secondaries")
    public ResponseEntity<List<ClaimView>> getSecondaryClaims(@PathVariable String primaryId) {
        List<ClaimView> claims = lineageRepository.getSecondaryClaims(primaryId).stream()
                .map(ClaimView::from)
                .toList();
        return ResponseEntity.ok(claims);
    }
}
