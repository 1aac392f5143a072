package com.traceit.backend.extraction.controller;

import com.traceit.backend.extraction.ExtractorRouter;
import com.traceit.backend.model.dto.ExtractRequest;
import com.traceit.backend.model.dto.ExtractedContent;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ingest preview: runs the extractor chain only, no quota and no claims
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ExtractionController {

    private final ExtractorRouter extractorRouter;

    @PostMapping("/extract")
    public ResponseEntity<ExtractedContent> extract(@Valid @RequestBody ExtractRequest request) {
        log.info("📥 Received extraction request for {}", request.getUrl());
        return ResponseEntity.ok(extractorRouter.route(request.getUrl().trim()));
    }
}
