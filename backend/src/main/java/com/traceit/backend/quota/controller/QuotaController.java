package com.traceit.backend.quota.controller;

import com.traceit.backend.model.dto.QuotaState;
import com.traceit.backend.quota.service.QuotaGuard;
import com.traceit.backend.quota.service.QuotaUsageMonitoringService;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/quota")
@RequiredArgsConstructor
public class QuotaController {

    private final QuotaGuard quotaGuard;
    private final QuotaUsageMonitoringService monitoringService;

    @GetMapping("/{userId}")
    public ResponseEntity<QuotaState> getQuota(@PathVariable String userId) {
        return ResponseEntity.ok(quotaGuard.status(userId));
    }

    @GetMapping("/{userId}/usage")
    public ResponseEntity<Map<String, Object>> getUsage(@PathVariable String userId) {
        return ResponseEntity.ok(monitoringService.getUsageStats(userId));
    }

    @PostMapping("/{userId}/reset")
    public ResponseEntity<QuotaState> resetQuota(@PathVariable String userId) {
        log.info("📥 Quota reset requested for user {}", userId);
        return ResponseEntity.ok(quotaGuard.reset(userId));
    }
}
