package com.traceit.backend.quota.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.traceit.backend.exception.GlobalExceptionHandler;
import com.traceit.backend.model.dto.QuotaState;
import com.traceit.backend.quota.service.QuotaGuard;
import com.traceit.backend.quota.service.QuotaUsageMonitoringService;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class QuotaControllerTest {

    private static final Instant RESET_AT = Instant.parse("2024-06-02T00:00:00Z");

    @Mock
    private QuotaGuard quotaGuard;

    @Mock
    private QuotaUsageMonitoringService monitoringService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new QuotaController(quotaGuard, monitoringService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET returns the current quota state")
    void getQuota() throws Exception {
        when(quotaGuard.status("alice")).thenReturn(QuotaState.builder().remaining(3).limit(10).windowResetAt(RESET_AT).build());

        mockMvc.perform(get("/api/quota/alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.remaining").value(3))
                .andExpect(jsonPath("$.limit").value(10));
    }

    @Test
    @DisplayName("POST reset restores the budget")
    void resetQuota() throws Exception {
        when(quotaGuard.reset("alice")).thenReturn(QuotaState.builder().remaining(10).limit(10).windowResetAt(RESET_AT).build());

        mockMvc.perform(post("/api/quota/alice/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.remaining").value(10));
    }

    @Test
    @DisplayName("GET usage returns the monitoring statistics")
    void usage() throws Exception {
        when(monitoringService.getUsageStats("alice")).thenReturn(Map.of(
                "userId", "alice",
                "daily", Map.of("granted", 4L, "denied", 1L)));

        mockMvc.perform(get("/api/quota/alice/usage"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.daily.granted").value(4))
                .andExpect(jsonPath("$.daily.denied").value(1));
    }
}
