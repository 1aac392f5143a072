package com.traceit.backend.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TraceRequest {
    @NotBlank(message = "userId is required")
    private String userId;

    // http(s) URL or raw text
    @NotBlank(message = "input is required")
    private String input;
}
