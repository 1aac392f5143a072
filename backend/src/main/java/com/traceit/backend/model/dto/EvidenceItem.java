package com.traceit.backend.model.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class EvidenceItem {
    String url;
    String title;
    String snippet;
}
