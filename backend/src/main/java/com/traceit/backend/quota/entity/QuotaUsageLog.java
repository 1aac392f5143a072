package com.traceit.backend.quota.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "quota_usage_log", indexes = @Index(name = "idx_quota_usage_user_time", columnList = "userId, usedAt"))
public class QuotaUsageLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false)
    private Boolean granted;

    // Remaining budget after the decision
    @Column(nullable = false)
    private Integer remaining;

    @Column(nullable = false)
    private Instant usedAt;
}
