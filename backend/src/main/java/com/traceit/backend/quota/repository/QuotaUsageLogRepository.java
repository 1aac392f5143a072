package com.traceit.backend.quota.repository;

import com.traceit.backend.quota.entity.QuotaUsageLog;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface QuotaUsageLogRepository extends JpaRepository<QuotaUsageLog, Long> {

    @Query("SELECT COUNT(q) FROM QuotaUsageLog q WHERE q.userId = :userId AND q.granted = :granted AND q.usedAt >= :since")
    Long countByUserSince(@Param("userId") String userId, @Param("granted") Boolean granted, @Param("since") Instant since);

    List<QuotaUsageLog> findTop20ByUserIdOrderByUsedAtDesc(String userId);
}
