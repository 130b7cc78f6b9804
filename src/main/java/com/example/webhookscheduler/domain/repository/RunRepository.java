package com.example.webhookscheduler.domain.repository;

import com.example.webhookscheduler.domain.entity.Run;
import com.example.webhookscheduler.domain.enums.RunStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Run ledger: append-only history of execution attempts.
 */
@Repository
public interface RunRepository extends JpaRepository<Run, UUID> {

    /**
     * Load a run with a row lock so concurrent outcome reports for it are applied one at a time
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Run r WHERE r.id = :runId")
    Optional<Run> findByIdForUpdate(@Param("runId") UUID runId);

    Page<Run> findByScheduleIdOrderByRunAtDescAttemptDesc(UUID scheduleId, Pageable pageable);

    /**
     * All attempts of one occurrence in attempt order
     */
    List<Run> findByScheduleIdAndRunAtOrderByAttemptAsc(UUID scheduleId, Instant runAt);

    Page<Run> findByTenantIdAndStatusOrderByFinishedAtDesc(String tenantId, RunStatus status, Pageable pageable);

    /**
     * Runs claimed by a worker that never reported back
     */
    @Query("""
            SELECT r FROM Run r
            WHERE r.status = :status
              AND r.startedAt < :threshold
            ORDER BY r.startedAt ASC
            """)
    List<Run> findStartedBefore(@Param("status") RunStatus status, @Param("threshold") Instant threshold, Pageable pageable);

    /**
     * Runs that were due for delivery long ago but never claimed
     */
    @Query("""
            SELECT r FROM Run r
            WHERE r.status = :status
              AND r.scheduledFor < :threshold
            ORDER BY r.scheduledFor ASC
            """)
    List<Run> findScheduledBefore(@Param("status") RunStatus status, @Param("threshold") Instant threshold, Pageable pageable);

    long countByStatus(RunStatus status);

    long countByScheduleId(UUID scheduleId);

    /**
     * Run counts grouped by status
     */
    @Query("""
            SELECT r.status as status, COUNT(r) as count
            FROM Run r
            GROUP BY r.status
            """)
    List<Object[]> getRunStatsByStatus();
}
