package com.example.webhookscheduler.domain.repository;

import com.example.webhookscheduler.domain.entity.Schedule;
import com.example.webhookscheduler.domain.enums.ScheduleStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for Schedule entity.
 * <p>
 * Due detection relies on the (status, next_run_at) index. The lock columns are only
 * written when the database lock backend is active.
 */
@Repository
public interface ScheduleRepository extends JpaRepository<Schedule, UUID> {

    List<Schedule> findByStatusAndNextRunAtLessThanEqualOrderByNextRunAtAsc(ScheduleStatus status, Instant now, Pageable pageable);

    /**
     * Active schedules whose next_run_at has passed, oldest first
     */
    default List<Schedule> findDueSchedules(Instant now, int limit) {
        return findByStatusAndNextRunAtLessThanEqualOrderByNextRunAtAsc(ScheduleStatus.ACTIVE, now, PageRequest.of(0, limit));
    }

    /**
     * Claim the fallback lock of a schedule.
     * Never blocks: returns 0 when another instance holds an unexpired lock.
     */
    @Modifying
    @Query("""
            UPDATE Schedule s
            SET s.lockedBy = :instanceId,
                s.lockedUntil = :lockUntil
            WHERE s.id = :scheduleId
              AND (s.lockedBy IS NULL OR s.lockedUntil < :now)
            """)
    int acquireLock(
            @Param("scheduleId") UUID scheduleId,
            @Param("instanceId") String instanceId,
            @Param("lockUntil") Instant lockUntil,
            @Param("now") Instant now);

    /**
     * Clear the fallback lock, only if this instance still owns it
     */
    @Modifying
    @Query("""
            UPDATE Schedule s
            SET s.lockedBy = NULL,
                s.lockedUntil = NULL
            WHERE s.id = :scheduleId
              AND s.lockedBy = :instanceId
            """)
    int releaseLock(@Param("scheduleId") UUID scheduleId, @Param("instanceId") String instanceId);

    Page<Schedule> findByTenantIdAndStatusNot(String tenantId, ScheduleStatus status, Pageable pageable);

    Page<Schedule> findByTenantIdAndStatus(String tenantId, ScheduleStatus status, Pageable pageable);

    long countByStatus(ScheduleStatus status);
}
