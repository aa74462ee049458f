package com.edustream.studio.repository;

import com.edustream.studio.model.ScheduleRecord;
import com.edustream.studio.model.ScheduleStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ScheduleRecordRepository extends JpaRepository<ScheduleRecord, Long> {

    @Query("SELECT MAX(s.scheduledAt) FROM ScheduleRecord s WHERE s.status = :status")
    LocalDateTime findLatestScheduledAt(@Param("status") ScheduleStatus status);

    Optional<ScheduleRecord> findFirstByContentIdAndStatusOrderByCreatedAtDesc(Long contentId, ScheduleStatus status);

    boolean existsByContentIdAndStatus(Long contentId, ScheduleStatus status);

    List<ScheduleRecord> findByStatusOrderByScheduledAtAsc(ScheduleStatus status);

    List<ScheduleRecord> findByContentIdOrderByCreatedAtDesc(Long contentId);
}
