package com.example.timesheet.task;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface TaskEntryRepository extends JpaRepository<TaskEntry, Long>, JpaSpecificationExecutor<TaskEntry> {

    List<TaskEntry> findByOwnerIdAndWorkDate(Long ownerId, LocalDate workDate);

    List<TaskEntry> findByOwnerIdAndWorkDateBetweenOrderByWorkDateAsc(Long ownerId, LocalDate from, LocalDate to);

    /**
     * Record lock taken before any lifecycle transition.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TaskEntry t WHERE t.id = :id")
    Optional<TaskEntry> lockById(@Param("id") Long id);
}
