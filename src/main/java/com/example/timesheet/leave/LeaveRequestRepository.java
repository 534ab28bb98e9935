package com.example.timesheet.leave;

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
public interface LeaveRequestRepository extends JpaRepository<LeaveRequest, Long>, JpaSpecificationExecutor<LeaveRequest> {

    /**
     * Leave of an owner intersecting {@code [from, to]}.
     */
    @Query("SELECT l FROM LeaveRequest l WHERE l.ownerId = :ownerId " +
           "AND l.startDate <= :to AND l.endDate >= :from ORDER BY l.startDate ASC")
    List<LeaveRequest> findOverlapping(@Param("ownerId") Long ownerId,
                                       @Param("from") LocalDate from,
                                       @Param("to") LocalDate to);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM LeaveRequest l WHERE l.id = :id")
    Optional<LeaveRequest> lockById(@Param("id") Long id);
}
