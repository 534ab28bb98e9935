package com.example.timesheet.holiday;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface HolidayRepository extends JpaRepository<Holiday, Long> {
    Optional<Holiday> findByDate(LocalDate date);

    @Query("select h.date from Holiday h where h.date between :start and :end")
    List<LocalDate> findDatesBetween(@Param("start") LocalDate start, @Param("end") LocalDate end);
}
