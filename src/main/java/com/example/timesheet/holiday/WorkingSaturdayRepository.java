package com.example.timesheet.holiday;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface WorkingSaturdayRepository extends JpaRepository<WorkingSaturday, Long> {
    boolean existsByYearAndMonth(int year, int month);
    List<WorkingSaturday> findByYearOrderByDateAsc(int year);

    @Query("select w.date from WorkingSaturday w where w.date between :start and :end")
    List<LocalDate> findDatesBetween(@Param("start") LocalDate start, @Param("end") LocalDate end);
}
