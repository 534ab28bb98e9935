package com.example.timesheet.holiday;

import com.example.timesheet.config.CacheConfig;
import com.example.timesheet.time.WorkCalendar;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.YearMonth;
import java.util.HashSet;

/**
 * Builds {@link WorkCalendar} snapshots from the declared holidays and working Saturdays.
 */
@Service
@Transactional(readOnly = true)
public class WorkCalendarService {

    private final HolidayRepository holidayRepository;
    private final WorkingSaturdayRepository workingSaturdayRepository;

    public WorkCalendarService(HolidayRepository holidayRepository,
                               WorkingSaturdayRepository workingSaturdayRepository) {
        this.holidayRepository = holidayRepository;
        this.workingSaturdayRepository = workingSaturdayRepository;
    }

    @Cacheable(cacheNames = CacheConfig.WORK_CALENDAR, key = "#month.toString()")
    public WorkCalendar forMonth(YearMonth month) {
        return new WorkCalendar(
                new HashSet<>(holidayRepository.findDatesBetween(month.atDay(1), month.atEndOfMonth())),
                new HashSet<>(workingSaturdayRepository.findDatesBetween(month.atDay(1), month.atEndOfMonth())));
    }
}
