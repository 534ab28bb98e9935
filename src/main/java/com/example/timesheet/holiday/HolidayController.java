package com.example.timesheet.holiday;

import com.example.timesheet.common.ApiResponse;
import com.example.timesheet.config.CacheConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

@RestController
@RequestMapping("/api/holidays")
public class HolidayController {
    private final HolidayRepository holidayRepository;
    private final WorkingSaturdayRepository workingSaturdayRepository;

    public HolidayController(HolidayRepository holidayRepository,
                             WorkingSaturdayRepository workingSaturdayRepository) {
        this.holidayRepository = holidayRepository;
        this.workingSaturdayRepository = workingSaturdayRepository;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<HolidayDto>>> list() {
        List<HolidayDto> holidays = holidayRepository.findAll().stream()
                .sorted(Comparator.comparing(Holiday::getDate))
                .map(HolidayDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("Holidays loaded", holidays));
    }

    @PostMapping
    @CacheEvict(cacheNames = CacheConfig.WORK_CALENDAR, allEntries = true)
    public ResponseEntity<ApiResponse<HolidayDto>> create(@Valid @RequestBody HolidayRequest request) {
        LocalDate date = request.date();
        Holiday holiday = holidayRepository.findByDate(date)
                .map(existing -> {
                    existing.setName(request.name());
                    return existing;
                })
                .orElseGet(() -> new Holiday(date, request.name()));
        Holiday saved = holidayRepository.save(holiday);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Holiday saved", HolidayDto.from(saved)));
    }

    @DeleteMapping("/{id}")
    @CacheEvict(cacheNames = CacheConfig.WORK_CALENDAR, allEntries = true)
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable Long id) {
        if (!holidayRepository.existsById(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiResponse.failure("Holiday not found (ID=" + id + ")"));
        }
        holidayRepository.deleteById(id);
        return ResponseEntity.ok(ApiResponse.success("Holiday deleted", null));
    }

    @GetMapping("/working-saturdays")
    public ResponseEntity<ApiResponse<List<WorkingSaturdayDto>>> listWorkingSaturdays(@RequestParam int year) {
        List<WorkingSaturdayDto> days = workingSaturdayRepository.findByYearOrderByDateAsc(year).stream()
                .map(WorkingSaturdayDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("Working Saturdays loaded", days));
    }

    @PostMapping("/working-saturdays")
    @CacheEvict(cacheNames = CacheConfig.WORK_CALENDAR, allEntries = true)
    public ResponseEntity<ApiResponse<WorkingSaturdayDto>> createWorkingSaturday(@Valid @RequestBody WorkingSaturdayRequest request) {
        LocalDate date = request.date();
        if (date.getDayOfWeek() != DayOfWeek.SATURDAY) {
            return ResponseEntity.badRequest().body(ApiResponse.failure(date + " is not a Saturday"));
        }
        if (workingSaturdayRepository.existsByYearAndMonth(date.getYear(), date.getMonthValue())) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(ApiResponse.failure("A working Saturday is already declared for " + date.getYear() + "-" + date.getMonthValue()));
        }
        WorkingSaturday saved = workingSaturdayRepository.save(new WorkingSaturday(date, request.description()));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Working Saturday saved", WorkingSaturdayDto.from(saved)));
    }

    @DeleteMapping("/working-saturdays/{id}")
    @CacheEvict(cacheNames = CacheConfig.WORK_CALENDAR, allEntries = true)
    public ResponseEntity<ApiResponse<Void>> deleteWorkingSaturday(@PathVariable Long id) {
        if (!workingSaturdayRepository.existsById(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiResponse.failure("Working Saturday not found (ID=" + id + ")"));
        }
        workingSaturdayRepository.deleteById(id);
        return ResponseEntity.ok(ApiResponse.success("Working Saturday deleted", null));
    }

    public record HolidayRequest(
            @NotNull(message = "Date is required") LocalDate date,
            @Size(max = 64, message = "Holiday name must be at most 64 characters") String name
    ) {}

    public record HolidayDto(Long id, LocalDate date, String name) {
        static HolidayDto from(Holiday holiday) {
            return new HolidayDto(holiday.getId(), holiday.getDate(), holiday.getName());
        }
    }

    public record WorkingSaturdayRequest(
            @NotNull(message = "Date is required") LocalDate date,
            @Size(max = 255, message = "description must be at most 255 characters") String description
    ) {}

    public record WorkingSaturdayDto(Long id, LocalDate date, String description) {
        static WorkingSaturdayDto from(WorkingSaturday day) {
            return new WorkingSaturdayDto(day.getId(), day.getDate(), day.getDescription());
        }
    }
}
