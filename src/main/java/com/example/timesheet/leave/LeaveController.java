package com.example.timesheet.leave;

import com.example.timesheet.approval.ApprovalStatus;
import com.example.timesheet.common.ApiResponse;
import com.example.timesheet.exception.RuleViolation;
import com.example.timesheet.user.UserDirectory;
import com.example.timesheet.workflow.TimesheetWorkflowService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/leave-requests")
public class LeaveController {

    private final TimesheetWorkflowService workflowService;

    public LeaveController(TimesheetWorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<LeaveRequestDto>>> list(
            @RequestHeader(UserDirectory.USER_ID_HEADER) Long userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false) ApprovalStatus status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "100") int size) {
        LeaveFilter filter = new LeaveFilter(null, from, to, status);
        List<LeaveRequestDto> leave = workflowService.listLeave(userId, filter, page, size).stream()
                .map(LeaveRequestDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("Leave requests loaded", leave));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<LeaveRequestDto>> get(@RequestHeader(UserDirectory.USER_ID_HEADER) Long userId,
                                                            @PathVariable Long id) {
        LeaveRequest leave = workflowService.getLeave(userId, id);
        return ResponseEntity.ok(ApiResponse.success("Leave request loaded", LeaveRequestDto.from(leave)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<LeaveRequestDto>> create(@RequestHeader(UserDirectory.USER_ID_HEADER) Long userId,
                                                               @Valid @RequestBody LeaveRequestBody body) {
        LeaveRequest saved = workflowService.createLeave(userId, body.startDate(), body.endDate(),
                body.hoursPerDay(), body.reason().trim());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Leave request created", LeaveRequestDto.from(saved)));
    }

    @PostMapping("/{id}/submit")
    public ResponseEntity<ApiResponse<LeaveRequestDto>> submit(@RequestHeader(UserDirectory.USER_ID_HEADER) Long userId,
                                                               @PathVariable Long id) {
        LeaveRequest saved = workflowService.submitLeave(userId, id);
        return ResponseEntity.ok(ApiResponse.success("Leave request submitted", LeaveRequestDto.from(saved)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@RequestHeader(UserDirectory.USER_ID_HEADER) Long userId,
                                                    @PathVariable Long id) {
        workflowService.deleteLeave(userId, id);
        return ResponseEntity.ok(ApiResponse.success("Leave request deleted", null));
    }

    @GetMapping("/{id}/recheck")
    public ResponseEntity<ApiResponse<List<String>>> recheck(@RequestHeader(UserDirectory.USER_ID_HEADER) Long userId,
                                                             @PathVariable Long id) {
        List<String> problems = workflowService.recheckLeave(userId, id).stream()
                .map(RuleViolation::message)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(problems.isEmpty() ? "Leave request is valid" : "Leave request has problems", problems));
    }

    public record LeaveRequestBody(
            @NotNull(message = "startDate is required") LocalDate startDate,
            @NotNull(message = "endDate is required") LocalDate endDate,
            BigDecimal hoursPerDay,
            @NotBlank(message = "reason is required")
            @Size(max = 500, message = "reason must be at most 500 characters") String reason
    ) {}

    public record LeaveRequestDto(Long id, Long ownerId, LocalDate startDate, LocalDate endDate,
                                  BigDecimal hoursPerDay, LeaveType leaveType, String reason,
                                  ApprovalStatus status, String adminComment, Long decidedBy,
                                  Instant decidedAt, Instant createdAt, Instant updatedAt) {
        public static LeaveRequestDto from(LeaveRequest leave) {
            return new LeaveRequestDto(leave.getId(), leave.getOwnerId(), leave.getStartDate(), leave.getEndDate(),
                    leave.getHoursPerDay(), leave.getLeaveType(), leave.getReason(), leave.getStatus(),
                    leave.getAdminComment(), leave.getDecidedBy(), leave.getDecidedAt(),
                    leave.getCreatedAt(), leave.getUpdatedAt());
        }
    }
}
