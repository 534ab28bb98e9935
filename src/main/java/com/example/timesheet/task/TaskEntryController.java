package com.example.timesheet.task;

import com.example.timesheet.approval.ApprovalStatus;
import com.example.timesheet.common.ApiResponse;
import com.example.timesheet.exception.RuleViolation;
import com.example.timesheet.user.UserDirectory;
import com.example.timesheet.workflow.TimesheetWorkflowService;
import jakarta.validation.Valid;
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
@RequestMapping("/api/task-entries")
public class TaskEntryController {

    private final TimesheetWorkflowService workflowService;

    public TaskEntryController(TimesheetWorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<TaskEntryDto>>> list(
            @RequestHeader(UserDirectory.USER_ID_HEADER) Long userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false) ApprovalStatus status,
            @RequestParam(required = false) Long clientId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "100") int size) {
        TaskEntryFilter filter = new TaskEntryFilter(null, from, to, status, clientId);
        List<TaskEntryDto> entries = workflowService.listTaskEntries(userId, filter, page, size).stream()
                .map(TaskEntryDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("Task entries loaded", entries));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<TaskEntryDto>> get(@RequestHeader(UserDirectory.USER_ID_HEADER) Long userId,
                                                         @PathVariable Long id) {
        TaskEntry entry = workflowService.getTaskEntry(userId, id);
        return ResponseEntity.ok(ApiResponse.success("Task entry loaded", TaskEntryDto.from(entry)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<TaskEntryDto>> create(@RequestHeader(UserDirectory.USER_ID_HEADER) Long userId,
                                                            @Valid @RequestBody TaskEntryRequest request) {
        TaskEntry saved = workflowService.createTaskEntry(userId, request.workDate(), request.taskName(),
                request.toSubTasks());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Task entry created", TaskEntryDto.from(saved)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<TaskEntryDto>> update(@RequestHeader(UserDirectory.USER_ID_HEADER) Long userId,
                                                            @PathVariable Long id,
                                                            @Valid @RequestBody TaskEntryUpdateRequest request) {
        TaskEntry saved = workflowService.updateTaskEntry(userId, id, request.taskName(), request.toSubTasks());
        return ResponseEntity.ok(ApiResponse.success("Task entry updated", TaskEntryDto.from(saved)));
    }

    @PostMapping("/{id}/submit")
    public ResponseEntity<ApiResponse<TaskEntryDto>> submit(@RequestHeader(UserDirectory.USER_ID_HEADER) Long userId,
                                                            @PathVariable Long id) {
        TaskEntry saved = workflowService.submitTaskEntry(userId, id);
        return ResponseEntity.ok(ApiResponse.success("Task entry submitted", TaskEntryDto.from(saved)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@RequestHeader(UserDirectory.USER_ID_HEADER) Long userId,
                                                    @PathVariable Long id) {
        workflowService.deleteTaskEntry(userId, id);
        return ResponseEntity.ok(ApiResponse.success("Task entry deleted", null));
    }

    @GetMapping("/{id}/recheck")
    public ResponseEntity<ApiResponse<List<String>>> recheck(@RequestHeader(UserDirectory.USER_ID_HEADER) Long userId,
                                                             @PathVariable Long id) {
        List<String> problems = workflowService.recheckTaskEntry(userId, id).stream()
                .map(RuleViolation::message)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(problems.isEmpty() ? "Task entry is valid" : "Task entry has problems", problems));
    }

    public record SubTaskBody(
            Long clientId,
            @Size(max = 500, message = "description must be at most 500 characters") String description,
            @NotNull(message = "hours is required") BigDecimal hours
    ) {
        SubTask toSubTask() {
            return new SubTask(clientId, description, hours);
        }
    }

    public record TaskEntryRequest(
            @NotNull(message = "workDate is required") LocalDate workDate,
            @Size(max = 255, message = "taskName must be at most 255 characters") String taskName,
            List<@NotNull(message = "sub-task must not be null") @Valid SubTaskBody> subTasks
    ) {
        List<SubTask> toSubTasks() {
            return subTasksOf(subTasks);
        }
    }

    public record TaskEntryUpdateRequest(
            @Size(max = 255, message = "taskName must be at most 255 characters") String taskName,
            List<@NotNull(message = "sub-task must not be null") @Valid SubTaskBody> subTasks
    ) {
        List<SubTask> toSubTasks() {
            return subTasksOf(subTasks);
        }
    }

    private static List<SubTask> subTasksOf(List<SubTaskBody> bodies) {
        if (bodies == null) {
            return List.of();
        }
        return bodies.stream().map(SubTaskBody::toSubTask).toList();
    }

    public record SubTaskDto(Long clientId, String description, BigDecimal hours) {
        static SubTaskDto from(SubTask subTask) {
            return new SubTaskDto(subTask.getClientId(), subTask.getDescription(), subTask.getHours());
        }
    }

    public record TaskEntryDto(Long id, Long ownerId, LocalDate workDate, String taskName,
                               List<SubTaskDto> subTasks, BigDecimal totalHours, ApprovalStatus status,
                               boolean overtime, BigDecimal overtimeHours, String adminComment,
                               Long decidedBy, Instant decidedAt, Instant createdAt, Instant updatedAt) {
        public static TaskEntryDto from(TaskEntry entry) {
            return new TaskEntryDto(entry.getId(), entry.getOwnerId(), entry.getWorkDate(), entry.getTaskName(),
                    entry.getSubTasks().stream().map(SubTaskDto::from).toList(), entry.totalHours(),
                    entry.getStatus(), entry.isOvertime(), entry.getOvertimeHours(), entry.getAdminComment(),
                    entry.getDecidedBy(), entry.getDecidedAt(), entry.getCreatedAt(), entry.getUpdatedAt());
        }
    }
}
