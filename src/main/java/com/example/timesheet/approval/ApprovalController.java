package com.example.timesheet.approval;

import com.example.timesheet.common.ApiResponse;
import com.example.timesheet.leave.LeaveController.LeaveRequestDto;
import com.example.timesheet.task.TaskEntryController.TaskEntryDto;
import com.example.timesheet.user.UserDirectory;
import com.example.timesheet.workflow.TimesheetWorkflowService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Administrator queue: records awaiting a decision (or any status, when asked) and the
 * approve/reject decisions on them.
 */
@RestController
@RequestMapping("/api/admin/approvals")
public class ApprovalController {

    private final TimesheetWorkflowService workflowService;

    public ApprovalController(TimesheetWorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    @GetMapping("/task-entries")
    public ResponseEntity<ApiResponse<List<TaskEntryDto>>> pendingTaskEntries(
            @RequestHeader(UserDirectory.USER_ID_HEADER) Long adminId,
            @RequestParam(defaultValue = "SUBMITTED") ApprovalStatus status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "100") int size) {
        List<TaskEntryDto> pending = workflowService.taskEntryQueue(adminId, status, page, size).stream()
                .map(TaskEntryDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("Task entries loaded", pending));
    }

    @PostMapping("/task-entries/{id}/approve")
    public ResponseEntity<ApiResponse<TaskEntryDto>> approveTaskEntry(@RequestHeader(UserDirectory.USER_ID_HEADER) Long adminId,
                                                                      @PathVariable Long id,
                                                                      @Valid @RequestBody(required = false) DecisionRequest request) {
        TaskEntryDto dto = TaskEntryDto.from(workflowService.approveTaskEntry(adminId, id, commentOf(request)));
        return ResponseEntity.ok(ApiResponse.success("Task entry approved", dto));
    }

    @PostMapping("/task-entries/{id}/reject")
    public ResponseEntity<ApiResponse<TaskEntryDto>> rejectTaskEntry(@RequestHeader(UserDirectory.USER_ID_HEADER) Long adminId,
                                                                     @PathVariable Long id,
                                                                     @Valid @RequestBody(required = false) DecisionRequest request) {
        TaskEntryDto dto = TaskEntryDto.from(workflowService.rejectTaskEntry(adminId, id, commentOf(request)));
        return ResponseEntity.ok(ApiResponse.success("Task entry rejected", dto));
    }

    @GetMapping("/leaves")
    public ResponseEntity<ApiResponse<List<LeaveRequestDto>>> pendingLeave(
            @RequestHeader(UserDirectory.USER_ID_HEADER) Long adminId,
            @RequestParam(defaultValue = "SUBMITTED") ApprovalStatus status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "100") int size) {
        List<LeaveRequestDto> pending = workflowService.leaveQueue(adminId, status, page, size).stream()
                .map(LeaveRequestDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("Leave requests loaded", pending));
    }

    @PostMapping("/leaves/{id}/approve")
    public ResponseEntity<ApiResponse<LeaveRequestDto>> approveLeave(@RequestHeader(UserDirectory.USER_ID_HEADER) Long adminId,
                                                                     @PathVariable Long id,
                                                                     @Valid @RequestBody(required = false) DecisionRequest request) {
        LeaveRequestDto dto = LeaveRequestDto.from(workflowService.approveLeave(adminId, id, commentOf(request)));
        return ResponseEntity.ok(ApiResponse.success("Leave request approved", dto));
    }

    @PostMapping("/leaves/{id}/reject")
    public ResponseEntity<ApiResponse<LeaveRequestDto>> rejectLeave(@RequestHeader(UserDirectory.USER_ID_HEADER) Long adminId,
                                                                    @PathVariable Long id,
                                                                    @Valid @RequestBody(required = false) DecisionRequest request) {
        LeaveRequestDto dto = LeaveRequestDto.from(workflowService.rejectLeave(adminId, id, commentOf(request)));
        return ResponseEntity.ok(ApiResponse.success("Leave request rejected", dto));
    }

    private static String commentOf(DecisionRequest request) {
        return request == null ? null : request.comment();
    }

    public record DecisionRequest(
            @Size(max = 500, message = "comment must be at most 500 characters") String comment
    ) {}
}
