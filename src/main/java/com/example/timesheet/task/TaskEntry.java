package com.example.timesheet.task;

import com.example.timesheet.approval.Approvable;
import com.example.timesheet.approval.ApprovalDecision;
import com.example.timesheet.approval.ApprovalStatus;
import com.example.timesheet.approval.AuditStamp;
import com.example.timesheet.time.Hours;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "task_entries", indexes = @Index(name = "ix_task_entries_owner_date", columnList = "owner_id, work_date"))
public class TaskEntry implements Approvable {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "work_date", nullable = false)
    private LocalDate workDate;

    @Column(name = "task_name", length = 255)
    private String taskName;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "task_sub_entries", joinColumns = @JoinColumn(name = "task_entry_id"))
    @OrderColumn(name = "position")
    private List<SubTask> subTasks = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ApprovalStatus status = ApprovalStatus.DRAFT;

    @Column(name = "is_overtime", nullable = false)
    private boolean overtime;

    @Column(name = "overtime_hours", nullable = false, precision = 4, scale = 2)
    private BigDecimal overtimeHours = Hours.ZERO;

    @Column(name = "admin_comment", length = 500)
    private String adminComment;

    @Column(name = "decided_by")
    private Long decidedBy;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "created_by")
    private Long createdBy;

    @Column(name = "updated_by")
    private Long updatedBy;

    @Version
    private Long version;

    protected TaskEntry() {
    }

    public TaskEntry(Long ownerId, LocalDate workDate, String taskName, List<SubTask> subTasks) {
        this.ownerId = ownerId;
        this.workDate = workDate;
        this.taskName = taskName;
        this.subTasks = new ArrayList<>(subTasks);
    }

    /**
     * Detached copy carrying revised content, used to validate an update before it is applied.
     */
    public TaskEntry revisedWith(String newTaskName, List<SubTask> newSubTasks) {
        TaskEntry revised = new TaskEntry(ownerId, workDate, newTaskName != null ? newTaskName : taskName, newSubTasks);
        revised.id = id;
        revised.status = status;
        return revised;
    }

    public BigDecimal totalHours() {
        return Hours.total(subTasks, SubTask::getHours);
    }

    public void replaceContent(String newTaskName, List<SubTask> newSubTasks) {
        if (newTaskName != null) {
            this.taskName = newTaskName;
        }
        this.subTasks.clear();
        this.subTasks.addAll(newSubTasks);
    }

    public void applyAudit(AuditStamp audit) {
        if (audit.isCreation()) {
            this.createdAt = audit.createdAt();
            this.createdBy = audit.createdBy();
        }
        this.updatedAt = audit.updatedAt();
        this.updatedBy = audit.updatedBy();
    }

    public void applyDecision(ApprovalDecision decision) {
        this.status = decision.outcome();
        this.decidedBy = decision.actorId();
        this.decidedAt = decision.decidedAt();
        this.adminComment = decision.comment();
    }

    public void applyOvertime(BigDecimal hours) {
        this.overtimeHours = hours;
        this.overtime = hours.signum() > 0;
    }

    @Override
    public Long getId() { return id; }
    @Override
    public Long getOwnerId() { return ownerId; }
    public LocalDate getWorkDate() { return workDate; }
    public String getTaskName() { return taskName; }
    public List<SubTask> getSubTasks() { return List.copyOf(subTasks); }
    @Override
    public ApprovalStatus getStatus() { return status; }
    public void setStatus(ApprovalStatus status) { this.status = status; }
    public boolean isOvertime() { return overtime; }
    public BigDecimal getOvertimeHours() { return overtimeHours; }
    public String getAdminComment() { return adminComment; }
    public Long getDecidedBy() { return decidedBy; }
    public Instant getDecidedAt() { return decidedAt; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Long getCreatedBy() { return createdBy; }
    public Long getUpdatedBy() { return updatedBy; }
    public Long getVersion() { return version; }
}
