package com.example.timesheet.leave;

import com.example.timesheet.approval.Approvable;
import com.example.timesheet.approval.ApprovalDecision;
import com.example.timesheet.approval.ApprovalStatus;
import com.example.timesheet.approval.AuditStamp;
import com.example.timesheet.time.DateRange;
import com.example.timesheet.time.Hours;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "leave_requests", indexes = @Index(name = "ix_leave_requests_owner", columnList = "owner_id, start_date"))
public class LeaveRequest implements Approvable {

    public static final BigDecimal FULL_DAY_HOURS = new BigDecimal("8.00");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(name = "hours_per_day", nullable = false, precision = 4, scale = 2)
    private BigDecimal hoursPerDay = FULL_DAY_HOURS;

    @Enumerated(EnumType.STRING)
    @Column(name = "leave_type", nullable = false, length = 16)
    private LeaveType leaveType = LeaveType.FULL_DAY;

    @Column(nullable = false, length = 500)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ApprovalStatus status = ApprovalStatus.DRAFT;

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

    protected LeaveRequest() {
    }

    public LeaveRequest(Long ownerId, DateRange range, BigDecimal hoursPerDay, String reason) {
        this.ownerId = ownerId;
        this.startDate = range.start();
        this.endDate = range.end();
        this.hoursPerDay = hoursPerDay != null ? Hours.requireBookable(hoursPerDay) : FULL_DAY_HOURS;
        this.leaveType = LeaveType.fromHoursPerDay(this.hoursPerDay);
        this.reason = reason;
    }

    public LeaveRequest(Long ownerId, DateRange range, String reason) {
        this(ownerId, range, FULL_DAY_HOURS, reason);
    }

    public DateRange range() {
        return DateRange.of(startDate, endDate);
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

    @Override
    public Long getId() { return id; }
    @Override
    public Long getOwnerId() { return ownerId; }
    public LocalDate getStartDate() { return startDate; }
    public LocalDate getEndDate() { return endDate; }
    public BigDecimal getHoursPerDay() { return hoursPerDay; }
    public LeaveType getLeaveType() { return leaveType; }
    public String getReason() { return reason; }
    @Override
    public ApprovalStatus getStatus() { return status; }
    public void setStatus(ApprovalStatus status) { this.status = status; }
    public String getAdminComment() { return adminComment; }
    public Long getDecidedBy() { return decidedBy; }
    public Instant getDecidedAt() { return decidedAt; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Long getCreatedBy() { return createdBy; }
    public Long getUpdatedBy() { return updatedBy; }
    public Long getVersion() { return version; }
}
