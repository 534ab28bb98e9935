package com.example.timesheet.leave;

import com.example.timesheet.approval.ApprovalStatus;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Listing criteria for leave requests; {@code from}/{@code to} select requests whose range
 * intersects them. A {@code null} field does not restrict the result.
 */
public record LeaveFilter(Long ownerId, LocalDate from, LocalDate to, ApprovalStatus status) {

    public static LeaveFilter withStatus(ApprovalStatus status) {
        return new LeaveFilter(null, null, null, status);
    }

    public LeaveFilter forOwner(Long owner) {
        return new LeaveFilter(owner, from, to, status);
    }

    public Specification<LeaveRequest> toSpecification() {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (ownerId != null) {
                predicates.add(cb.equal(root.get("ownerId"), ownerId));
            }
            if (from != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<LocalDate>get("endDate"), from));
            }
            if (to != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<LocalDate>get("startDate"), to));
            }
            if (status != null) {
                predicates.add(cb.equal(root.get("status"), status));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
