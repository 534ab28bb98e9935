package com.example.timesheet.task;

import com.example.timesheet.approval.ApprovalStatus;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Listing criteria for task entries. A {@code null} field does not restrict the result.
 *
 * @param ownerId  entries of this user only
 * @param from     earliest work date, inclusive
 * @param to       latest work date, inclusive
 * @param status   lifecycle status
 * @param clientId entries with at least one sub-task billed to this client
 */
public record TaskEntryFilter(Long ownerId, LocalDate from, LocalDate to, ApprovalStatus status, Long clientId) {

    public static TaskEntryFilter withStatus(ApprovalStatus status) {
        return new TaskEntryFilter(null, null, null, status, null);
    }

    public TaskEntryFilter forOwner(Long owner) {
        return new TaskEntryFilter(owner, from, to, status, clientId);
    }

    public Specification<TaskEntry> toSpecification() {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (ownerId != null) {
                predicates.add(cb.equal(root.get("ownerId"), ownerId));
            }
            if (from != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<LocalDate>get("workDate"), from));
            }
            if (to != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<LocalDate>get("workDate"), to));
            }
            if (status != null) {
                predicates.add(cb.equal(root.get("status"), status));
            }
            if (clientId != null) {
                Subquery<Long> billed = query.subquery(Long.class);
                Root<TaskEntry> entry = billed.from(TaskEntry.class);
                Join<TaskEntry, SubTask> subTask = entry.join("subTasks");
                billed.select(entry.<Long>get("id"))
                        .where(cb.equal(entry.get("id"), root.get("id")),
                                cb.equal(subTask.get("clientId"), clientId));
                predicates.add(cb.exists(billed));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
