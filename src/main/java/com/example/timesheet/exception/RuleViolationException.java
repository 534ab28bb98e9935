package com.example.timesheet.exception;

import java.util.List;
import java.util.stream.Collectors;

public class RuleViolationException extends BusinessException {

    private final List<RuleViolation> violations;

    public RuleViolationException(RuleViolation violation) {
        this(List.of(violation));
    }

    public RuleViolationException(List<RuleViolation> violations) {
        super(primary(violations).code(), render(violations));
        this.violations = List.copyOf(violations);
    }

    public List<RuleViolation> getViolations() {
        return violations;
    }

    public RuleViolation getPrimaryViolation() {
        return violations.get(0);
    }

    private static RuleViolation primary(List<RuleViolation> violations) {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("at least one violation is required");
        }
        return violations.get(0);
    }

    private static String render(List<RuleViolation> violations) {
        return violations.stream().map(RuleViolation::message).collect(Collectors.joining("; "));
    }
}
