package com.example.timesheet.common;

import com.example.timesheet.exception.RuleViolation;
import com.example.timesheet.exception.RuleViolationException;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a rule evaluation: either an accepted value or at least one violation.
 */
public final class Verdict<T> {

    private final T value;
    private final List<RuleViolation> violations;

    private Verdict(T value, List<RuleViolation> violations) {
        this.value = value;
        this.violations = violations;
    }

    public static <T> Verdict<T> accepted(T value) {
        return new Verdict<>(Objects.requireNonNull(value, "value"), List.of());
    }

    public static <T> Verdict<T> rejected(RuleViolation violation) {
        return new Verdict<>(null, List.of(violation));
    }

    public static <T> Verdict<T> rejected(List<? extends RuleViolation> violations) {
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("a rejected verdict needs at least one violation");
        }
        return new Verdict<>(null, List.copyOf(violations));
    }

    public boolean isAccepted() {
        return violations.isEmpty();
    }

    public boolean isRejected() {
        return !violations.isEmpty();
    }

    public T value() {
        if (isRejected()) {
            throw new NoSuchElementException("verdict was rejected: " + violations);
        }
        return value;
    }

    public List<RuleViolation> violations() {
        return violations;
    }

    public <R> Verdict<R> map(Function<? super T, ? extends R> mapper) {
        if (isRejected()) {
            return new Verdict<>(null, violations);
        }
        return Verdict.accepted(mapper.apply(value));
    }

    public <R> Verdict<R> flatMap(Function<? super T, Verdict<R>> mapper) {
        if (isRejected()) {
            return new Verdict<>(null, violations);
        }
        return mapper.apply(value);
    }

    public T orElseThrow() {
        if (isRejected()) {
            throw new RuleViolationException(violations);
        }
        return value;
    }

    @Override
    public String toString() {
        return isAccepted() ? "Accepted[" + value + "]" : "Rejected" + violations;
    }
}
