package com.example.timesheet.time;

import com.example.timesheet.exception.RuleViolation;
import com.example.timesheet.exception.RuleViolationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.function.Function;

/**
 * Exact hour arithmetic. All values are carried as {@link BigDecimal} with two decimals.
 */
public final class Hours {

    public static final int SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private Hours() {
    }

    public static BigDecimal normalize(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    /**
     * Validates a raw hour value at construction time: present, not negative, at most two decimals.
     */
    public static BigDecimal requireBookable(BigDecimal hours) {
        if (hours == null || hours.signum() < 0 || hours.stripTrailingZeros().scale() > SCALE) {
            throw new RuleViolationException(new RuleViolation.InvalidHours(hours == null ? ZERO : hours, null));
        }
        return normalize(hours);
    }

    public static <T> BigDecimal total(Collection<? extends T> items, Function<? super T, BigDecimal> hours) {
        BigDecimal sum = ZERO;
        for (T item : items) {
            sum = sum.add(hours.apply(item));
        }
        return sum.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    /**
     * @param granularity minimum booking unit, or {@code null} when any value is allowed
     */
    public static boolean isMultipleOf(BigDecimal hours, BigDecimal granularity) {
        if (granularity == null || granularity.signum() == 0) {
            return true;
        }
        return hours.remainder(granularity).signum() == 0;
    }
}
