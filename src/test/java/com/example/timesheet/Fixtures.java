package com.example.timesheet;

import com.example.timesheet.config.TimesheetPolicy;
import com.example.timesheet.user.Actor;
import com.example.timesheet.user.Role;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.ZoneId;

/**
 * Shared builders for unit tests that run without a Spring context.
 */
public final class Fixtures {

    private Fixtures() {
    }

    /** Same values as the {@code timesheet.policy} defaults. */
    public static TimesheetPolicy defaultPolicy() {
        return policyWithGranularity(null);
    }

    public static TimesheetPolicy policyWithGranularity(BigDecimal granularity) {
        return new TimesheetPolicy(new BigDecimal("8.00"), granularity, new BigDecimal("8.00"), ZoneId.of("UTC"));
    }

    public static Actor admin(Long id) {
        return new Actor(id, Role.ADMIN);
    }

    public static Actor employee(Long id) {
        return new Actor(id, Role.EMPLOYEE);
    }

    /** Assigns the id the database would, for records that are never persisted. */
    public static <T> T withId(T entity, Long id) {
        ReflectionTestUtils.setField(entity, "id", id);
        return entity;
    }
}
