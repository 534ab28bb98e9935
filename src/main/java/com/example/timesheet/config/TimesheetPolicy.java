package com.example.timesheet.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;
import java.time.ZoneId;

/**
 * Tunable business limits, bound from {@code timesheet.policy.*}.
 *
 * @param dailyHourLimit       maximum task hours per owner and date
 * @param hourGranularity      minimum booking unit for sub-task hours; {@code null} for none
 * @param maxLeaveHoursPerDay  upper bound of a leave request's hours per day
 * @param zone                 canonical zone in which calendar dates are interpreted
 */
@ConfigurationProperties(prefix = "timesheet.policy")
public record TimesheetPolicy(
        @DefaultValue("8.00") BigDecimal dailyHourLimit,
        BigDecimal hourGranularity,
        @DefaultValue("8.00") BigDecimal maxLeaveHoursPerDay,
        @DefaultValue("UTC") ZoneId zone
) {
}
