package com.example.timesheet.time;

import com.example.timesheet.exception.RuleViolation;
import com.example.timesheet.exception.RuleViolationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DateRangeTest {

    private static final LocalDate MARCH_1 = LocalDate.of(2026, 3, 1);

    @Test
    void constructor_endBeforeStart_isInvalidRange() {
        assertThatThrownBy(() -> DateRange.of(MARCH_1, MARCH_1.minusDays(1)))
                .isInstanceOf(RuleViolationException.class)
                .satisfies(ex -> assertThat(((RuleViolationException) ex).getPrimaryViolation())
                        .isEqualTo(new RuleViolation.InvalidRange(MARCH_1, MARCH_1.minusDays(1))));
    }

    @Test
    void singleDay_isItsOwnRange() {
        DateRange day = DateRange.single(MARCH_1);

        assertThat(day.length()).isEqualTo(1);
        assertThat(day.contains(MARCH_1)).isTrue();
        assertThat(day.days()).containsExactly(MARCH_1);
    }

    @Test
    void overlaps_sharedEndpointCounts() {
        DateRange first = DateRange.of(MARCH_1, LocalDate.of(2026, 3, 5));
        DateRange touching = DateRange.of(LocalDate.of(2026, 3, 5), LocalDate.of(2026, 3, 9));
        DateRange after = DateRange.of(LocalDate.of(2026, 3, 6), LocalDate.of(2026, 3, 9));

        assertThat(first.overlaps(touching)).isTrue();
        assertThat(touching.overlaps(first)).isTrue();
        assertThat(first.overlaps(after)).isFalse();
    }

    @Test
    void overlaps_matchesSharedDayForRandomRanges() {
        Random random = new Random(20260301L);
        for (int i = 0; i < 500; i++) {
            DateRange a = randomRange(random);
            DateRange b = randomRange(random);

            boolean shareDay = a.days().anyMatch(b::contains);

            assertThat(a.overlaps(b)).as("%s vs %s", a, b).isEqualTo(shareDay);
            assertThat(b.overlaps(a)).isEqualTo(a.overlaps(b));
        }
    }

    @Test
    void days_spanMonthBoundary() {
        DateRange range = DateRange.of(LocalDate.of(2026, 2, 27), LocalDate.of(2026, 3, 2));

        assertThat(range.length()).isEqualTo(4);
        assertThat(range.days()).containsExactly(
                LocalDate.of(2026, 2, 27), LocalDate.of(2026, 2, 28),
                LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 2));
        assertThat(range).hasToString("2026-02-27..2026-03-02");
    }

    private static DateRange randomRange(Random random) {
        LocalDate start = MARCH_1.plusDays(random.nextInt(30));
        return DateRange.of(start, start.plusDays(random.nextInt(6)));
    }
}
