package com.example.billingautomation.domain.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ScheduledTask Tests")
class ScheduledTaskTest {

    private ScheduledTask task;

    @BeforeEach
    void setUp() {
        task = ScheduledTask.builder()
                .id("monthly-invoice-generation")
                .name("Monthly Invoice Generation")
                .schedule("@monthly")
                .active(true)
                .action(() -> {
                })
                .build();
    }

    @Nested
    @DisplayName("hasRunInMonthOf Tests")
    class HasRunInMonthOfTests {

        @Test
        @DisplayName("Should return false when the task never ran")
        void shouldReturnFalseWhenNeverRan() {
            assertThat(task.hasRunInMonthOf(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC)).isFalse();
        }

        @Test
        @DisplayName("Should return true for a run earlier in the same month")
        void shouldReturnTrueForSameMonth() {
            task.setLastRun(Instant.parse("2024-03-01T00:05:00Z"));

            assertThat(task.hasRunInMonthOf(Instant.parse("2024-03-01T23:00:00Z"), ZoneOffset.UTC)).isTrue();
        }

        @Test
        @DisplayName("Should return false for a run in the same month of a previous year")
        void shouldReturnFalseForPreviousYear() {
            task.setLastRun(Instant.parse("2023-03-01T00:05:00Z"));

            assertThat(task.hasRunInMonthOf(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC)).isFalse();
        }

        @Test
        @DisplayName("Should compare months in the given zone")
        void shouldCompareInZone() {
            var johannesburg = ZoneId.of("Africa/Johannesburg");
            // 23:30 UTC on Feb 29 is already March 1 in Johannesburg
            task.setLastRun(Instant.parse("2024-02-29T23:30:00Z"));

            assertThat(task.hasRunInMonthOf(Instant.parse("2024-03-01T08:00:00Z"), johannesburg)).isTrue();
            assertThat(task.hasRunInMonthOf(Instant.parse("2024-03-01T08:00:00Z"), ZoneOffset.UTC)).isFalse();
        }
    }

    @Nested
    @DisplayName("Schedule Tests")
    class ScheduleTests {

        @Test
        @DisplayName("Should recognise monthly schedule")
        void shouldRecogniseMonthly() {
            assertThat(task.isMonthly()).isTrue();

            task.setSchedule("@daily");
            assertThat(task.isMonthly()).isFalse();
        }
    }

    @Nested
    @DisplayName("snapshot Tests")
    class SnapshotTests {

        @Test
        @DisplayName("Should not reflect later changes to the original")
        void shouldBeDetached() {
            var snapshot = task.snapshot();

            task.setActive(false);
            task.setLastRun(Instant.parse("2024-03-01T00:00:00Z"));

            assertThat(snapshot.isActive()).isTrue();
            assertThat(snapshot.getLastRun()).isNull();
            assertThat(snapshot.getId()).isEqualTo(task.getId());
        }
    }
}
