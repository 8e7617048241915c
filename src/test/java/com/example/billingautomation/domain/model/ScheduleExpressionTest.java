package com.example.billingautomation.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ScheduleExpression Tests")
class ScheduleExpressionTest {

    @Nested
    @DisplayName("Named schedules")
    class NamedScheduleTests {

        @Test
        @DisplayName("Should treat @monthly as a 30 day period checked on the short interval")
        void shouldCheckMonthlyOnShortInterval() {
            var expression = ScheduleExpression.parse("@monthly");

            assertThat(expression.isMonthly()).isTrue();
            assertThat(expression.isRecognized()).isTrue();
            assertThat(expression.getPeriod()).isEqualTo(Duration.ofDays(30));
            assertThat(expression.checkInterval(Duration.ofHours(1))).isEqualTo(Duration.ofHours(1));
        }

        @Test
        @DisplayName("Should check @daily once per day")
        void shouldCheckDailyOncePerDay() {
            var expression = ScheduleExpression.parse("@daily");

            assertThat(expression.isMonthly()).isFalse();
            assertThat(expression.checkInterval(Duration.ofHours(1))).isEqualTo(Duration.ofDays(1));
        }

        @Test
        @DisplayName("Should map @weekly and @hourly to their periods")
        void shouldMapWeeklyAndHourly() {
            assertThat(ScheduleExpression.parse("@weekly").getPeriod()).isEqualTo(Duration.ofDays(7));
            assertThat(ScheduleExpression.parse("@hourly").getPeriod()).isEqualTo(Duration.ofHours(1));
        }
    }

    @Nested
    @DisplayName("Minute intervals")
    class MinuteIntervalTests {

        @Test
        @DisplayName("Should parse */15 as every fifteen minutes")
        void shouldParseEveryFifteenMinutes() {
            var expression = ScheduleExpression.parse("*/15");

            assertThat(expression.isRecognized()).isTrue();
            assertThat(expression.getPeriod()).isEqualTo(Duration.ofMinutes(15));
        }

        @Test
        @DisplayName("Should fall back to daily for a zero minute interval")
        void shouldFallBackForZeroMinutes() {
            var expression = ScheduleExpression.parse("*/0");

            assertThat(expression.isRecognized()).isFalse();
            assertThat(expression.getPeriod()).isEqualTo(Duration.ofDays(1));
        }
    }

    @Nested
    @DisplayName("Unknown formats")
    class UnknownFormatTests {

        @ParameterizedTest
        @ValueSource(strings = {"0 0 1 * *", "@yearly", "every day", ""})
        @DisplayName("Should accept unknown formats and treat them as daily")
        void shouldTreatUnknownAsDaily(String raw) {
            var expression = ScheduleExpression.parse(raw);

            assertThat(expression.isRecognized()).isFalse();
            assertThat(expression.isMonthly()).isFalse();
            assertThat(expression.getPeriod()).isEqualTo(Duration.ofDays(1));
            assertThat(expression.getExpression()).isEqualTo(raw);
        }

        @Test
        @DisplayName("Should treat a null schedule as daily")
        void shouldTreatNullAsDaily() {
            assertThat(ScheduleExpression.parse(null).getPeriod()).isEqualTo(Duration.ofDays(1));
        }
    }
}
