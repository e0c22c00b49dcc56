package com.jarviz.moneybot.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class SummaryPeriodTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 11, 14);

    @Test
    void parsesKnownPeriodsAndFallsBackToMonth() {
        assertThat(SummaryPeriod.fromText("today")).isEqualTo(SummaryPeriod.TODAY);
        assertThat(SummaryPeriod.fromText("WEEK")).isEqualTo(SummaryPeriod.WEEK);
        assertThat(SummaryPeriod.fromText("all")).isEqualTo(SummaryPeriod.ALL);
        assertThat(SummaryPeriod.fromText("month")).isEqualTo(SummaryPeriod.MONTH);
        assertThat(SummaryPeriod.fromText("year")).isEqualTo(SummaryPeriod.MONTH);
        assertThat(SummaryPeriod.fromText(null)).isEqualTo(SummaryPeriod.MONTH);
    }

    @Test
    void startDates() {
        assertThat(SummaryPeriod.TODAY.startDate(TODAY)).isEqualTo(TODAY);
        assertThat(SummaryPeriod.WEEK.startDate(TODAY)).isEqualTo(LocalDate.of(2025, 11, 7));
        assertThat(SummaryPeriod.MONTH.startDate(TODAY)).isEqualTo(LocalDate.of(2025, 11, 1));
        assertThat(SummaryPeriod.ALL.startDate(TODAY)).isNull();
    }
}
