package com.jarviz.moneybot.service;

import java.time.LocalDate;
import java.util.Locale;

public enum SummaryPeriod {
    TODAY,
    WEEK,
    MONTH,
    ALL;

    /**
     * Unknown or missing text falls back to the current month.
     */
    public static SummaryPeriod fromText(String text) {
        if (text == null || text.isBlank()) {
            return MONTH;
        }
        switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "today":
                return TODAY;
            case "week":
                return WEEK;
            case "all":
                return ALL;
            default:
                return MONTH;
        }
    }

    /**
     * Inclusive lower bound of the period, {@code null} for {@link #ALL}.
     */
    public LocalDate startDate(LocalDate today) {
        switch (this) {
            case TODAY:
                return today;
            case WEEK:
                return today.minusDays(7);
            case ALL:
                return null;
            case MONTH:
            default:
                return today.withDayOfMonth(1);
        }
    }
}
