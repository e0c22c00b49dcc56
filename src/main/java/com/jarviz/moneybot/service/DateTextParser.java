package com.jarviz.moneybot.service;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Finds a calendar date inside free text such as "today", "2025-11-13", "13/11/2025",
 * "13 Nov" or "paid on Nov 13, 2025 at the mall".
 * <p>
 * Numeric dates with slashes, dots or dashes are read day first; when that is not a valid
 * date (11/13/2025) they are read month first. A missing year means the current year.
 * Bare numbers are never taken as a day, so "2 plates" is not a date.
 */
@Component
public class DateTextParser {

    // Whole month words only, so "decent" or "marathon" never read as a month
    private static final String MONTH_NAMES = "(january|jan|february|feb|march|mar|april|apr|may|june|jun"
            + "|july|jul|august|aug|september|sept|sep|october|oct|november|nov|december|dec)\\b\\.?";

    private static final Pattern RELATIVE = Pattern.compile("\\b(today|yesterday|tomorrow)\\b");
    private static final Pattern ISO = Pattern.compile("\\b(\\d{4})-(\\d{1,2})-(\\d{1,2})\\b");
    private static final Pattern NUMERIC = Pattern.compile("\\b(\\d{1,2})[/.\\-](\\d{1,2})[/.\\-](\\d{4}|\\d{2})\\b");
    private static final Pattern DAY_MONTH = Pattern.compile(
            "\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+(?:of\\s+)?" + MONTH_NAMES + "(?:,?\\s+(\\d{4}))?");
    private static final Pattern MONTH_DAY = Pattern.compile(
            "\\b" + MONTH_NAMES + "\\s+(\\d{1,2})(?:st|nd|rd|th)?\\b(?:,?\\s+(\\d{4}))?");

    // keyed by the first three letters of the month word
    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
            Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12));

    public Optional<LocalDate> parse(String text, LocalDate today) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);

        Matcher matcher = ISO.matcher(normalized);
        if (matcher.find()) {
            Optional<LocalDate> date = toDate(number(matcher, 1), number(matcher, 2), number(matcher, 3));
            if (date.isPresent()) {
                return date;
            }
        }

        matcher = NUMERIC.matcher(normalized);
        while (matcher.find()) {
            int first = number(matcher, 1);
            int second = number(matcher, 2);
            int year = expandYear(number(matcher, 3));
            Optional<LocalDate> date = toDate(year, second, first)
                    .or(() -> toDate(year, first, second));
            if (date.isPresent()) {
                return date;
            }
        }

        matcher = DAY_MONTH.matcher(normalized);
        while (matcher.find()) {
            int year = matcher.group(3) != null ? number(matcher, 3) : today.getYear();
            Optional<LocalDate> date = toDate(year, month(matcher.group(2)), number(matcher, 1));
            if (date.isPresent()) {
                return date;
            }
        }

        matcher = MONTH_DAY.matcher(normalized);
        while (matcher.find()) {
            int year = matcher.group(3) != null ? number(matcher, 3) : today.getYear();
            Optional<LocalDate> date = toDate(year, month(matcher.group(1)), number(matcher, 2));
            if (date.isPresent()) {
                return date;
            }
        }

        matcher = RELATIVE.matcher(normalized);
        if (matcher.find()) {
            switch (matcher.group(1)) {
                case "yesterday":
                    return Optional.of(today.minusDays(1));
                case "tomorrow":
                    return Optional.of(today.plusDays(1));
                default:
                    return Optional.of(today);
            }
        }
        return Optional.empty();
    }

    private static int number(Matcher matcher, int group) {
        return Integer.parseInt(matcher.group(group));
    }

    private static Integer month(String word) {
        return MONTHS.get(word.substring(0, 3));
    }

    private static int expandYear(int year) {
        return year < 100 ? 2000 + year : year;
    }

    private static Optional<LocalDate> toDate(int year, Integer month, int day) {
        if (month == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
