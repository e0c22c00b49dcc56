package com.jarviz.moneybot.service;

import com.jarviz.moneybot.dto.LegacyTransactionRow;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Maps raw SQLite rows (column name -> value) to {@link LegacyTransactionRow}.
 * Missing columns are treated as NULL, so older ledgers without the extra columns still migrate.
 */
@Component
public class LegacyRowNormalizer {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("uuuu-M-d").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("d-M-uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("d/M/uuuu").withResolverStyle(ResolverStyle.STRICT));
    private static final DateTimeFormatter DATE_TIME_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-M-d H:m:s").withResolverStyle(ResolverStyle.STRICT);

    private final TagParser tagParser;

    public LegacyRowNormalizer(TagParser tagParser) {
        this.tagParser = tagParser;
    }

    public LegacyTransactionRow normalize(Map<String, Object> row) {
        LegacyTransactionRow normalized = new LegacyTransactionRow();
        normalized.setId(asLong(row.get("id")));
        normalized.setUserId(asLong(row.get("user_id")));
        normalized.setCategory(asString(row.get("category")));
        normalized.setAmount(asDouble(row.get("amount")));
        normalized.setCurrency(orDefault(asString(row.get("currency")), ExpenseService.DEFAULT_CURRENCY));
        normalized.setDate(normalizeDate(asString(row.get("date"))));
        normalized.setDescription(asString(row.get("description")));
        normalized.setTagsJson(tagParser.toJson(tagParser.parse(asString(row.get("tags")))));
        normalized.setMerchant(asString(row.get("merchant")));
        normalized.setPaymentMethod(asString(row.get("payment_method")));
        normalized.setTransactionType(orDefault(asString(row.get("transaction_type")), "expense"));
        normalized.setRecurring(asBoolean(row.get("is_recurring")));
        normalized.setRecurringPeriod(asString(row.get("recurring_period")));
        normalized.setStatus(orDefault(asString(row.get("status")), "paid"));
        normalized.setBillDueDate(normalizeDate(asString(row.get("bill_due_date"))));
        normalized.setAttachmentUrl(asString(row.get("attachment_url")));
        normalized.setCreatedAt(asString(row.get("created_at")));
        normalized.setUpdatedAt(asString(row.get("updated_at")));
        return normalized;
    }

    /**
     * Converts the known legacy date notations to ISO; anything else is returned unchanged.
     */
    String normalizeDate(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            Optional<LocalDate> parsed = tryParse(trimmed, format);
            if (parsed.isPresent()) {
                return parsed.get().toString();
            }
        }
        try {
            return LocalDateTime.parse(trimmed, DATE_TIME_FORMAT).toLocalDate().toString();
        } catch (DateTimeParseException e) {
            return value;
        }
    }

    private static Optional<LocalDate> tryParse(String value, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDate.parse(value, format));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static Long asLong(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.valueOf(value.toString().trim());
    }

    private static Double asDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return Double.valueOf(value.toString().trim());
    }

    private static boolean asBoolean(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue() != 0;
        }
        String text = value.toString().trim();
        return !text.isEmpty() && !"0".equals(text) && !"false".equalsIgnoreCase(text);
    }
}
