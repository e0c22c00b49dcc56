package com.jarviz.moneybot.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.jarviz.moneybot.dto.LegacyTransactionRow;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LegacyRowNormalizerTest {

    private final LegacyRowNormalizer normalizer = new LegacyRowNormalizer(new TagParser());

    @Test
    void minimalRowGetsDefaults() {
        Map<String, Object> row = new HashMap<>();
        row.put("id", 1);
        row.put("user_id", 123456789012L);
        row.put("category", "food");
        row.put("amount", 250);
        row.put("date", "2025-11-13");

        LegacyTransactionRow normalized = normalizer.normalize(row);

        assertThat(normalized.getId()).isEqualTo(1L);
        assertThat(normalized.getUserId()).isEqualTo(123456789012L);
        assertThat(normalized.getAmount()).isEqualTo(250.0);
        assertThat(normalized.getCurrency()).isEqualTo("INR");
        assertThat(normalized.getTransactionType()).isEqualTo("expense");
        assertThat(normalized.getStatus()).isEqualTo("paid");
        assertThat(normalized.isRecurring()).isFalse();
        assertThat(normalized.getTagsJson()).isNull();
        assertThat(normalized.getDate()).isEqualTo("2025-11-13");
    }

    @Test
    void tagsBecomeJsonArrays() {
        Map<String, Object> commaSeparated = new HashMap<>();
        commaSeparated.put("tags", "fuel, car");
        Map<String, Object> json = new HashMap<>();
        json.put("tags", "[\"emi\"]");
        Map<String, Object> blank = new HashMap<>();
        blank.put("tags", "");

        assertThat(normalizer.normalize(commaSeparated).getTagsJson()).isEqualTo("[\"fuel\",\"car\"]");
        assertThat(normalizer.normalize(json).getTagsJson()).isEqualTo("[\"emi\"]");
        assertThat(normalizer.normalize(blank).getTagsJson()).isNull();
    }

    @Test
    void legacyDateNotations() {
        assertThat(normalizer.normalizeDate("2025-11-13 18:30:00")).isEqualTo("2025-11-13");
        assertThat(normalizer.normalizeDate("13-11-2025")).isEqualTo("2025-11-13");
        assertThat(normalizer.normalizeDate("13/11/2025")).isEqualTo("2025-11-13");
        assertThat(normalizer.normalizeDate("Nov 13 2025")).isEqualTo("Nov 13 2025");
        assertThat(normalizer.normalizeDate("31/02/2025")).isEqualTo("31/02/2025");
        assertThat(normalizer.normalizeDate(null)).isNull();
    }

    @Test
    void recurringFlagFromSqliteInteger() {
        Map<String, Object> row = new HashMap<>();
        row.put("is_recurring", 1);
        row.put("bill_due_date", "05/12/2025");

        LegacyTransactionRow normalized = normalizer.normalize(row);

        assertThat(normalized.isRecurring()).isTrue();
        assertThat(normalized.getBillDueDate()).isEqualTo("2025-12-05");
    }

    @Test
    void insertParametersFollowColumnOrder() {
        Map<String, Object> row = new HashMap<>();
        row.put("id", 9);
        row.put("category", "emi");
        row.put("updated_at", "2025-11-13 10:00:00");

        Object[] parameters = normalizer.normalize(row).toInsertParameters();

        assertThat(parameters).hasSize(18);
        assertThat(parameters[0]).isEqualTo(9L);
        assertThat(parameters[2]).isEqualTo("emi");
        assertThat(parameters[4]).isEqualTo("INR");
        assertThat(parameters[17]).isEqualTo("2025-11-13 10:00:00");
    }
}
