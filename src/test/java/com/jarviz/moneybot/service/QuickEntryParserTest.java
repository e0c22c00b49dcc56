package com.jarviz.moneybot.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.jarviz.moneybot.dto.QuickEntry;
import java.time.LocalDate;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class QuickEntryParserTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 11, 14);

    private final QuickEntryParser parser = new QuickEntryParser(new AmountParser(), new DateTextParser());

    @Test
    void fullEntry() {
        Optional<QuickEntry> entry = parser.parse("food 1,250.50 yesterday --desc \"team lunch\"", TODAY);

        assertThat(entry).isPresent();
        assertThat(entry.get().getCategory()).isEqualTo("food");
        assertThat(entry.get().getAmount()).isEqualTo(1250.5);
        assertThat(entry.get().getDate()).isEqualTo(LocalDate.of(2025, 11, 13));
        assertThat(entry.get().getDescription()).isEqualTo("team lunch");
    }

    @Test
    void minimalEntryDefaultsToToday() {
        QuickEntry entry = parser.parse("petrol 500", TODAY).orElseThrow();

        assertThat(entry.getCategory()).isEqualTo("petrol");
        assertThat(entry.getAmount()).isEqualTo(500.0);
        assertThat(entry.getDate()).isEqualTo(TODAY);
        assertThat(entry.getDescription()).isNull();
    }

    @Test
    void dateInFreeText() {
        QuickEntry entry = parser.parse("credit-card 99.5 paid on 2025-11-01", TODAY).orElseThrow();

        assertThat(entry.getCategory()).isEqualTo("credit-card");
        assertThat(entry.getDate()).isEqualTo(LocalDate.of(2025, 11, 1));
    }

    @Test
    void dateInsideDescriptionIsNotUsed() {
        QuickEntry entry = parser.parse("chai 20 --desc \"for 12/11/2025 meeting\"", TODAY).orElseThrow();

        assertThat(entry.getDate()).isEqualTo(TODAY);
        assertThat(entry.getDescription()).isEqualTo("for 12/11/2025 meeting");
    }

    @Test
    void freeTextWithoutDateKeepsToday() {
        QuickEntry entry = parser.parse("food 120 3 decent meals", TODAY).orElseThrow();

        assertThat(entry.getDate()).isEqualTo(TODAY);
    }

    @Test
    void unicodeCategory() {
        assertThat(parser.parse("खाना 150", TODAY)).isPresent();
    }

    @Test
    void malformedPayloads() {
        assertThat(parser.parse("", TODAY)).isEmpty();
        assertThat(parser.parse("food", TODAY)).isEmpty();
        assertThat(parser.parse("food lots", TODAY)).isEmpty();
        assertThat(parser.parse("food ,,,", TODAY)).isEmpty();
        assertThat(parser.parse(null, TODAY)).isEmpty();
    }
}
