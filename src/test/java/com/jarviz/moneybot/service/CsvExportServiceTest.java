package com.jarviz.moneybot.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.jarviz.moneybot.entity.ExpenseTransaction;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class CsvExportServiceTest {

    private final CsvExportService csvExportService = new CsvExportService();

    @Test
    void writesHeaderAndQuotedDescriptions() {
        List<ExpenseTransaction> rows = List.of(
                new ExpenseTransaction(1L, 42L, "food", 250.0, "INR", LocalDate.of(2025, 11, 1), "the \"big\" lunch"),
                new ExpenseTransaction(2L, 42L, "petrol", 1250.5, "INR", LocalDate.of(2025, 11, 2), null));

        String csv = csvExportService.toCsv(rows);

        assertThat(csv.split("\n")).containsExactly(
                "id,date,category,amount,currency,description",
                "1,2025-11-01,food,250.0,INR,\"the \"\"big\"\" lunch\"",
                "2,2025-11-02,petrol,1250.5,INR,\"\"");
    }

    @Test
    void categoryWithCommaIsQuoted() {
        List<ExpenseTransaction> rows = List.of(
                new ExpenseTransaction(3L, 42L, "bills, misc", 10.0, "INR", LocalDate.of(2025, 11, 3), "x"));

        assertThat(csvExportService.toCsv(rows)).endsWith("3,2025-11-03,\"bills, misc\",10.0,INR,\"x\"");
    }

    @Test
    void bytesAreUtf8() {
        List<ExpenseTransaction> rows = List.of(
                new ExpenseTransaction(4L, 42L, "chai", 20.0, "INR", LocalDate.of(2025, 11, 4), "₹ chai"));

        byte[] bytes = csvExportService.toCsvBytes(rows);

        assertThat(new String(bytes, StandardCharsets.UTF_8)).contains("\"₹ chai\"");
    }
}
