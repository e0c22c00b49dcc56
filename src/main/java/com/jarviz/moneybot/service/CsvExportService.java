package com.jarviz.moneybot.service;

import com.jarviz.moneybot.entity.ExpenseTransaction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class CsvExportService {

    public static final String FILE_NAME = "expenses.csv";
    static final String HEADER = "id,date,category,amount,currency,description";

    public String toCsv(List<ExpenseTransaction> rows) {
        StringBuilder csv = new StringBuilder(HEADER);
        for (ExpenseTransaction row : rows) {
            csv.append('\n')
                    .append(row.getId()).append(',')
                    .append(row.getDate()).append(',')
                    .append(escapeIfNeeded(row.getCategory())).append(',')
                    .append(AmountParser.format(row.getAmount())).append(',')
                    .append(escapeIfNeeded(row.getCurrency() != null ? row.getCurrency() : "")).append(',')
                    .append(quote(row.getDescription()));
        }
        return csv.toString();
    }

    public byte[] toCsvBytes(List<ExpenseTransaction> rows) {
        return toCsv(rows).getBytes(StandardCharsets.UTF_8);
    }

    // description is always quoted, other columns only when they would break the row
    private static String quote(String value) {
        String safe = value == null ? "" : value;
        return '"' + safe.replace("\"", "\"\"") + '"';
    }

    private static String escapeIfNeeded(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return quote(value);
        }
        return value;
    }
}
