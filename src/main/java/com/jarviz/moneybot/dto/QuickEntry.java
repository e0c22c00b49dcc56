package com.jarviz.moneybot.dto;

import java.time.LocalDate;

/**
 * Expense parsed from a one-line /quick command.
 */
public class QuickEntry {

    private final String category;
    private final double amount;
    private final LocalDate date;
    private final String description;

    public QuickEntry(String category, double amount, LocalDate date, String description) {
        this.category = category;
        this.amount = amount;
        this.date = date;
        this.description = description;
    }

    public String getCategory() {
        return category;
    }

    public double getAmount() {
        return amount;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getDescription() {
        return description;
    }
}
