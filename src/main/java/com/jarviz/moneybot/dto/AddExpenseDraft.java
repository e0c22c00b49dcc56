package com.jarviz.moneybot.dto;

import java.time.LocalDate;

/**
 * Values collected so far by the interactive /add flow of one user.
 */
public class AddExpenseDraft {

    public enum Step {
        CATEGORY,
        AMOUNT,
        DATE,
        DESCRIPTION
    }

    private Step step;
    private String category;
    private Double amount;
    private LocalDate date;

    public AddExpenseDraft() {
        this.step = Step.CATEGORY;
    }

    public Step getStep() {
        return step;
    }

    public void setStep(Step step) {
        this.step = step;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public Double getAmount() {
        return amount;
    }

    public void setAmount(Double amount) {
        this.amount = amount;
    }

    public LocalDate getDate() {
        return date;
    }

    public void setDate(LocalDate date) {
        this.date = date;
    }
}
