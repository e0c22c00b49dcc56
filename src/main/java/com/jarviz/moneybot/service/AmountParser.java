package com.jarviz.moneybot.service;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class AmountParser {

    /**
     * Parses free text typed as an amount. Everything except digits, '.' and '-' is dropped,
     * so "₹1,250.50" and "1250.5 rs" both give 1250.5.
     */
    public Optional<Double> parseLenient(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return parse(text.replaceAll("[^\\d.\\-]", ""));
    }

    /**
     * Parses an amount with optional thousands separators, e.g. "1,250.50".
     */
    public Optional<Double> parseGrouped(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return parse(text.replace(",", ""));
    }

    private Optional<Double> parse(String cleaned) {
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        try {
            double value = Double.parseDouble(cleaned);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return Optional.empty();
            }
            return Optional.of(value);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Formats an amount the way it is echoed back to users: at least one fraction digit, at most two.
     */
    public static String format(Double amount) {
        if (amount == null) {
            return "";
        }
        // DecimalFormat is not thread safe
        DecimalFormat decimalFormat = new DecimalFormat("0.0#", DecimalFormatSymbols.getInstance(Locale.ROOT));
        return decimalFormat.format(amount);
    }
}
