package com.jarviz.moneybot.service;

import com.jarviz.moneybot.dto.QuickEntry;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Parses the payload of {@code /quick <category> <amount> [free text] --desc "..."}.
 */
@Component
public class QuickEntryParser {

    private static final Pattern QUICK = Pattern.compile(
            "(?<category>[\\w-]+)\\s+(?<amount>[\\d,]+(?:\\.\\d+)?)\\s*(?<rest>.*)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS | Pattern.DOTALL);
    private static final Pattern DESCRIPTION = Pattern.compile("--desc\\s+\"([^\"]+)\"");

    private final AmountParser amountParser;
    private final DateTextParser dateTextParser;

    public QuickEntryParser(AmountParser amountParser, DateTextParser dateTextParser) {
        this.amountParser = amountParser;
        this.dateTextParser = dateTextParser;
    }

    /**
     * @param payload command text without the leading "/quick"
     * @param today   date used when the free text carries none
     */
    public Optional<QuickEntry> parse(String payload, LocalDate today) {
        if (payload == null) {
            return Optional.empty();
        }
        Matcher matcher = QUICK.matcher(payload.trim());
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }
        Optional<Double> amount = amountParser.parseGrouped(matcher.group("amount"));
        if (amount.isEmpty()) {
            return Optional.empty();
        }

        String rest = matcher.group("rest").trim();
        String description = null;
        Matcher descMatcher = DESCRIPTION.matcher(rest);
        if (descMatcher.find()) {
            description = descMatcher.group(1);
            rest = rest.substring(0, descMatcher.start()) + rest.substring(descMatcher.end());
        }

        LocalDate date = dateTextParser.parse(rest, today).orElse(today);
        return Optional.of(new QuickEntry(matcher.group("category"), amount.get(), date, description));
    }
}
