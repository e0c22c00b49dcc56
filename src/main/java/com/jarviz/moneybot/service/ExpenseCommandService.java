package com.jarviz.moneybot.service;

import com.jarviz.moneybot.config.BotConfig;
import com.jarviz.moneybot.dto.AddExpenseDraft;
import com.jarviz.moneybot.dto.BotReply;
import com.jarviz.moneybot.dto.QuickEntry;
import com.jarviz.moneybot.entity.ExpenseTransaction;
import com.jarviz.moneybot.repository.CategoryTotal;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns one incoming text message into the bot's reply. Telegram specifics stay in the bot class.
 */
@Service
public class ExpenseCommandService {

    private static final Logger logger = LoggerFactory.getLogger(ExpenseCommandService.class);

    static final int DEFAULT_LIST_SIZE = 10;
    static final int MAX_LIST_SIZE = 100;

    static final String HELP = """
            Hi! I'm your Expense Tracker Bot.

            Commands:
            /add - interactive add
            /cancel - stop the interactive add
            /quick <category> <amount> [free text] --desc "your description"
            /list [n] - last n items
            /summary [today|week|month|all]
            /export - get CSV
            /help - this message""";

    static final String QUICK_USAGE = "Use: /quick <category> <amount> [free text] --desc \"...\"";
    static final String ASK_CATEGORY = "Enter category (e.g. food, petrol, creditcard, emi):";
    static final String ASK_AMOUNT = "Enter amount (numbers):";
    static final String BAD_AMOUNT = "Couldn't parse amount. Enter numeric amount:";
    static final String ASK_DATE = "Enter date (YYYY-MM-DD) or text like 'today' or '2025-11-13':";
    static final String BAD_DATE = "Couldn't parse date. Please try again:";
    static final String ASK_DESCRIPTION = "Enter description (optional):";
    static final String SAVED = "Saved ✅";
    static final String CANCELLED = "Cancelled.";
    static final String NO_TRANSACTIONS = "No transactions yet.";
    static final String NO_PERIOD_TRANSACTIONS = "No transactions for the selected period.";
    static final String NO_EXPORT_DATA = "No data to export.";
    static final String UNKNOWN_COMMAND = "Unknown command. Send /help to see what I can do.";
    static final String NOT_A_COMMAND = "Send /add to record an expense or /help to see all commands.";

    private final ExpenseService expenseService;
    private final ConversationStateService conversationStateService;
    private final QuickEntryParser quickEntryParser;
    private final AmountParser amountParser;
    private final DateTextParser dateTextParser;
    private final CsvExportService csvExportService;
    private final BotConfig botConfig;

    public ExpenseCommandService(ExpenseService expenseService,
                                 ConversationStateService conversationStateService,
                                 QuickEntryParser quickEntryParser,
                                 AmountParser amountParser,
                                 DateTextParser dateTextParser,
                                 CsvExportService csvExportService,
                                 BotConfig botConfig) {
        this.expenseService = expenseService;
        this.conversationStateService = conversationStateService;
        this.quickEntryParser = quickEntryParser;
        this.amountParser = amountParser;
        this.dateTextParser = dateTextParser;
        this.csvExportService = csvExportService;
        this.botConfig = botConfig;
    }

    public BotReply handle(Long userId, String messageText) {
        String text = messageText == null ? "" : messageText.trim();
        if (!text.startsWith("/")) {
            if (conversationStateService.isActive(userId)) {
                return continueAdd(userId, text);
            }
            return BotReply.text(NOT_A_COMMAND);
        }

        String[] parts = text.split("\\s+", 2);
        if (!addressedToThisBot(parts[0])) {
            logger.debug("Ignoring {} from user {}, addressed to another bot", parts[0], userId);
            return BotReply.none();
        }
        String command = commandName(parts[0]);
        String arguments = parts.length > 1 ? parts[1].trim() : "";

        switch (command) {
            case "/start":
            case "/help":
                return BotReply.text(HELP);
            case "/add":
                conversationStateService.start(userId);
                return BotReply.text(ASK_CATEGORY);
            case "/cancel":
                conversationStateService.clear(userId);
                return BotReply.text(CANCELLED);
            case "/quick":
                return quick(userId, arguments);
            case "/list":
                return list(userId, arguments);
            case "/summary":
                return summary(userId, arguments);
            case "/export":
                return export(userId);
            default:
                logger.debug("Unknown command {} from user {}", command, userId);
                return BotReply.text(UNKNOWN_COMMAND);
        }
    }

    // In group chats "/add@other_bot" belongs to another bot
    private boolean addressedToThisBot(String token) {
        int at = token.indexOf('@');
        if (at < 0) {
            return true;
        }
        return token.substring(at + 1).equalsIgnoreCase(botConfig.getBotUsername());
    }

    // "/list@jarviz_money_control_bot" -> "/list"
    private static String commandName(String token) {
        int at = token.indexOf('@');
        String name = at > 0 ? token.substring(0, at) : token;
        return name.toLowerCase(Locale.ROOT);
    }

    private BotReply continueAdd(Long userId, String text) {
        AddExpenseDraft draft = conversationStateService.get(userId);
        switch (draft.getStep()) {
            case CATEGORY:
                if (text.isEmpty()) {
                    return BotReply.text(ASK_CATEGORY);
                }
                draft.setCategory(text);
                draft.setStep(AddExpenseDraft.Step.AMOUNT);
                return BotReply.text(ASK_AMOUNT);
            case AMOUNT:
                Optional<Double> amount = amountParser.parseLenient(text);
                if (amount.isEmpty()) {
                    return BotReply.text(BAD_AMOUNT);
                }
                draft.setAmount(amount.get());
                draft.setStep(AddExpenseDraft.Step.DATE);
                return BotReply.text(ASK_DATE);
            case DATE:
                Optional<LocalDate> date = dateTextParser.parse(text, expenseService.today());
                if (date.isEmpty()) {
                    return BotReply.text(BAD_DATE);
                }
                draft.setDate(date.get());
                draft.setStep(AddExpenseDraft.Step.DESCRIPTION);
                return BotReply.text(ASK_DESCRIPTION);
            case DESCRIPTION:
            default:
                expenseService.record(userId, draft.getCategory(), draft.getAmount(), draft.getDate(),
                        text.isEmpty() ? null : text);
                conversationStateService.clear(userId);
                return BotReply.text(SAVED);
        }
    }

    private BotReply quick(Long userId, String payload) {
        Optional<QuickEntry> parsed = quickEntryParser.parse(payload, expenseService.today());
        if (parsed.isEmpty()) {
            return BotReply.text(QUICK_USAGE);
        }
        QuickEntry entry = parsed.get();
        expenseService.record(userId, entry.getCategory(), entry.getAmount(), entry.getDate(), entry.getDescription());
        return BotReply.text("Saved: " + entry.getCategory() + " " + AmountParser.format(entry.getAmount())
                + " on " + entry.getDate() + " ✅");
    }

    private BotReply list(Long userId, String arguments) {
        int limit = DEFAULT_LIST_SIZE;
        if (!arguments.isEmpty()) {
            try {
                limit = Integer.parseInt(arguments.split("\\s+")[0]);
            } catch (NumberFormatException e) {
                logger.debug("Ignoring non-numeric /list argument '{}'", arguments);
            }
        }
        if (limit < 1) {
            limit = DEFAULT_LIST_SIZE;
        }
        limit = Math.min(limit, MAX_LIST_SIZE);

        List<ExpenseTransaction> rows = expenseService.recent(userId, limit);
        if (rows.isEmpty()) {
            return BotReply.text(NO_TRANSACTIONS);
        }
        String lines = rows.stream()
                .map(row -> row.getDate() + " | " + row.getCategory() + " | " + AmountParser.format(row.getAmount())
                        + " | " + (row.getDescription() != null ? row.getDescription() : "")
                        + " (id:" + row.getId() + ")")
                .collect(Collectors.joining("\n"));
        return BotReply.text(lines);
    }

    private BotReply summary(Long userId, String arguments) {
        String periodText = arguments.isEmpty() ? null : arguments.split("\\s+")[0];
        List<CategoryTotal> totals = expenseService.summary(userId, SummaryPeriod.fromText(periodText));
        if (totals.isEmpty()) {
            return BotReply.text(NO_PERIOD_TRANSACTIONS);
        }
        String lines = totals.stream()
                .map(total -> total.getCategory() + " : " + AmountParser.format(total.getTotal()))
                .collect(Collectors.joining("\n"));
        return BotReply.text("Summary:\n" + lines);
    }

    private BotReply export(Long userId) {
        List<ExpenseTransaction> rows = expenseService.exportRows(userId);
        if (rows.isEmpty()) {
            return BotReply.text(NO_EXPORT_DATA);
        }
        logger.info("Exporting {} transactions for user {}", rows.size(), userId);
        return BotReply.document(csvExportService.toCsvBytes(rows), CsvExportService.FILE_NAME);
    }
}
