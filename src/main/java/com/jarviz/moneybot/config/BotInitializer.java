package com.jarviz.moneybot.config;

import com.jarviz.moneybot.bot.ExpenseBot;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

/**
 * Starts long polling for {@link ExpenseBot} once the context is up. Registration happens
 * at most once even if the context is refreshed again.
 */
@Component
@Profile("!migrate")
public class BotInitializer {

    private static final Logger logger = LoggerFactory.getLogger(BotInitializer.class);

    static final int CONFLICT = 409;

    private final ExpenseBot expenseBot;
    private final AtomicBoolean started = new AtomicBoolean();

    public BotInitializer(ExpenseBot expenseBot) {
        this.expenseBot = expenseBot;
    }

    @EventListener(ContextRefreshedEvent.class)
    public void startPolling() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        String username = expenseBot.getBotUsername();
        // getUpdates is refused while a webhook is set
        expenseBot.clearWebhook();
        try {
            new TelegramBotsApi(DefaultBotSession.class).registerBot(expenseBot);
        } catch (TelegramApiException e) {
            started.set(false);
            if (isPollingConflict(e)) {
                throw new IllegalStateException("@" + username
                        + " is already polling from another process, stop it before starting this one", e);
            }
            throw new IllegalStateException("Could not start polling for @" + username, e);
        }
        expenseBot.registerCommands();
        logger.info("Polling started for @{}", username);
    }

    // Telegram answers 409 when two processes call getUpdates with one token
    static boolean isPollingConflict(TelegramApiException e) {
        if (e instanceof TelegramApiRequestException) {
            Integer errorCode = ((TelegramApiRequestException) e).getErrorCode();
            if (errorCode != null && errorCode == CONFLICT) {
                return true;
            }
        }
        return e.getMessage() != null && e.getMessage().contains("terminated by other getUpdates");
    }
}
