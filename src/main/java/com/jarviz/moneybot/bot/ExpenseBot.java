package com.jarviz.moneybot.bot;

import com.jarviz.moneybot.config.BotConfig;
import com.jarviz.moneybot.dto.BotReply;
import com.jarviz.moneybot.service.ExpenseCommandService;
import java.io.ByteArrayInputStream;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.commands.SetMyCommands;
import org.telegram.telegrambots.meta.api.methods.send.SendDocument;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.commands.BotCommand;
import org.telegram.telegrambots.meta.api.objects.commands.scope.BotCommandScopeDefault;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;

@Component
@Profile("!migrate")
public class ExpenseBot extends TelegramLongPollingBot {

    private static final Logger logger = LoggerFactory.getLogger(ExpenseBot.class);

    static final String ERROR_REPLY = "❌ Something went wrong while processing your request. Please try again later.";

    private final BotConfig botConfig;
    private final ExpenseCommandService commandService;

    public ExpenseBot(BotConfig botConfig, ExpenseCommandService commandService) {
        super(botConfig.getBotToken());
        this.botConfig = botConfig;
        this.commandService = commandService;
    }

    @Override
    public void onUpdateReceived(Update update) {
        // Only text messages are handled, edits and callbacks are ignored
        if (!update.hasMessage() || !update.getMessage().hasText()) {
            return;
        }
        Message message = update.getMessage();
        long chatId = message.getChatId();
        Long userId = message.getFrom() != null ? message.getFrom().getId() : chatId;

        BotReply reply;
        try {
            reply = commandService.handle(userId, message.getText());
        } catch (Exception e) {
            logger.error("Error handling message from user {} in chat {}", userId, chatId, e);
            sendMessage(chatId, ERROR_REPLY);
            return;
        }

        if (reply.isEmpty()) {
            return;
        }
        if (reply.isDocument()) {
            sendDocument(chatId, reply.getDocument(), reply.getFileName());
        } else {
            sendMessage(chatId, reply.getText());
        }
    }

    /**
     * Publishes the command list shown in Telegram's command menu.
     */
    public void registerCommands() {
        List<BotCommand> commands = List.of(
                new BotCommand("add", "interactive add"),
                new BotCommand("quick", "one-line add: category amount [text] --desc \"...\""),
                new BotCommand("list", "last n items"),
                new BotCommand("summary", "totals for today, week, month or all"),
                new BotCommand("export", "get CSV"),
                new BotCommand("cancel", "stop the interactive add"),
                new BotCommand("help", "show help"));
        try {
            execute(new SetMyCommands(commands, new BotCommandScopeDefault(), null));
        } catch (TelegramApiException e) {
            logger.warn("Could not register bot commands: {}", e.getMessage());
        }
    }

    public void sendMessage(long chatId, String text) {
        SendMessage message = new SendMessage();
        message.setChatId(String.valueOf(chatId));
        message.setText(text);

        try {
            execute(message);
        } catch (TelegramApiException e) {
            logger.error("Error sending message to chat {}", chatId, e);
        }
    }

    private void sendDocument(long chatId, byte[] content, String fileName) {
        SendDocument document = new SendDocument();
        document.setChatId(String.valueOf(chatId));
        document.setDocument(new InputFile(new ByteArrayInputStream(content), fileName));

        try {
            execute(document);
            logger.info("Sent {} ({} bytes) to chat {}", fileName, content.length, chatId);
        } catch (TelegramApiException e) {
            logger.error("Error sending document {} to chat {}", fileName, chatId, e);
        }
    }

    @Override
    public String getBotUsername() {
        return botConfig.getBotUsername();
    }

    @Override
    public void clearWebhook() {
        try {
            super.clearWebhook();
        } catch (TelegramApiException e) {
            // 404 only means no webhook was set before
            if (e instanceof TelegramApiRequestException) {
                TelegramApiRequestException apiException = (TelegramApiRequestException) e;
                if (apiException.getErrorCode() != null && apiException.getErrorCode() == 404) {
                    logger.debug("No existing webhook to clear");
                    return;
                }
            }
            logger.warn("Error clearing webhook: {}", e.getMessage());
        }
    }
}
