package com.jarviz.moneybot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BotConfig {

    static final String MISSING_TOKEN_MESSAGE =
            "Bot token not provided. Set BOT_TOKEN env var or put bot_token=... in credentials.txt";

    @Value("${telegram.bot.token:}")
    private String botToken;

    @Value("${telegram.bot.username:jarviz_money_control_bot}")
    private String botUsername;

    public BotConfig() {
    }

    public BotConfig(String botToken, String botUsername) {
        this.botToken = botToken;
        this.botUsername = botUsername;
    }

    public String getBotToken() {
        if (botToken == null || botToken.isBlank()) {
            throw new IllegalStateException(MISSING_TOKEN_MESSAGE);
        }
        return botToken.trim();
    }

    public String getBotUsername() {
        if (botUsername == null || botUsername.isBlank()) {
            throw new IllegalStateException("telegram.bot.username property is not set");
        }
        return botUsername.trim();
    }
}
