package com.jarviz.moneybot;

import com.jarviz.moneybot.config.DatabaseProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import jakarta.annotation.PreDestroy;

@SpringBootApplication
@EnableConfigurationProperties(DatabaseProperties.class)
public class JarvizBotApplication {

    private static final Logger logger = LoggerFactory.getLogger(JarvizBotApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(JarvizBotApplication.class, args);
    }

    @PreDestroy
    public void onShutdown() {
        logger.info("Application is shutting down. Releasing database connections...");
        // Spring Boot closes the Hikari pool together with the context
    }
}
