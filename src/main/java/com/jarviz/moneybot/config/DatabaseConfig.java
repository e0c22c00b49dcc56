package com.jarviz.moneybot.config;

import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DatabaseConfig {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseConfig.class);

    @Bean(destroyMethod = "close")
    public DataSource dataSource(DatabaseProperties properties) {
        properties.validate();

        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("jarviz-pg");
        dataSource.setJdbcUrl(properties.toJdbcUrl());
        dataSource.setUsername(properties.getUser().trim());
        dataSource.setPassword(properties.getPassword());
        dataSource.setMinimumIdle(properties.getMinIdle());
        dataSource.setMaximumPoolSize(properties.getMaxPoolSize());

        logger.info("Using PostgreSQL at {}:{}/{} (sslmode={}, pool {}..{})",
                properties.getHost(), properties.getPort(), properties.getName(),
                properties.getSslMode(), properties.getMinIdle(), properties.getMaxPoolSize());
        return dataSource;
    }
}
