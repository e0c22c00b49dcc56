package com.jarviz.moneybot.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the pooled PostgreSQL endpoint.
 * Bound from PGHOST, PGPORT, PGDATABASE, PGUSER, PGPASSWORD and PGSSLMODE
 * (see application.properties), which may also come from a .env file.
 */
@ConfigurationProperties(prefix = "jarviz.db")
public class DatabaseProperties {

    public static final int DEFAULT_PORT = 5432;
    public static final String DEFAULT_SSL_MODE = "require";

    private String host;
    private int port = DEFAULT_PORT;
    private String name;
    private String user;
    private String password;
    private String sslMode = DEFAULT_SSL_MODE;
    private int minIdle = 1;
    private int maxPoolSize = 10;

    /**
     * Fails when any required connection variable is missing.
     *
     * @throws IllegalStateException naming every missing variable
     */
    public void validate() {
        List<String> missing = new ArrayList<>();
        if (isBlank(host)) {
            missing.add("PGHOST");
        }
        if (isBlank(name)) {
            missing.add("PGDATABASE");
        }
        if (isBlank(user)) {
            missing.add("PGUSER");
        }
        if (isBlank(password)) {
            missing.add("PGPASSWORD");
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Please set " + String.join(", ", missing)
                    + " environment variables. Create a .env file or set them as environment variables.");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalStateException("PGPORT must be a valid TCP port, got " + port);
        }
    }

    public String toJdbcUrl() {
        StringBuilder url = new StringBuilder("jdbc:postgresql://")
                .append(host.trim())
                .append(':')
                .append(port)
                .append('/')
                .append(name.trim());
        if (!isBlank(sslMode)) {
            url.append("?sslmode=").append(sslMode.trim());
        }
        return url.toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getUser() {
        return user;
    }

    public void setUser(String user) {
        this.user = user;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getSslMode() {
        return sslMode;
    }

    public void setSslMode(String sslMode) {
        this.sslMode = sslMode;
    }

    public int getMinIdle() {
        return minIdle;
    }

    public void setMinIdle(int minIdle) {
        this.minIdle = minIdle;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
        this.maxPoolSize = maxPoolSize;
    }
}
