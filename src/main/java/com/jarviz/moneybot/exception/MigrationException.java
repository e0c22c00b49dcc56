package com.jarviz.moneybot.exception;

/**
 * Thrown when the legacy SQLite ledger cannot be read or copied into PostgreSQL.
 */
public class MigrationException extends RuntimeException {

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
