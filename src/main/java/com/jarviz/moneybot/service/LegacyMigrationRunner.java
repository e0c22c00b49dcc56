package com.jarviz.moneybot.service;

import com.jarviz.moneybot.dto.LegacyTransactionRow;
import com.jarviz.moneybot.exception.MigrationException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.sqlite.SQLiteDataSource;

/**
 * One-shot copy of the legacy SQLite ledger into PostgreSQL.
 * Only active with the "migrate" profile, in which the Telegram bot is not started.
 * Rows whose id already exists in PostgreSQL are skipped, so the run can be repeated.
 */
@Service
@Profile("migrate")
public class LegacyMigrationRunner implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(LegacyMigrationRunner.class);

    static final String INSERT_SQL = """
            INSERT INTO transactions
            (id, user_id, category, amount, currency, date, description, tags, merchant,
             payment_method, transaction_type, is_recurring, recurring_period, status,
             bill_due_date, attachment_url, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, CAST(? AS DATE), ?, CAST(? AS JSONB), ?,
                    ?, ?, ?, ?, ?,
                    CAST(? AS DATE), ?,
                    COALESCE(CAST(? AS TIMESTAMP), CURRENT_TIMESTAMP),
                    COALESCE(CAST(? AS TIMESTAMP), CURRENT_TIMESTAMP))
            ON CONFLICT (id) DO NOTHING""";

    private final JdbcTemplate postgresTemplate;
    private final LegacyRowNormalizer normalizer;

    @Value("${migration.sqlite.path:data.db}")
    private String sqlitePath;

    @Value("${migration.batch-size:500}")
    private int batchSize;

    public LegacyMigrationRunner(JdbcTemplate postgresTemplate, LegacyRowNormalizer normalizer) {
        this.postgresTemplate = postgresTemplate;
        this.normalizer = normalizer;
    }

    @Override
    public void run(String... args) {
        Path path = Path.of(sqlitePath);
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("SQLite ledger not found at " + path.toAbsolutePath()
                    + ". Set SQLITE_PATH to the legacy data.db file.");
        }
        SQLiteDataSource sqlite = new SQLiteDataSource();
        sqlite.setUrl("jdbc:sqlite:" + path);
        sqlite.setReadOnly(true);

        logger.info("Migrating transactions from {} in batches of {}", path.toAbsolutePath(), batchSize);
        int inserted = migrate(new JdbcTemplate(sqlite));
        logger.info("Migration finished. {} rows processed.", inserted);
    }

    /**
     * Streams every legacy row into PostgreSQL.
     *
     * @return number of rows sent to PostgreSQL, including ones skipped as duplicates
     */
    public int migrate(JdbcTemplate sqliteTemplate) {
        ColumnMapRowMapper rowMapper = new ColumnMapRowMapper();
        List<Object[]> batch = new ArrayList<>(batchSize);
        int[] processed = {0};

        try {
            sqliteTemplate.query("SELECT * FROM transactions", rs -> {
                Map<String, Object> row = rowMapper.mapRow(rs, rs.getRow());
                LegacyTransactionRow normalized = normalizer.normalize(row);
                batch.add(normalized.toInsertParameters());
                if (batch.size() >= batchSize) {
                    processed[0] += flush(batch);
                    logger.info("Inserted {} rows...", processed[0]);
                }
            });
            if (!batch.isEmpty()) {
                processed[0] += flush(batch);
                logger.info("Inserted {} rows...", processed[0]);
            }
        } catch (DataAccessException e) {
            throw new MigrationException("Migration stopped after " + processed[0] + " rows", e);
        }
        return processed[0];
    }

    private int flush(List<Object[]> batch) {
        postgresTemplate.batchUpdate(INSERT_SQL, new ArrayList<>(batch));
        int size = batch.size();
        batch.clear();
        return size;
    }

    void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }
}
