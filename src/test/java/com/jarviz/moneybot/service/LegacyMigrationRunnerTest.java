package com.jarviz.moneybot.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.jarviz.moneybot.exception.MigrationException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteDataSource;

@ExtendWith(MockitoExtension.class)
class LegacyMigrationRunnerTest {

    @TempDir
    Path tempDir;

    @Mock
    private JdbcTemplate postgresTemplate;

    private LegacyMigrationRunner runner;
    private JdbcTemplate sqliteTemplate;

    @BeforeEach
    void setUp() {
        runner = new LegacyMigrationRunner(postgresTemplate, new LegacyRowNormalizer(new TagParser()));
        runner.setBatchSize(2);

        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("data.db"));
        sqliteTemplate = new JdbcTemplate(dataSource);
    }

    private void createLegacyTable() {
        sqliteTemplate.execute("CREATE TABLE transactions (id INTEGER PRIMARY KEY, user_id INTEGER, "
                + "category TEXT, amount REAL, currency TEXT, date TEXT, description TEXT, tags TEXT)");
    }

    @Test
    @SuppressWarnings("unchecked")
    void copiesRowsInBatches() {
        createLegacyTable();
        sqliteTemplate.update("INSERT INTO transactions VALUES (1, 42, 'food', 250, NULL, '13/11/2025', 'lunch', 'office')");
        sqliteTemplate.update("INSERT INTO transactions VALUES (2, 42, 'petrol', 500.5, 'INR', '2025-11-12', NULL, NULL)");
        sqliteTemplate.update("INSERT INTO transactions VALUES (3, 43, 'emi', 12000, 'INR', '2025-11-01', NULL, '[\"loan\"]')");

        int processed = runner.migrate(sqliteTemplate);

        assertThat(processed).isEqualTo(3);
        ArgumentCaptor<List<Object[]>> captor = ArgumentCaptor.forClass(List.class);
        verify(postgresTemplate, times(2)).batchUpdate(eq(LegacyMigrationRunner.INSERT_SQL), captor.capture());

        List<List<Object[]>> batches = captor.getAllValues();
        assertThat(batches.get(0)).hasSize(2);
        assertThat(batches.get(1)).hasSize(1);

        Object[] first = batches.get(0).get(0);
        assertThat(first[0]).isEqualTo(1L);
        assertThat(first[1]).isEqualTo(42L);
        assertThat(first[3]).isEqualTo(250.0);
        assertThat(first[4]).isEqualTo("INR");
        assertThat(first[5]).isEqualTo("2025-11-13");
        assertThat(first[7]).isEqualTo("[\"office\"]");
        assertThat(batches.get(1).get(0)[7]).isEqualTo("[\"loan\"]");
    }

    @Test
    void emptyLedgerInsertsNothing() {
        createLegacyTable();

        assertThat(runner.migrate(sqliteTemplate)).isZero();
        verifyNoInteractions(postgresTemplate);
    }

    @Test
    void missingTableFails() {
        assertThatThrownBy(() -> runner.migrate(sqliteTemplate))
                .isInstanceOf(MigrationException.class)
                .hasMessageContaining("after 0 rows");
    }
}
