package com.agenteval.repository;

import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class EvaluatorSchemaMigrationFlywayTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    @Test
    void freshMigrationCreatesTablesConstraintsAndIndexes() throws SQLException {
        migrate();

        assertTrue(tableExists("tasks"));
        assertTrue(tableExists("evaluations"));
        assertTrue(tableExists("agent_results"));
        assertTrue(columnUsesType("tasks", "config_json", "jsonb"));
        assertTrue(columnUsesType("evaluations", "agent_status", "jsonb"));
        assertTrue(columnUsesType("agent_results", "breakdown", "jsonb"));
        assertTrue(columnUsesType("agent_results", "score", "int4"));

        assertTrue(constraintExists("uk_agent_results_evaluation_agent"));
        assertTrue(constraintExists("ck_agent_results_score"));
        assertTrue(constraintExists("ck_evaluations_status"));
        assertTrue(constraintExists("ck_tasks_evaluation_strategy"));

        assertTrue(indexExists("idx_evaluations_status_created_at"));
        assertTrue(indexExists("idx_evaluations_task_id"));
        assertTrue(indexExists("idx_agent_results_agent_status"));
    }

    @Test
    void secondResultForSameAgentIsRejected() throws SQLException {
        migrate();
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute("""
                    INSERT INTO tasks (task_id, name, config_json)
                    VALUES ('dup-task', 'Duplicate check', '{}'::jsonb)
                    ON CONFLICT DO NOTHING
                    """);
            statement.execute("""
                    INSERT INTO evaluations (evaluation_id, task_id, agents, agent_status)
                    VALUES ('eval-dup', 'dup-task', '["claude"]'::jsonb, '{"claude":"PENDING"}'::jsonb)
                    ON CONFLICT DO NOTHING
                    """);
            statement.execute("""
                    INSERT INTO agent_results (result_id, evaluation_id, agent_name, score)
                    VALUES (gen_random_uuid(), 'eval-dup', 'claude', 80)
                    """);

            assertThrows(SQLException.class, () -> statement.execute("""
                    INSERT INTO agent_results (result_id, evaluation_id, agent_name, score)
                    VALUES (gen_random_uuid(), 'eval-dup', 'claude', 90)
                    """));
        }
        assertEquals(1, countRows("SELECT COUNT(*) FROM agent_results WHERE evaluation_id = ?", "eval-dup"));
    }

    private static void migrate() {
        Flyway.configure()
                .dataSource(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword())
                .locations("classpath:db/migration")
                .load()
                .migrate();
    }

    private static boolean tableExists(String tableName) throws SQLException {
        return countRows(
                "SELECT COUNT(*) FROM information_schema.tables WHERE table_schema = 'public' AND table_name = ?",
                tableName
        ) == 1;
    }

    private static boolean columnUsesType(String tableName, String columnName, String udtName) throws SQLException {
        String sql = "SELECT COUNT(*) FROM information_schema.columns "
                + "WHERE table_schema = 'public' AND table_name = ? AND column_name = ? AND udt_name = ?";
        try (Connection connection = openConnection();
             PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setString(1, tableName);
            preparedStatement.setString(2, columnName);
            preparedStatement.setString(3, udtName);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                resultSet.next();
                return resultSet.getInt(1) == 1;
            }
        }
    }

    private static boolean indexExists(String indexName) throws SQLException {
        return countRows("SELECT COUNT(*) FROM pg_indexes WHERE schemaname = 'public' AND indexname = ?", indexName) == 1;
    }

    private static boolean constraintExists(String constraintName) throws SQLException {
        return countRows("SELECT COUNT(*) FROM pg_constraint WHERE conname = ?", constraintName) == 1;
    }

    private static int countRows(String sql, String arg) throws SQLException {
        try (Connection connection = openConnection();
             PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setString(1, arg);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                resultSet.next();
                return resultSet.getInt(1);
            }
        }
    }

    private static Connection openConnection() throws SQLException {
        return DriverManager.getConnection(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
    }
}
