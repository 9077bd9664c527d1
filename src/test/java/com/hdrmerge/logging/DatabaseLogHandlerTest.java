package com.hdrmerge.logging;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatabaseLogHandlerTest {

    private static final String JDBC_URL = "jdbc:h2:mem:batch-logs;MODE=PostgreSQL;DATABASE_TO_UPPER=false;DB_CLOSE_DELAY=-1";
    private static final String JDBC_USER = "sa";
    private static final String JDBC_PASS = "";

    @BeforeAll
    static void setUpDatabase() throws SQLException {
        try {
            Class.forName("org.h2.Driver");
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("H2 driver not found on classpath", e);
        }
        System.setProperty("hdrmerge.logging.jdbc.url", JDBC_URL);
        System.setProperty("hdrmerge.logging.jdbc.user", JDBC_USER);
        System.setProperty("hdrmerge.logging.jdbc.pass", JDBC_PASS);
        System.setProperty("hdrmerge.logging.jdbc.poolSize", "2");

        try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
             Statement statement = connection.createStatement()) {
            statement.execute("DROP TABLE IF EXISTS batch_logs");
            statement.execute("""
                CREATE TABLE batch_logs (
                    logged_at   TIMESTAMP NOT NULL,
                    level       VARCHAR(16) NOT NULL,
                    logger      VARCHAR(128),
                    message     TEXT,
                    run_id      VARCHAR(64),
                    thread_name VARCHAR(64),
                    host        VARCHAR(128),
                    thrown_type VARCHAR(256),
                    thrown_msg  TEXT
                )
                """);
        }
    }

    @AfterEach
    void clearTable() throws SQLException {
        try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
             Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM batch_logs");
        }
    }

    @AfterAll
    static void tearDown() {
        System.clearProperty("hdrmerge.logging.jdbc.url");
        System.clearProperty("hdrmerge.logging.jdbc.user");
        System.clearProperty("hdrmerge.logging.jdbc.pass");
        System.clearProperty("hdrmerge.logging.jdbc.poolSize");
    }

    @Test
    void publishPersistsFormattedRecordWithRunId() throws Exception {
        DatabaseLogHandler handler = new DatabaseLogHandler();
        try {
            LogRecord record = new LogRecord(Level.INFO, "Bracket {0} merged in {1}");
            record.setLoggerName("test.logger");
            record.setParameters(new Object[]{"003", "12s"});

            handler.publish(record);
            awaitRows(1);

            try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
                 PreparedStatement statement = connection.prepareStatement(
                     "SELECT level, logger, message, run_id, thread_name, thrown_type FROM batch_logs")) {
                ResultSet resultSet = statement.executeQuery();
                assertTrue(resultSet.next(), "No log record persisted");
                assertEquals("INFO", resultSet.getString("level"));
                assertEquals("test.logger", resultSet.getString("logger"));
                assertEquals("Bracket 003 merged in 12s", resultSet.getString("message"));
                assertEquals(handler.runId(), resultSet.getString("run_id"));
                assertTrue(resultSet.getString("thread_name").startsWith("thread-"));
                assertNull(resultSet.getString("thrown_type"));
            }
        } finally {
            handler.close();
        }
    }

    @Test
    void thrownExceptionIsRecorded() throws Exception {
        DatabaseLogHandler handler = new DatabaseLogHandler();
        try {
            LogRecord record = new LogRecord(Level.SEVERE, "Bracket 001 failed");
            record.setLoggerName("test.logger");
            record.setThrown(new IOException("disk full"));

            handler.publish(record);
            awaitRows(1);

            try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
                 PreparedStatement statement = connection.prepareStatement(
                     "SELECT level, thrown_type, thrown_msg FROM batch_logs")) {
                ResultSet resultSet = statement.executeQuery();
                assertTrue(resultSet.next());
                assertEquals("SEVERE", resultSet.getString("level"));
                assertEquals("java.io.IOException", resultSet.getString("thrown_type"));
                assertEquals("disk full", resultSet.getString("thrown_msg"));
            }
        } finally {
            handler.close();
        }
    }

    private static void awaitRows(int expected) throws SQLException, InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            if (countRows() >= expected) {
                return;
            }
            Thread.sleep(50);
        }
        assertEquals(expected, countRows(), "log rows not written in time");
    }

    private static int countRows() throws SQLException {
        try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT COUNT(*) FROM batch_logs")) {
            resultSet.next();
            return resultSet.getInt(1);
        }
    }
}
