package com.hdrmerge.logging;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.text.MessageFormat;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Ships JUL records of a batch run to a shared JDBC database so long unattended runs on
 * several workstations can be reviewed in one place. Records are queued and written in
 * small JDBC batches by a daemon thread; every row carries the run id of this process.
 */
public final class DatabaseLogHandler extends Handler {

    private static final String INSERT_SQL = """
        INSERT INTO batch_logs (
            logged_at,
            level,
            logger,
            message,
            run_id,
            thread_name,
            host,
            thrown_type,
            thrown_msg
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private static final int MAX_BATCH = 64;

    private final BlockingQueue<LogRecord> queue = new LinkedBlockingQueue<>(2048);
    private final HikariDataSource dataSource;
    private final String hostName;
    private final String runId;
    private final Thread worker;

    private volatile boolean running = true;

    public DatabaseLogHandler() {
        DbConfig config = DbConfig.load();
        if (!config.enabled()) {
            throw new IllegalStateException("no JDBC url configured for batch logs");
        }
        this.dataSource = createDataSource(config);
        this.hostName = resolveHostName();
        this.runId = UUID.randomUUID().toString();
        this.worker = new Thread(this::drainLoop, "batch-log-writer");
        this.worker.setDaemon(true);
        this.worker.start();
        setLevel(Level.ALL);
    }

    public String runId() {
        return runId;
    }

    private void drainLoop() {
        List<LogRecord> pending = new ArrayList<>(MAX_BATCH);
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                LogRecord first = queue.poll(1, TimeUnit.SECONDS);
                if (first == null) {
                    continue;
                }
                pending.add(first);
                queue.drainTo(pending, MAX_BATCH - 1);
                writeRecords(pending);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
            } catch (SQLException ex) {
                System.err.println("Batch log write failed: " + ex.getMessage());
            } finally {
                pending.clear();
            }
        }

        List<LogRecord> remaining = new ArrayList<>();
        queue.drainTo(remaining);
        if (remaining.isEmpty()) {
            return;
        }
        try {
            writeRecords(remaining);
        } catch (SQLException ex) {
            System.err.println("Batch log shutdown write failed: " + ex.getMessage());
        }
    }

    @Override
    public void publish(LogRecord record) {
        Objects.requireNonNull(record);
        if (!isLoggable(record) || !running) {
            return;
        }
        if (!queue.offer(record)) {
            // drop the oldest entry rather than blocking a worker thread
            queue.poll();
            queue.offer(record);
        }
    }

    @Override
    public void flush() {
        // records are persisted asynchronously
    }

    @Override
    public void close() throws SecurityException {
        running = false;
        worker.interrupt();
        try {
            worker.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
        dataSource.close();
    }

    private void writeRecords(List<LogRecord> records) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
            for (LogRecord record : records) {
                statement.setTimestamp(1, Timestamp.from(Instant.ofEpochMilli(record.getMillis())));
                statement.setString(2, record.getLevel().getName());
                statement.setString(3, record.getLoggerName());
                statement.setString(4, renderMessage(record));
                statement.setString(5, runId);
                statement.setString(6, "thread-" + record.getLongThreadID());
                statement.setString(7, hostName);
                Throwable thrown = record.getThrown();
                statement.setString(8, thrown == null ? null : thrown.getClass().getName());
                statement.setString(9, thrown == null ? null : thrown.getMessage());
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    private static String renderMessage(LogRecord record) {
        String message = record.getMessage();
        if (message == null) {
            return "";
        }
        Object[] params = record.getParameters();
        if (params == null || params.length == 0) {
            return message;
        }
        try {
            return MessageFormat.format(message, params);
        } catch (IllegalArgumentException ex) {
            return message;
        }
    }

    private static String resolveHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }

    private static HikariDataSource createDataSource(DbConfig config) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(config.url());
        hikariConfig.setUsername(config.username());
        hikariConfig.setPassword(config.password());
        hikariConfig.setMaximumPoolSize(config.poolSize());
        hikariConfig.setPoolName("BatchLogPool");
        hikariConfig.setAutoCommit(true);
        hikariConfig.setInitializationFailTimeout(-1);
        return new HikariDataSource(hikariConfig);
    }

    private record DbConfig(String url, String username, String password, int poolSize) {

        boolean enabled() {
            return url != null && !url.isBlank();
        }

        static DbConfig load() {
            Properties file = loadFileProperties();
            return new DbConfig(
                lookup("url", file),
                lookup("user", file),
                lookup("pass", file),
                parsePoolSize(lookup("poolSize", file))
            );
        }

        /**
         * System property {@code hdrmerge.logging.jdbc.<key>}, then environment
         * {@code HDRMERGE_LOG_JDBC_<KEY>}, then {@code hdrmerge-logging.properties} on the classpath.
         */
        private static String lookup(String key, Properties file) {
            String[] candidates = {
                System.getProperty("hdrmerge.logging.jdbc." + key),
                System.getenv("HDRMERGE_LOG_JDBC_" + key.toUpperCase()),
                file.getProperty("jdbc." + key)
            };
            for (String value : candidates) {
                if (value != null && !value.isBlank()) {
                    return value.trim();
                }
            }
            return null;
        }

        private static Properties loadFileProperties() {
            Properties props = new Properties();
            try (InputStream stream = DatabaseLogHandler.class
                .getClassLoader()
                .getResourceAsStream("hdrmerge-logging.properties")) {
                if (stream != null) {
                    props.load(stream);
                }
            } catch (IOException ex) {
                System.err.println("Ignoring unreadable hdrmerge-logging.properties: " + ex.getMessage());
            }
            return props;
        }

        private static int parsePoolSize(String raw) {
            try {
                return raw == null ? 2 : Math.max(1, Integer.parseInt(raw));
            } catch (NumberFormatException ex) {
                return 2;
            }
        }
    }
}
