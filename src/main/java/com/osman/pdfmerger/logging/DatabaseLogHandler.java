package com.osman.pdfmerger.logging;

import com.osman.pdfmerger.config.ConfigService;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Stores merge logs in the {@code merge_logs} table. Phase and page events arrive as
 * {@link MergeLogRecord}s and land in typed columns, so a run can be queried page by page; other
 * records only fill the common columns. Writes happen in batches on a background thread.
 */
public final class DatabaseLogHandler extends Handler {

    static final int BATCH_SIZE = 64;

    private static final String INSERT_SQL = """
        INSERT INTO merge_logs (
            logged_at, level, logger, message,
            phase, source_name, page_kind, sequence_no, output_page, total_pages,
            host, thrown_type, thrown_msg
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    /**
     * Connection settings, resolved through {@link ConfigService} under {@code pdfmerger.logging.jdbc.*}.
     */
    public record JdbcSettings(String url, String username, String password, int poolSize) {

        public JdbcSettings {
            Objects.requireNonNull(url, "url");
            poolSize = Math.max(1, poolSize);
        }

        public static Optional<JdbcSettings> from(ConfigService config) {
            return config.value("pdfmerger.logging.jdbc.url").map(url -> new JdbcSettings(
                url,
                config.value("pdfmerger.logging.jdbc.user").orElse(null),
                config.value("pdfmerger.logging.jdbc.pass").orElse(null),
                config.intValue("pdfmerger.logging.jdbc.poolSize", 2)
            ));
        }
    }

    private final BlockingQueue<LogRecord> queue = new LinkedBlockingQueue<>(1024);
    private final HikariDataSource dataSource;
    private final String hostName;
    private final Thread writer;

    private volatile boolean running = true;

    public DatabaseLogHandler(JdbcSettings settings) {
        this.dataSource = createDataSource(settings);
        this.hostName = resolveHostName();
        this.writer = new Thread(this::writeLoop, "merge-log-writer");
        this.writer.setDaemon(true);
        this.writer.start();
        setLevel(Level.ALL);
    }

    @Override
    public void publish(LogRecord record) {
        Objects.requireNonNull(record);
        if (!isLoggable(record) || !running) {
            return;
        }
        // drop the oldest record rather than block the merge when the database lags behind
        while (!queue.offer(record)) {
            queue.poll();
        }
    }

    @Override
    public void flush() {
        // the writer thread persists records as they arrive
    }

    /**
     * Stops accepting records, writes what is still queued and closes the pool.
     */
    @Override
    public void close() {
        running = false;
        try {
            writer.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
        dataSource.close();
    }

    private void writeLoop() {
        List<LogRecord> batch = new ArrayList<>(BATCH_SIZE);
        while (running) {
            try {
                LogRecord first = queue.poll(200, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, BATCH_SIZE - 1);
                writeBatch(batch);
            } catch (InterruptedException interrupted) {
                // only this handler owns the writer thread; stop polling and drain below
                break;
            } finally {
                batch.clear();
            }
        }
        queue.drainTo(batch);
        writeBatch(batch);
    }

    private void writeBatch(List<LogRecord> batch) {
        if (batch.isEmpty()) {
            return;
        }
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
            for (LogRecord record : batch) {
                bind(statement, record);
                statement.addBatch();
            }
            statement.executeBatch();
        } catch (SQLException | RuntimeException ex) {
            System.err.println("Could not store " + batch.size() + " merge log records: " + ex.getMessage());
        }
    }

    private void bind(PreparedStatement statement, LogRecord record) throws SQLException {
        statement.setTimestamp(1, Timestamp.from(Instant.ofEpochMilli(record.getMillis())));
        statement.setString(2, record.getLevel().getName());
        statement.setString(3, record.getLoggerName());
        statement.setString(4, AppLogger.render(record));

        MergeLogRecord event = record instanceof MergeLogRecord ? (MergeLogRecord) record : null;
        statement.setString(5, event == null ? null : event.getPhase());
        statement.setString(6, event == null ? null : event.getSourceName());
        statement.setString(7, event == null ? null : event.getPageKind());
        setNullableInt(statement, 8, event == null ? null : event.getSequence());
        setNullableInt(statement, 9, event == null ? null : event.getOutputPage());
        setNullableInt(statement, 10, event == null ? null : event.getTotalPages());

        statement.setString(11, hostName);
        Throwable thrown = record.getThrown();
        statement.setString(12, thrown == null ? null : thrown.getClass().getName());
        statement.setString(13, thrown == null ? null : thrown.getMessage());
    }

    private static void setNullableInt(PreparedStatement statement, int index, Integer value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setInt(index, value);
        }
    }

    private static String resolveHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }

    private static HikariDataSource createDataSource(JdbcSettings settings) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(settings.url());
        hikariConfig.setUsername(settings.username());
        hikariConfig.setPassword(settings.password());
        hikariConfig.setMaximumPoolSize(settings.poolSize());
        hikariConfig.setPoolName("MergeLoggingPool");
        hikariConfig.setAutoCommit(true);
        hikariConfig.setInitializationFailTimeout(-1);
        return new HikariDataSource(hikariConfig);
    }
}
