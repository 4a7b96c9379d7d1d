package com.questrail.irrigation.archive;

import com.questrail.irrigation.api.ScheduleRecord;
import com.questrail.irrigation.api.WeatherAdjustment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ScheduleStore} backed by a SQLite file through the xerial JDBC driver.
 *
 * <p>One connection with auto-commit off. Timestamps are stored as epoch
 * seconds; {@code dateTimeStop = 0} marks an open run.</p>
 */
public final class SqliteScheduleStore implements ScheduleStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteScheduleStore.class);

    private static final String COLUMNS = "id, zone, dateTimeStart, dateTimeStop, wxAdjust";
    private static final String AUTOMATIC =
            " (wxAdjust >= 0 OR wxAdjust < " + WeatherAdjustment.DISABLED_BELOW + ")";

    private final Connection connection;

    private SqliteScheduleStore(Connection connection) {
        this.connection = connection;
    }

    /**
     * Opens (creating if needed) the database at {@code file}.
     */
    public static SqliteScheduleStore open(Path file) {
        Objects.requireNonNull(file, "file");
        return open("jdbc:sqlite:" + file.toAbsolutePath());
    }

    /**
     * Opens a store at an arbitrary SQLite JDBC URL ({@code jdbc:sqlite::memory:} in tests).
     */
    public static SqliteScheduleStore open(String jdbcUrl) {
        try {
            Connection connection = DriverManager.getConnection(jdbcUrl);
            try (Statement st = connection.createStatement()) {
                st.executeUpdate("CREATE TABLE IF NOT EXISTS schedule_history ("
                        + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                        + "zone INTEGER NOT NULL, "
                        + "dateTimeStart INTEGER NOT NULL, "
                        + "dateTimeStop INTEGER NOT NULL DEFAULT 0, "
                        + "wxAdjust REAL NOT NULL)");
                st.executeUpdate("CREATE INDEX IF NOT EXISTS schedule_history_zone_start "
                        + "ON schedule_history (zone, dateTimeStart)");
            }
            connection.setAutoCommit(false);
            log.info("Opened schedule history at {}", jdbcUrl);
            return new SqliteScheduleStore(connection);
        } catch (SQLException e) {
            throw new ArchiveException("Cannot open schedule history at " + jdbcUrl, e);
        }
    }

    @Override
    public ScheduleRecord insertOpen(int zone, long startTime, double weatherAdjustment) {
        String sql = "INSERT INTO schedule_history (zone, dateTimeStart, dateTimeStop, wxAdjust) VALUES (?, ?, 0, ?)";
        try (PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setInt(1, zone);
            ps.setLong(2, startTime);
            ps.setDouble(3, weatherAdjustment);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new ArchiveException("No id generated for zone " + zone + " run");
                }
                return new ScheduleRecord(keys.getLong(1), zone, startTime, 0L, weatherAdjustment);
            }
        } catch (SQLException e) {
            throw new ArchiveException("Insert failed for zone " + zone, e);
        }
    }

    @Override
    public Optional<ScheduleRecord> findOpen(int zone) {
        List<ScheduleRecord> rows = query("SELECT " + COLUMNS + " FROM schedule_history "
                + "WHERE zone = ? AND dateTimeStop = 0 ORDER BY dateTimeStart DESC, id DESC LIMIT 1", zone);
        return rows.stream().findFirst();
    }

    @Override
    public void close(long id, long stopTime) {
        try (PreparedStatement ps = connection.prepareStatement(
                "UPDATE schedule_history SET dateTimeStop = ? WHERE id = ?")) {
            ps.setLong(1, stopTime);
            ps.setLong(2, id);
            if (ps.executeUpdate() != 1) {
                throw new ArchiveException("No run with id " + id);
            }
        } catch (SQLException e) {
            throw new ArchiveException("Update failed for run " + id, e);
        }
    }

    @Override
    public List<ScheduleRecord> latestPerZone(boolean scheduledOnly) {
        String outer = scheduledOnly ? AUTOMATIC + " AND" : "";
        String inner = scheduledOnly ? " AND" + AUTOMATIC.replace("wxAdjust", "h2.wxAdjust") : "";
        return query("SELECT " + COLUMNS + " FROM schedule_history h WHERE" + outer
                + " NOT EXISTS (SELECT 1 FROM schedule_history h2 WHERE h2.zone = h.zone" + inner
                + " AND (h2.dateTimeStart > h.dateTimeStart"
                + " OR (h2.dateTimeStart = h.dateTimeStart AND h2.id > h.id)))"
                + " ORDER BY dateTimeStart DESC, id DESC");
    }

    @Override
    public List<ScheduleRecord> startedSince(long startTime, boolean scheduledOnly) {
        return query("SELECT " + COLUMNS + " FROM schedule_history WHERE dateTimeStart >= ?"
                + (scheduledOnly ? " AND" + AUTOMATIC : "")
                + " ORDER BY dateTimeStart ASC, id ASC", startTime);
    }

    @Override
    public List<ScheduleRecord> openRuns() {
        return query("SELECT " + COLUMNS + " FROM schedule_history WHERE dateTimeStop = 0 ORDER BY zone ASC");
    }

    @Override
    public void commit() {
        try {
            connection.commit();
        } catch (SQLException e) {
            throw new ArchiveException("Commit failed", e);
        }
    }

    @Override
    public void rollback() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw new ArchiveException("Rollback failed", e);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new ArchiveException("Close failed", e);
        }
    }

    private List<ScheduleRecord> query(String sql, Object... args) {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) {
                ps.setObject(i + 1, args[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                List<ScheduleRecord> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(new ScheduleRecord(
                            rs.getLong("id"),
                            rs.getInt("zone"),
                            rs.getLong("dateTimeStart"),
                            rs.getLong("dateTimeStop"),
                            rs.getDouble("wxAdjust")));
                }
                return out;
            }
        } catch (SQLException e) {
            throw new ArchiveException("Query failed: " + sql, e);
        }
    }
}
