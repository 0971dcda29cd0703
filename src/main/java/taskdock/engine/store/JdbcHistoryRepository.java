package taskdock.engine.store;

import taskdock.engine.model.HistoryRecord;
import taskdock.engine.model.TaskStatus;
import taskdock.engine.repository.HistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of HistoryRepository on the {@code history} table.
 */
public class JdbcHistoryRepository implements HistoryRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcHistoryRepository.class);

    private final Database db;

    public JdbcHistoryRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(HistoryRecord record) {
        String sql = """
                    INSERT INTO history (id, task_id, url, title, file_path, status, error_message, recorded_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, record.id());
            ps.setString(2, record.taskId());
            ps.setString(3, record.url());
            ps.setString(4, record.title());
            ps.setString(5, record.filePath());
            ps.setString(6, record.status().name());
            ps.setString(7, record.errorMessage());
            setTimestamp(ps, 8, record.recordedAt());

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved history record {} for task {}", record.id(), record.taskId());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save history record: " + record.id(), e);
        }
    }

    @Override
    public Optional<HistoryRecord> findById(String id) {
        String sql = "SELECT * FROM history WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find history record: " + id, e);
        }
    }

    @Override
    public List<HistoryRecord> findRecent(int limit) {
        String sql = "SELECT * FROM history ORDER BY recorded_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent history", e);
        }
    }

    @Override
    public List<HistoryRecord> findByUrl(String url) {
        String sql = "SELECT * FROM history WHERE url = ? ORDER BY recorded_at DESC";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, url);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find history for url: " + url, e);
        }
    }

    @Override
    public int countByStatus(TaskStatus status) {
        String sql = "SELECT COUNT(*) FROM history WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            return singleInt(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count history by status: " + status, e);
        }
    }

    @Override
    public int count() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM history")) {
            return singleInt(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count history", e);
        }
    }

    @Override
    public int deleteBefore(Instant cutoff) {
        String sql = "DELETE FROM history WHERE recorded_at < ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, cutoff);
            int deleted = ps.executeUpdate();
            conn.commit();

            if (deleted > 0) {
                log.info("Pruned {} history records older than {}", deleted, cutoff);
            }
            return deleted;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to prune history", e);
        }
    }

    @Override
    public void clear() {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement()) {
            st.executeUpdate("DELETE FROM history");
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear history", e);
        }
    }

    // ---------- Helpers ----------

    private List<HistoryRecord> executeQuery(PreparedStatement ps) throws SQLException {
        List<HistoryRecord> records = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                records.add(mapRow(rs));
            }
        }
        return records;
    }

    private static int singleInt(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private HistoryRecord mapRow(ResultSet rs) throws SQLException {
        return new HistoryRecord(
                rs.getString("id"),
                rs.getString("task_id"),
                rs.getString("url"),
                rs.getString("title"),
                rs.getString("file_path"),
                TaskStatus.valueOf(rs.getString("status")),
                rs.getString("error_message"),
                rs.getTimestamp("recorded_at").toInstant());
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
