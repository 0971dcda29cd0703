package taskdock.engine.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import taskdock.engine.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Durable tier: one table per namespace, values stored as JSON.
 *
 * Storage failures never propagate. A failed read is a miss, a failed write is a no-op,
 * and both are logged, so the memory tier keeps working on its own.
 */
public class JdbcCache<V> implements Cache<V> {

    private static final Logger log = LoggerFactory.getLogger(JdbcCache.class);

    private static final Pattern NAMESPACE = Pattern.compile("[A-Za-z0-9_]{1,48}");

    private final Database db;
    private final String namespace;
    private final String table;
    private final JavaType valueType;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Object lock = new Object();

    public JdbcCache(Database db, String namespace, Class<V> valueType, ObjectMapper mapper) {
        this(db, namespace, mapper.constructType(valueType), mapper, Clock.systemUTC());
    }

    public JdbcCache(Database db, String namespace, JavaType valueType, ObjectMapper mapper, Clock clock) {
        if (namespace == null || !NAMESPACE.matcher(namespace).matches()) {
            throw new IllegalArgumentException("Invalid cache namespace: " + namespace);
        }
        this.db = Objects.requireNonNull(db, "db is required");
        this.namespace = namespace;
        this.table = "cache_" + namespace;
        this.valueType = Objects.requireNonNull(valueType, "valueType is required");
        this.mapper = Objects.requireNonNull(mapper, "mapper is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        initTable();
    }

    public String namespace() {
        return namespace;
    }

    @Override
    public Optional<V> get(String key) {
        return getEntry(key).map(CacheEntry::value);
    }

    /**
     * Look up the full entry, deleting the row if it has expired.
     */
    public Optional<CacheEntry<V>> getEntry(String key) {
        String sql = "SELECT cache_value, created_at, expires_at FROM " + table + " WHERE cache_key = ?";

        synchronized (lock) {
            CacheEntry<V> entry = null;
            try (Connection conn = db.getConnection();
                    PreparedStatement ps = conn.prepareStatement(sql)) {

                ps.setString(1, key);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        V value = mapper.readValue(rs.getString("cache_value"), valueType);
                        entry = new CacheEntry<>(key, value,
                                rs.getTimestamp("created_at").toInstant(),
                                toInstant(rs.getTimestamp("expires_at")));
                    }
                }
                conn.commit();
            } catch (SQLException | IOException e) {
                log.error("Failed to read cache entry {}/{}", namespace, key, e);
                return Optional.empty();
            }

            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpired(clock.instant())) {
                delete(key);
                return Optional.empty();
            }
            return Optional.of(entry);
        }
    }

    /**
     * Store with no expiry when ttl is null. Rewrites created_at on every call.
     */
    @Override
    public void set(String key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(value, "value is required");

        CacheEntry<V> entry = CacheEntry.of(key, value, clock.instant(), ttl);
        String updateSql = "UPDATE " + table
                + " SET cache_value = ?, created_at = ?, expires_at = ?, updated_at = ? WHERE cache_key = ?";
        String insertSql = "INSERT INTO " + table
                + " (cache_key, cache_value, created_at, expires_at, updated_at) VALUES (?, ?, ?, ?, ?)";

        synchronized (lock) {
            try (Connection conn = db.getConnection()) {
                String json = mapper.writeValueAsString(value);
                Timestamp now = Timestamp.from(entry.createdAt());

                try (PreparedStatement update = conn.prepareStatement(updateSql)) {
                    update.setString(1, json);
                    update.setTimestamp(2, now);
                    setTimestamp(update, 3, entry.expiresAt());
                    update.setTimestamp(4, now);
                    update.setString(5, key);

                    if (update.executeUpdate() == 0) {
                        try (PreparedStatement insert = conn.prepareStatement(insertSql)) {
                            insert.setString(1, key);
                            insert.setString(2, json);
                            insert.setTimestamp(3, now);
                            setTimestamp(insert, 4, entry.expiresAt());
                            insert.setTimestamp(5, now);
                            insert.executeUpdate();
                        }
                    }
                    conn.commit();
                } catch (SQLException e) {
                    conn.rollback();
                    throw e;
                }
            } catch (JsonProcessingException e) {
                log.error("Failed to serialize cache value {}/{}", namespace, key, e);
            } catch (SQLException e) {
                log.error("Failed to write cache entry {}/{}", namespace, key, e);
            }
        }
    }

    @Override
    public boolean delete(String key) {
        String sql = "DELETE FROM " + table + " WHERE cache_key = ?";

        synchronized (lock) {
            try (Connection conn = db.getConnection();
                    PreparedStatement ps = conn.prepareStatement(sql)) {

                ps.setString(1, key);
                int deleted = ps.executeUpdate();
                conn.commit();
                return deleted > 0;
            } catch (SQLException e) {
                log.error("Failed to delete cache entry {}/{}", namespace, key, e);
                return false;
            }
        }
    }

    @Override
    public boolean exists(String key) {
        return get(key).isPresent();
    }

    @Override
    public void clear() {
        synchronized (lock) {
            try (Connection conn = db.getConnection();
                    Statement st = conn.createStatement()) {

                st.executeUpdate("DELETE FROM " + table);
                conn.commit();
            } catch (SQLException e) {
                log.error("Failed to clear cache {}", namespace, e);
            }
        }
    }

    /**
     * Remove every row whose expiry has passed.
     *
     * @return number of rows removed, 0 on failure
     */
    public int cleanupExpired() {
        String sql = "DELETE FROM " + table + " WHERE expires_at IS NOT NULL AND expires_at < ?";

        synchronized (lock) {
            try (Connection conn = db.getConnection();
                    PreparedStatement ps = conn.prepareStatement(sql)) {

                ps.setTimestamp(1, Timestamp.from(clock.instant()));
                int deleted = ps.executeUpdate();
                conn.commit();

                if (deleted > 0) {
                    log.debug("Removed {} expired entries from {}", deleted, namespace);
                }
                return deleted;
            } catch (SQLException e) {
                log.error("Failed to clean up cache {}", namespace, e);
                return 0;
            }
        }
    }

    /**
     * Row count including expired rows not yet cleaned up; 0 on failure.
     */
    public int size() {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {

            int count = rs.next() ? rs.getInt(1) : 0;
            conn.commit();
            return count;
        } catch (SQLException e) {
            log.warn("Failed to count cache {}: {}", namespace, e.getMessage());
            return 0;
        }
    }

    private void initTable() {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement()) {

            st.addBatch("CREATE TABLE IF NOT EXISTS " + table + " ("
                    + " cache_key    VARCHAR(512) PRIMARY KEY,"
                    + " cache_value  CLOB NOT NULL,"
                    + " created_at   TIMESTAMP NOT NULL,"
                    + " expires_at   TIMESTAMP,"
                    + " updated_at   TIMESTAMP NOT NULL"
                    + ")");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_" + table + "_expires ON " + table + "(expires_at)");

            st.executeBatch();
            conn.commit();
        } catch (SQLException e) {
            log.error("Failed to initialize cache table {}", table, e);
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
