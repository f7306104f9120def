package prflow.coordinator.store;

import prflow.coordinator.model.AuditLogEntry;
import prflow.coordinator.model.LogLevel;
import prflow.coordinator.repository.AuditLogRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of AuditLogRepository.
 */
public class JdbcAuditLogRepository implements AuditLogRepository {

    private final Database db;

    public JdbcAuditLogRepository(Database db) {
        this.db = db;
    }

    @Override
    public AuditLogEntry append(AuditLogEntry entry) {
        String sql = """
                    INSERT INTO audit_log (request_id, log_level, message, details, processor_id, logged_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, new String[] { "id" })) {

            ps.setString(1, entry.requestId());
            ps.setString(2, entry.level().name());
            ps.setString(3, entry.message());
            ps.setString(4, entry.details());
            ps.setString(5, entry.processorId());
            ps.setTimestamp(6, Timestamp.from(entry.timestamp()));

            ps.executeUpdate();

            Long id = null;
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (keys.next()) {
                    id = keys.getLong(1);
                }
            }
            conn.commit();

            return new AuditLogEntry(id, entry.requestId(), entry.level(), entry.message(), entry.details(),
                    entry.processorId(), entry.timestamp());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to append audit entry: " + entry.message(), e);
        }
    }

    @Override
    public List<AuditLogEntry> findByRequestId(String requestId, int limit) {
        String sql = """
                    SELECT * FROM audit_log
                    WHERE request_id = ?
                    ORDER BY logged_at, id
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, requestId);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find audit entries for request: " + requestId, e);
        }
    }

    @Override
    public List<AuditLogEntry> findRecent(int limit) {
        String sql = "SELECT * FROM audit_log ORDER BY logged_at DESC, id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent audit entries", e);
        }
    }

    @Override
    public int countByLevelSince(LogLevel level, Instant since) {
        String sql = "SELECT COUNT(*) FROM audit_log WHERE log_level = ? AND logged_at >= ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, level.name());
            ps.setTimestamp(2, Timestamp.from(since));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count " + level + " audit entries", e);
        }
    }

    @Override
    public int deleteQueueWideBefore(Instant cutoff) {
        String sql = "DELETE FROM audit_log WHERE request_id IS NULL AND logged_at < ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete queue audit entries before: " + cutoff, e);
        }
    }

    private List<AuditLogEntry> executeQuery(PreparedStatement ps) throws SQLException {
        List<AuditLogEntry> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                Timestamp loggedAt = rs.getTimestamp("logged_at");
                results.add(new AuditLogEntry(
                        rs.getLong("id"),
                        rs.getString("request_id"),
                        LogLevel.valueOf(rs.getString("log_level")),
                        rs.getString("message"),
                        rs.getString("details"),
                        rs.getString("processor_id"),
                        loggedAt.toInstant()));
            }
        }
        return results;
    }
}
