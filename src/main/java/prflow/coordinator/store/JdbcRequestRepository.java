package prflow.coordinator.store;

import prflow.coordinator.model.QueueStats;
import prflow.coordinator.model.RequestStatus;
import prflow.coordinator.model.RequestType;
import prflow.coordinator.model.WorkRequest;
import prflow.coordinator.repository.RequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of RequestRepository.
 * Uses conditional updates (compare-and-set on status) instead of row locks,
 * so concurrent claimers never block each other and exactly one wins a row.
 */
public class JdbcRequestRepository implements RequestRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRequestRepository.class);

    private static final String UNIQUE_VIOLATION = "23505";
    private static final String TERMINAL_STATUSES = "('COMPLETED', 'FAILED', 'CANCELLED')";

    private final Database db;

    public JdbcRequestRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean insert(WorkRequest request) {
        String existsSql = """
                    SELECT 1 FROM work_requests
                    WHERE branch_name = ? AND status IN ('PENDING', 'PROCESSING')
                """;

        String insertSql = """
                    INSERT INTO work_requests (id, created_at, created_by, request_type, status, branch_name,
                                               active_branch, pr_title, pr_description, target_branch, file_name,
                                               payload, stage_path, priority, retry_count, max_retries)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement exists = conn.prepareStatement(existsSql);
                    PreparedStatement ps = conn.prepareStatement(insertSql)) {

                exists.setString(1, request.branchName());
                try (ResultSet rs = exists.executeQuery()) {
                    if (rs.next()) {
                        conn.rollback();
                        return false;
                    }
                }

                ps.setString(1, request.id());
                setTimestamp(ps, 2, request.createdAt());
                ps.setString(3, request.createdBy());
                ps.setString(4, request.requestType().name());
                ps.setString(5, request.status().name());
                ps.setString(6, request.branchName());
                ps.setString(7, request.status().isActive() ? request.branchName() : null);
                ps.setString(8, request.prTitle());
                ps.setString(9, request.prDescription());
                ps.setString(10, request.targetBranch());
                ps.setString(11, request.fileName());
                ps.setBytes(12, request.payload());
                ps.setString(13, request.stagePath());
                ps.setInt(14, request.priority());
                ps.setInt(15, request.retryCount());
                ps.setInt(16, request.maxRetries());

                ps.executeUpdate();
                conn.commit();
                return true;
            } catch (SQLException e) {
                conn.rollback();
                if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    // lost a race with a concurrent submit for the same branch
                    log.debug("Active request already exists for branch {}", request.branchName());
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert request: " + request.id(), e);
        }
    }

    @Override
    public Optional<WorkRequest> findById(String requestId) {
        String sql = "SELECT * FROM work_requests WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, requestId);
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find request: " + requestId, e);
        }
    }

    @Override
    public Optional<WorkRequest> findLatestByBranch(String branchName) {
        String sql = """
                    SELECT * FROM work_requests
                    WHERE branch_name = ?
                    ORDER BY created_at DESC, seq DESC
                    LIMIT 1
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, branchName);
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find request for branch: " + branchName, e);
        }
    }

    @Override
    public List<WorkRequest> findClaimCandidates(int limit) {
        String sql = """
                    SELECT * FROM work_requests
                    WHERE status = 'PENDING' AND retry_count <= max_retries
                    ORDER BY priority DESC, created_at, seq
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find claim candidates", e);
        }
    }

    @Override
    public boolean tryClaim(String requestId, String processorId, Instant now) {
        String sql = """
                    UPDATE work_requests
                    SET status = 'PROCESSING', processor_id = ?, processed_at = ?
                    WHERE id = ? AND status = 'PENDING' AND retry_count <= max_retries
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, processorId);
            setTimestamp(ps, 2, now);
            ps.setString(3, requestId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Request {} claimed by {}", requestId, processorId);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim request: " + requestId, e);
        }
    }

    @Override
    public boolean applyTransition(WorkRequest expected, WorkRequest next) {
        String sql = """
                    UPDATE work_requests
                    SET status = ?, active_branch = ?, retry_count = ?, processor_id = ?, processed_at = ?,
                        error_message = ?, github_branch_url = ?, github_pr_url = ?, github_pr_number = ?
                    WHERE id = ? AND status = ? AND retry_count = ? AND processor_id IS NOT DISTINCT FROM ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, next.status().name());
            ps.setString(2, next.status().isActive() ? next.branchName() : null);
            ps.setInt(3, next.retryCount());
            ps.setString(4, next.processorId());
            setTimestamp(ps, 5, next.processedAt());
            ps.setString(6, next.errorMessage());
            ps.setString(7, next.githubBranchUrl());
            ps.setString(8, next.githubPrUrl());
            setIntOrNull(ps, 9, next.githubPrNumber());
            ps.setString(10, expected.id());
            ps.setString(11, expected.status().name());
            ps.setInt(12, expected.retryCount());
            ps.setString(13, expected.processorId());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Request {} moved {} -> {}", expected.id(), expected.status(), next.status());
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update request: " + expected.id(), e);
        }
    }

    @Override
    public List<WorkRequest> findStaleProcessing(Instant claimedBefore) {
        String sql = """
                    SELECT * FROM work_requests
                    WHERE status = 'PROCESSING' AND processed_at < ?
                    ORDER BY processed_at, seq
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, claimedBefore);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stale requests", e);
        }
    }

    @Override
    public boolean resetStale(String requestId, Instant claimedBefore, String note) {
        String sql = """
                    UPDATE work_requests
                    SET status = 'PENDING', processor_id = NULL, error_message = ?
                    WHERE id = ? AND status = 'PROCESSING' AND processed_at < ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, note);
            ps.setString(2, requestId);
            setTimestamp(ps, 3, claimedBefore);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Request {} reset to PENDING after stale claim", requestId);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to reset request: " + requestId, e);
        }
    }

    @Override
    public QueueStats countByStatus(Instant createdSince) {
        String sql = createdSince == null
                ? "SELECT status, COUNT(*) FROM work_requests GROUP BY status"
                : "SELECT status, COUNT(*) FROM work_requests WHERE created_at >= ? GROUP BY status";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            if (createdSince != null) {
                setTimestamp(ps, 1, createdSince);
            }

            Map<RequestStatus, Integer> counts = new EnumMap<>(RequestStatus.class);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.put(RequestStatus.valueOf(rs.getString(1)), rs.getInt(2));
                }
            }
            return new QueueStats(counts);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count requests by status", e);
        }
    }

    @Override
    public int countPendingCreatedBefore(Instant createdBefore) {
        String sql = "SELECT COUNT(*) FROM work_requests WHERE status = 'PENDING' AND created_at < ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, createdBefore);
            return count(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count old pending requests", e);
        }
    }

    @Override
    public int countActiveWithRetries(int minRetries, Instant createdSince) {
        String sql = """
                    SELECT COUNT(*) FROM work_requests
                    WHERE status IN ('PENDING', 'PROCESSING') AND retry_count >= ? AND created_at >= ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, minRetries);
            setTimestamp(ps, 2, createdSince);
            return count(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count retried requests", e);
        }
    }

    @Override
    public PurgeResult purgeTerminalCreatedBefore(Instant createdBefore) {
        String deleteLogsSql = "DELETE FROM audit_log WHERE request_id IN ("
                + "SELECT id FROM work_requests WHERE status IN " + TERMINAL_STATUSES + " AND created_at < ?)";
        String deleteRequestsSql = "DELETE FROM work_requests WHERE status IN " + TERMINAL_STATUSES
                + " AND created_at < ?";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement logs = conn.prepareStatement(deleteLogsSql);
                    PreparedStatement requests = conn.prepareStatement(deleteRequestsSql)) {

                // audit rows reference requests, so they go first
                setTimestamp(logs, 1, createdBefore);
                int deletedLogs = logs.executeUpdate();

                setTimestamp(requests, 1, createdBefore);
                int deletedRequests = requests.executeUpdate();

                conn.commit();

                if (deletedRequests > 0) {
                    log.info("Purged {} requests and {} audit entries created before {}",
                            deletedRequests, deletedLogs, createdBefore);
                }
                return new PurgeResult(deletedRequests, deletedLogs);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to purge requests created before: " + createdBefore, e);
        }
    }

    // Helper methods

    private List<WorkRequest> executeQuery(PreparedStatement ps) throws SQLException {
        List<WorkRequest> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private static int count(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private WorkRequest mapRow(ResultSet rs) throws SQLException {
        return WorkRequest.builder()
                .id(rs.getString("id"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .createdBy(rs.getString("created_by"))
                .requestType(RequestType.valueOf(rs.getString("request_type")))
                .status(RequestStatus.valueOf(rs.getString("status")))
                .branchName(rs.getString("branch_name"))
                .prTitle(rs.getString("pr_title"))
                .prDescription(rs.getString("pr_description"))
                .targetBranch(rs.getString("target_branch"))
                .fileName(rs.getString("file_name"))
                .payload(rs.getBytes("payload"))
                .stagePath(rs.getString("stage_path"))
                .priority(rs.getInt("priority"))
                .retryCount(rs.getInt("retry_count"))
                .maxRetries(rs.getInt("max_retries"))
                .processorId(rs.getString("processor_id"))
                .processedAt(toInstant(rs.getTimestamp("processed_at")))
                .errorMessage(rs.getString("error_message"))
                .githubBranchUrl(rs.getString("github_branch_url"))
                .githubPrUrl(rs.getString("github_pr_url"))
                .githubPrNumber(getIntOrNull(rs, "github_pr_number"))
                .build();
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

    private static void setIntOrNull(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }

    private static Integer getIntOrNull(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
