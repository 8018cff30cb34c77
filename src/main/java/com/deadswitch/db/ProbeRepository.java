package com.deadswitch.db;

import com.deadswitch.core.EmergencyProbe;
import com.deadswitch.core.Probe;
import com.deadswitch.core.ProbeStatus;

import java.sql.*;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Probes and emergency-probe audit rows.
 *
 * <p>A pending probe carries its user id in {@code pending_user_id}, which is unique, so
 * the database itself refuses a second pending probe for the same user. Every
 * transition out of PENDING clears the column and is conditional on the probe still
 * being pending: the first writer wins, later writers see {@code false}.</p>
 *
 * <p>Timestamps come from the supplied {@link Clock} so the follow-up schedule can be
 * tested without waiting hours.</p>
 */
public class ProbeRepository {
    private static final Logger logger = Logger.getLogger(ProbeRepository.class.getName());

    private final Database database;
    private final Clock clock;

    public ProbeRepository(Database database) {
        this(database, Clock.systemDefaultZone());
    }

    public ProbeRepository(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    /**
     * Insert a pending probe for the user.
     *
     * @throws SQLException if the user already has a pending probe
     */
    public Probe createPendingProbe(long userId) throws SQLException {
        String sql = "INSERT INTO probes (user_id, last_response, retry_count, status, pending_user_id, created_at, updated_at) " +
                     "VALUES (?, '', 0, ?, ?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            LocalDateTime now = now();

            stmt.setLong(1, userId);
            stmt.setString(2, ProbeStatus.PENDING.getDbName());
            stmt.setLong(3, userId);
            stmt.setTimestamp(4, Timestamp.valueOf(now));
            stmt.setTimestamp(5, Timestamp.valueOf(now));
            stmt.executeUpdate();

            Probe probe = new Probe();
            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for probe of user " + userId);
                }
                probe.setId(keys.getLong(1));
            }
            probe.setUserId(userId);
            probe.setLastResponse("");
            probe.setRetryCount(0);
            probe.setStatus(ProbeStatus.PENDING);
            probe.setCreatedAt(now);
            probe.setUpdatedAt(now);

            logger.fine("Created pending probe " + probe.getId() + " for user " + userId);
            return probe;
        }
    }

    /**
     * The most recently created probe of the user, whatever its status.
     */
    public Optional<Probe> lastProbeForUser(long userId) throws SQLException {
        String sql = "SELECT * FROM probes WHERE user_id = ? ORDER BY id DESC LIMIT 1";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, userId);
            return singleProbe(stmt);
        }
    }

    public Optional<Probe> findProbe(long probeId) throws SQLException {
        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT * FROM probes WHERE id = ?")) {

            stmt.setLong(1, probeId);
            return singleProbe(stmt);
        }
    }

    public List<Probe> probesByStatus(ProbeStatus status) throws SQLException {
        String sql = "SELECT * FROM probes WHERE status = ? ORDER BY id ASC";
        List<Probe> probes = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, status.getDbName());

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    probes.add(mapResultSetToProbe(rs));
                }
            }
        }

        return probes;
    }

    /**
     * Resolve a pending probe.
     *
     * @param lastResponse the reply that resolved it, or null to keep the stored one
     * @return false if the probe was no longer pending
     */
    public boolean setStatusIfPending(long probeId, ProbeStatus status, String lastResponse) throws SQLException {
        if (status == ProbeStatus.PENDING) {
            throw new IllegalArgumentException("Cannot move a probe back to pending");
        }

        String sql = lastResponse == null
                ? "UPDATE probes SET status = ?, pending_user_id = NULL, updated_at = ? WHERE id = ? AND status = ?"
                : "UPDATE probes SET status = ?, pending_user_id = NULL, updated_at = ?, last_response = ? WHERE id = ? AND status = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            int i = 1;
            stmt.setString(i++, status.getDbName());
            stmt.setTimestamp(i++, Timestamp.valueOf(now()));
            if (lastResponse != null) {
                stmt.setString(i++, lastResponse);
            }
            stmt.setLong(i++, probeId);
            stmt.setString(i, ProbeStatus.PENDING.getDbName());

            boolean updated = stmt.executeUpdate() == 1;
            if (updated) {
                logger.fine("Probe " + probeId + " -> " + status);
            }
            return updated;
        }
    }

    /**
     * Count one more follow-up on a pending probe and restart its follow-up clock.
     *
     * @return false if the probe was no longer pending
     */
    public boolean incrementRetryCount(long probeId) throws SQLException {
        String sql = "UPDATE probes SET retry_count = retry_count + 1, updated_at = ? WHERE id = ? AND status = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setTimestamp(1, Timestamp.valueOf(now()));
            stmt.setLong(2, probeId);
            stmt.setString(3, ProbeStatus.PENDING.getDbName());

            return stmt.executeUpdate() == 1;
        }
    }

    /**
     * Store a reply that did not resolve the probe. The follow-up clock is left alone.
     */
    public boolean saveLastResponse(long probeId, String lastResponse) throws SQLException {
        String sql = "UPDATE probes SET last_response = ? WHERE id = ? AND status = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, lastResponse);
            stmt.setLong(2, probeId);
            stmt.setString(3, ProbeStatus.PENDING.getDbName());

            return stmt.executeUpdate() == 1;
        }
    }

    /**
     * Cancel every pending probe of the user.
     *
     * @return the number of probes cancelled
     */
    public int cancelAllPendingProbes(long userId) throws SQLException {
        String sql = "UPDATE probes SET status = ?, pending_user_id = NULL, updated_at = ? WHERE user_id = ? AND status = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, ProbeStatus.CANCELLED.getDbName());
            stmt.setTimestamp(2, Timestamp.valueOf(now()));
            stmt.setLong(3, userId);
            stmt.setString(4, ProbeStatus.PENDING.getDbName());

            int cancelled = stmt.executeUpdate();
            if (cancelled > 0) {
                logger.info("Cancelled " + cancelled + " pending probe(s) for user " + userId);
            }
            return cancelled;
        }
    }

    public EmergencyProbe createEmergencyProbe(long probeId, long contactId, boolean delivered) throws SQLException {
        String sql = "INSERT INTO emergency_probes (probe_id, contact_id, delivered, acknowledged, created_at) " +
                     "VALUES (?, ?, ?, FALSE, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            LocalDateTime now = now();

            stmt.setLong(1, probeId);
            stmt.setLong(2, contactId);
            stmt.setBoolean(3, delivered);
            stmt.setTimestamp(4, Timestamp.valueOf(now));
            stmt.executeUpdate();

            EmergencyProbe emergencyProbe = new EmergencyProbe();
            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for emergency probe of probe " + probeId);
                }
                emergencyProbe.setId(keys.getLong(1));
            }
            emergencyProbe.setProbeId(probeId);
            emergencyProbe.setContactId(contactId);
            emergencyProbe.setDelivered(delivered);
            emergencyProbe.setAcknowledged(false);
            emergencyProbe.setCreatedAt(now);
            return emergencyProbe;
        }
    }

    public List<EmergencyProbe> emergencyProbesFor(long probeId) throws SQLException {
        String sql = "SELECT * FROM emergency_probes WHERE probe_id = ? ORDER BY id ASC";
        List<EmergencyProbe> result = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, probeId);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    EmergencyProbe emergencyProbe = new EmergencyProbe();
                    emergencyProbe.setId(rs.getLong("id"));
                    emergencyProbe.setProbeId(rs.getLong("probe_id"));
                    emergencyProbe.setContactId(rs.getLong("contact_id"));
                    emergencyProbe.setDelivered(rs.getBoolean("delivered"));
                    emergencyProbe.setAcknowledged(rs.getBoolean("acknowledged"));
                    emergencyProbe.setCreatedAt(rs.getTimestamp("created_at").toLocalDateTime());
                    result.add(emergencyProbe);
                }
            }
        }

        return result;
    }

    public Map<ProbeStatus, Integer> countByStatus() throws SQLException {
        String sql = "SELECT status, COUNT(*) AS cnt FROM probes GROUP BY status";
        Map<ProbeStatus, Integer> counts = new EnumMap<>(ProbeStatus.class);
        for (ProbeStatus status : ProbeStatus.values()) {
            counts.put(status, 0);
        }

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                counts.put(ProbeStatus.fromDbName(rs.getString("status")), rs.getInt("cnt"));
            }
        }

        return counts;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private Optional<Probe> singleProbe(PreparedStatement stmt) throws SQLException {
        try (ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                return Optional.of(mapResultSetToProbe(rs));
            }
        }
        return Optional.empty();
    }

    private Probe mapResultSetToProbe(ResultSet rs) throws SQLException {
        Probe probe = new Probe();
        probe.setId(rs.getLong("id"));
        probe.setUserId(rs.getLong("user_id"));
        probe.setLastResponse(rs.getString("last_response"));
        probe.setRetryCount(rs.getInt("retry_count"));
        probe.setStatus(ProbeStatus.fromDbName(rs.getString("status")));
        probe.setCreatedAt(rs.getTimestamp("created_at").toLocalDateTime());
        probe.setUpdatedAt(rs.getTimestamp("updated_at").toLocalDateTime());
        return probe;
    }
}
