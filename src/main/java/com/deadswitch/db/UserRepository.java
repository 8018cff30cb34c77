package com.deadswitch.db;

import com.deadswitch.core.Contact;
import com.deadswitch.core.ProbeSetting;
import com.deadswitch.core.User;

import java.sql.*;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Users, their contacts and their probe settings.
 */
public class UserRepository {
    private static final Logger logger = Logger.getLogger(UserRepository.class.getName());

    private static final String USER_WITH_SETTINGS =
            "SELECT u.*, s.id AS setting_id, s.active, s.cron_expression, " +
            "s.created_at AS setting_created_at, s.updated_at AS setting_updated_at " +
            "FROM users u JOIN probe_settings s ON s.user_id = u.id";

    private final Database database;
    private final String defaultCron;

    public UserRepository(Database database) {
        this(database, "0 0 18 * * WED");
    }

    public UserRepository(Database database, String defaultCron) {
        this.database = database;
        this.defaultCron = defaultCron;
    }

    /**
     * Create a user whose probe settings start on the default schedule.
     */
    public User createUser(String firstName, String lastName, String phoneNumber, String email) throws SQLException {
        return createUser(firstName, lastName, phoneNumber, email, defaultCron);
    }

    /**
     * Create a user together with inactive probe settings, in one transaction.
     *
     * @param defaultCron the probe schedule stored in the new settings
     * @return the persisted user, settings included
     * @throws SQLException if the insert fails, e.g. on a duplicate phone number or email
     */
    public User createUser(String firstName, String lastName, String phoneNumber, String email,
                           String defaultCron) throws SQLException {
        String userSql = "INSERT INTO users (first_name, last_name, phone_number, email, created_at, updated_at) " +
                         "VALUES (?, ?, ?, ?, ?, ?)";
        String settingSql = "INSERT INTO probe_settings (user_id, active, cron_expression, created_at, updated_at) " +
                            "VALUES (?, FALSE, ?, ?, ?)";

        try (Connection conn = database.getConnection()) {
            conn.setAutoCommit(false);

            try {
                Timestamp now = Timestamp.valueOf(LocalDateTime.now());
                long userId;

                try (PreparedStatement stmt = conn.prepareStatement(userSql, Statement.RETURN_GENERATED_KEYS)) {
                    stmt.setString(1, firstName);
                    stmt.setString(2, lastName);
                    stmt.setString(3, phoneNumber);
                    stmt.setString(4, email);
                    stmt.setTimestamp(5, now);
                    stmt.setTimestamp(6, now);
                    stmt.executeUpdate();
                    userId = generatedId(stmt);
                }

                try (PreparedStatement stmt = conn.prepareStatement(settingSql)) {
                    stmt.setLong(1, userId);
                    stmt.setString(2, defaultCron);
                    stmt.setTimestamp(3, now);
                    stmt.setTimestamp(4, now);
                    stmt.executeUpdate();
                }

                conn.commit();
                logger.info("Created user " + userId + " (" + firstName + " " + lastName + ")");

                return selectUser(conn, " WHERE u.id = ?", userId)
                        .orElseThrow(() -> new SQLException("Created user " + userId + " not found"));
            } catch (SQLException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    logger.log(Level.WARNING, "Error during rollback", rollbackEx);
                }
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        }
    }

    public Contact addContact(long userId, String firstName, String lastName, String phoneNumber, String email,
                              boolean emergencyContact) throws SQLException {
        String sql = "INSERT INTO contacts (user_id, first_name, last_name, phone_number, email, " +
                     "is_emergency_contact, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            LocalDateTime now = LocalDateTime.now();

            stmt.setLong(1, userId);
            stmt.setString(2, firstName);
            stmt.setString(3, lastName);
            stmt.setString(4, phoneNumber);
            stmt.setString(5, email);
            stmt.setBoolean(6, emergencyContact);
            stmt.setTimestamp(7, Timestamp.valueOf(now));
            stmt.setTimestamp(8, Timestamp.valueOf(now));
            stmt.executeUpdate();

            Contact contact = new Contact();
            contact.setId(generatedId(stmt));
            contact.setUserId(userId);
            contact.setFirstName(firstName);
            contact.setLastName(lastName);
            contact.setPhoneNumber(phoneNumber);
            contact.setEmail(email);
            contact.setEmergencyContact(emergencyContact);
            contact.setCreatedAt(now);
            contact.setUpdatedAt(now);
            return contact;
        }
    }

    public Optional<User> findUser(long userId) throws SQLException {
        try (Connection conn = database.getConnection()) {
            return selectUser(conn, " WHERE u.id = ?", userId);
        }
    }

    public Optional<User> findUserByPhone(String phoneNumber) throws SQLException {
        try (Connection conn = database.getConnection()) {
            return selectUser(conn, " WHERE u.phone_number = ?", phoneNumber);
        }
    }

    /**
     * Users whose probe settings are active, in id order.
     */
    public List<User> usersWithActiveProbe() throws SQLException {
        String sql = USER_WITH_SETTINGS + " WHERE s.active = TRUE ORDER BY u.id ASC";
        List<User> users = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                users.add(mapResultSetToUser(rs));
            }
        }

        return users;
    }

    /**
     * The user's oldest contact flagged as an emergency contact.
     */
    public Optional<Contact> emergencyContact(long userId) throws SQLException {
        String sql = "SELECT * FROM contacts WHERE user_id = ? AND is_emergency_contact = TRUE ORDER BY id ASC LIMIT 1";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, userId);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSetToContact(rs));
                }
            }
        }

        return Optional.empty();
    }

    /**
     * Overwrite a user's probe settings.
     *
     * @return the stored settings
     * @throws SQLException if the user has no settings row
     */
    public ProbeSetting updateProbeSettings(long userId, boolean active, String cronExpression) throws SQLException {
        String sql = "UPDATE probe_settings SET active = ?, cron_expression = ?, updated_at = ? WHERE user_id = ?";

        try (Connection conn = database.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setBoolean(1, active);
                stmt.setString(2, cronExpression);
                stmt.setTimestamp(3, Timestamp.valueOf(LocalDateTime.now()));
                stmt.setLong(4, userId);

                if (stmt.executeUpdate() == 0) {
                    throw new SQLException("No probe settings for user " + userId);
                }
            }

            return selectUser(conn, " WHERE u.id = ?", userId)
                    .map(User::getProbeSetting)
                    .orElseThrow(() -> new SQLException("No probe settings for user " + userId));
        }
    }

    private Optional<User> selectUser(Connection conn, String where, Object key) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(USER_WITH_SETTINGS + where)) {
            stmt.setObject(1, key);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSetToUser(rs));
                }
            }
        }
        return Optional.empty();
    }

    private static long generatedId(PreparedStatement stmt) throws SQLException {
        try (ResultSet keys = stmt.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("No id generated");
            }
            return keys.getLong(1);
        }
    }

    private User mapResultSetToUser(ResultSet rs) throws SQLException {
        User user = new User();
        user.setId(rs.getLong("id"));
        user.setFirstName(rs.getString("first_name"));
        user.setLastName(rs.getString("last_name"));
        user.setPhoneNumber(rs.getString("phone_number"));
        user.setEmail(rs.getString("email"));
        user.setCreatedAt(rs.getTimestamp("created_at").toLocalDateTime());
        user.setUpdatedAt(rs.getTimestamp("updated_at").toLocalDateTime());

        ProbeSetting setting = new ProbeSetting();
        setting.setId(rs.getLong("setting_id"));
        setting.setUserId(user.getId());
        setting.setActive(rs.getBoolean("active"));
        setting.setCronExpression(rs.getString("cron_expression"));
        setting.setCreatedAt(rs.getTimestamp("setting_created_at").toLocalDateTime());
        setting.setUpdatedAt(rs.getTimestamp("setting_updated_at").toLocalDateTime());
        user.setProbeSetting(setting);

        return user;
    }

    private Contact mapResultSetToContact(ResultSet rs) throws SQLException {
        Contact contact = new Contact();
        contact.setId(rs.getLong("id"));
        contact.setUserId(rs.getLong("user_id"));
        contact.setFirstName(rs.getString("first_name"));
        contact.setLastName(rs.getString("last_name"));
        contact.setPhoneNumber(rs.getString("phone_number"));
        contact.setEmail(rs.getString("email"));
        contact.setEmergencyContact(rs.getBoolean("is_emergency_contact"));
        contact.setCreatedAt(rs.getTimestamp("created_at").toLocalDateTime());
        contact.setUpdatedAt(rs.getTimestamp("updated_at").toLocalDateTime());
        return contact;
    }
}
