package com.deadswitch.db;

import com.deadswitch.core.Contact;
import com.deadswitch.core.ProbeSetting;
import com.deadswitch.core.User;
import com.deadswitch.testing.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class UserRepositoryTest {

    private Database database;
    private UserRepository users;

    @BeforeEach
    public void setUp() throws Exception {
        database = TestDatabases.newDatabase();
        users = new UserRepository(database);
    }

    @AfterEach
    public void tearDown() {
        TestDatabases.destroy(database);
    }

    @Test
    public void testCreateUserWithDefaultSettings() throws Exception {
        User user = users.createUser("ada", "lovelace", "+15550001", "ada@example.com", "0 0 18 * * WED");

        assertTrue(user.getId() > 0);
        ProbeSetting setting = user.getProbeSetting();
        assertNotNull(setting);
        assertFalse(setting.isActive());
        assertEquals("0 0 18 * * WED", setting.getCronExpression());
        assertEquals(user.getId(), setting.getUserId());

        assertEquals("ada", users.findUserByPhone("+15550001").orElseThrow().getFirstName());
        assertTrue(users.findUser(user.getId() + 100).isEmpty());
    }

    @Test
    public void testDefaultScheduleForNewUsers() throws Exception {
        UserRepository withDefault = new UserRepository(database, "0 0 9 * * MON");

        User user = withDefault.createUser("ada", "lovelace", "+15550001", "ada@example.com");

        assertEquals("0 0 9 * * MON", user.getProbeSetting().getCronExpression());
        assertFalse(user.getProbeSetting().isActive());
    }

    @Test
    public void testDuplicatePhoneNumberRollsBack() throws Exception {
        users.createUser("ada", "lovelace", "+15550001", "ada@example.com", "0 0 18 * * WED");

        assertThrows(SQLException.class,
                () -> users.createUser("bob", "smith", "+15550001", "bob@example.com", "0 0 18 * * WED"));

        // the pool connection is usable again after the rollback
        User bob = users.createUser("bob", "smith", "+15550002", "bob@example.com", "0 0 18 * * WED");
        assertEquals("bob", users.findUser(bob.getId()).orElseThrow().getFirstName());
    }

    @Test
    public void testEmergencyContactIsOldestFlaggedContact() throws Exception {
        User user = users.createUser("ada", "lovelace", "+15550001", "ada@example.com", "0 0 18 * * WED");

        assertTrue(users.emergencyContact(user.getId()).isEmpty());

        users.addContact(user.getId(), "friend", "one", "+15559001", "f1@example.com", false);
        Contact first = users.addContact(user.getId(), "charles", "babbage", "+15559002", "cb@example.com", true);
        users.addContact(user.getId(), "mary", "somerville", "+15559003", "ms@example.com", true);

        Contact found = users.emergencyContact(user.getId()).orElseThrow();
        assertEquals(first.getId(), found.getId());
        assertTrue(found.isEmergencyContact());
    }

    @Test
    public void testUpdateProbeSettingsAndActiveUsers() throws Exception {
        User ada = users.createUser("ada", "lovelace", "+15550001", "ada@example.com", "0 0 18 * * WED");
        User bob = users.createUser("bob", "smith", "+15550002", "bob@example.com", "0 0 18 * * WED");

        assertTrue(users.usersWithActiveProbe().isEmpty());

        ProbeSetting updated = users.updateProbeSettings(bob.getId(), true, "0 30 9 * * MON");
        assertTrue(updated.isActive());
        assertEquals("0 30 9 * * MON", updated.getCronExpression());

        List<User> active = users.usersWithActiveProbe();
        assertEquals(1, active.size());
        assertEquals(bob.getId(), active.get(0).getId());
        assertEquals("0 30 9 * * MON", active.get(0).getProbeSetting().getCronExpression());

        assertFalse(users.findUser(ada.getId()).orElseThrow().getProbeSetting().isActive());
        assertThrows(SQLException.class, () -> users.updateProbeSettings(9999L, true, "0 0 18 * * WED"));
    }
}
