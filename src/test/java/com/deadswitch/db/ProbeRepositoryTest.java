package com.deadswitch.db;

import com.deadswitch.core.Contact;
import com.deadswitch.core.EmergencyProbe;
import com.deadswitch.core.Probe;
import com.deadswitch.core.ProbeStatus;
import com.deadswitch.core.User;
import com.deadswitch.testing.TestClock;
import com.deadswitch.testing.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ProbeRepositoryTest {

    private Database database;
    private UserRepository users;
    private ProbeRepository probes;
    private TestClock clock;
    private User user;

    @BeforeEach
    public void setUp() throws Exception {
        database = TestDatabases.newDatabase();
        clock = TestClock.startingNow();
        users = new UserRepository(database);
        probes = new ProbeRepository(database, clock);
        user = users.createUser("ada", "lovelace", "+15550001", "ada@example.com", "0 0 18 * * WED");
    }

    @AfterEach
    public void tearDown() {
        TestDatabases.destroy(database);
    }

    @Test
    public void testOnePendingProbePerUser() throws Exception {
        Probe probe = probes.createPendingProbe(user.getId());
        assertEquals(ProbeStatus.PENDING, probe.getStatus());

        assertThrows(SQLException.class, () -> probes.createPendingProbe(user.getId()));

        assertTrue(probes.setStatusIfPending(probe.getId(), ProbeStatus.GOOD, "yes"));
        Probe next = probes.createPendingProbe(user.getId());

        assertEquals(next.getId(), probes.lastProbeForUser(user.getId()).orElseThrow().getId());
        assertEquals("yes", probes.findProbe(probe.getId()).orElseThrow().getLastResponse());
    }

    @Test
    public void testTransitionsOnlyApplyWhilePending() throws Exception {
        Probe probe = probes.createPendingProbe(user.getId());

        assertTrue(probes.setStatusIfPending(probe.getId(), ProbeStatus.UNAVAILABLE, null));
        assertFalse(probes.setStatusIfPending(probe.getId(), ProbeStatus.GOOD, "yes"));
        assertFalse(probes.incrementRetryCount(probe.getId()));
        assertFalse(probes.saveLastResponse(probe.getId(), "hello?"));

        Probe stored = probes.findProbe(probe.getId()).orElseThrow();
        assertEquals(ProbeStatus.UNAVAILABLE, stored.getStatus());
        assertEquals("", stored.getLastResponse());
        assertThrows(IllegalArgumentException.class,
                () -> probes.setStatusIfPending(probe.getId(), ProbeStatus.PENDING, null));
    }

    @Test
    public void testIncrementRetryCountUsesClock() throws Exception {
        Probe probe = probes.createPendingProbe(user.getId());

        clock.advance(Duration.ofHours(2));
        assertTrue(probes.incrementRetryCount(probe.getId()));

        Probe stored = probes.findProbe(probe.getId()).orElseThrow();
        assertEquals(1, stored.getRetryCount());
        assertEquals(Duration.ofHours(2), Duration.between(probe.getUpdatedAt(), stored.getUpdatedAt()));
    }

    @Test
    public void testSaveLastResponseKeepsFollowUpClock() throws Exception {
        Probe probe = probes.createPendingProbe(user.getId());

        clock.advance(Duration.ofMinutes(10));
        assertTrue(probes.saveLastResponse(probe.getId(), "who is this?"));

        Probe stored = probes.findProbe(probe.getId()).orElseThrow();
        assertEquals("who is this?", stored.getLastResponse());
        assertEquals(ProbeStatus.PENDING, stored.getStatus());
        assertEquals(probe.getUpdatedAt(), stored.getUpdatedAt());
    }

    @Test
    public void testCancelAllPendingProbes() throws Exception {
        Probe probe = probes.createPendingProbe(user.getId());

        assertEquals(1, probes.cancelAllPendingProbes(user.getId()));
        assertEquals(0, probes.cancelAllPendingProbes(user.getId()));
        assertEquals(ProbeStatus.CANCELLED, probes.findProbe(probe.getId()).orElseThrow().getStatus());
        assertTrue(probes.probesByStatus(ProbeStatus.PENDING).isEmpty());
        assertEquals(1, probes.countByStatus().get(ProbeStatus.CANCELLED));
    }

    @Test
    public void testEmergencyProbeAudit() throws Exception {
        Contact contact = users.addContact(user.getId(), "charles", "babbage", "+15559002", "cb@example.com", true);
        Probe probe = probes.createPendingProbe(user.getId());

        EmergencyProbe created = probes.createEmergencyProbe(probe.getId(), contact.getId(), false);

        List<EmergencyProbe> stored = probes.emergencyProbesFor(probe.getId());
        assertEquals(1, stored.size());
        assertEquals(created.getId(), stored.get(0).getId());
        assertFalse(stored.get(0).isDelivered());
        assertFalse(stored.get(0).isAcknowledged());
    }
}
