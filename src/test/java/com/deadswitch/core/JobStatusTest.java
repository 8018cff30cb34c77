package com.deadswitch.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JobStatusTest {

    @Test
    public void testDbNamesRoundTrip() {
        assertEquals(JobStatus.IN_PROGRESS, JobStatus.fromDbName("in-progress"));
        assertEquals("in-progress", JobStatus.IN_PROGRESS.toString());
        assertThrows(IllegalArgumentException.class, () -> JobStatus.fromDbName("running"));
    }

    @Test
    public void testTerminalStatuses() {
        assertTrue(JobStatus.SUCCESSFUL.isTerminal());
        assertTrue(JobStatus.DEAD.isTerminal());
        assertFalse(JobStatus.SCHEDULED.isTerminal());
        assertFalse(JobStatus.IN_PROGRESS.isTerminal());
    }
}
