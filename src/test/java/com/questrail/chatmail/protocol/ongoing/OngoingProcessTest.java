package com.questrail.chatmail.protocol.ongoing;

import com.questrail.chatmail.api.OngoingProcessException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class OngoingProcessTest {

    private OngoingProcess ongoing;

    @BeforeEach
    void setUp() {
        ongoing = new OngoingProcess();
    }

    @Test
    void onlyOneProcessAtATime() {
        try (OngoingProcess.Token token = ongoing.start("secure-join")) {
            assertTrue(ongoing.isRunning());
            assertThrows(OngoingProcessException.class, () -> ongoing.start("configure"));
        }
        assertFalse(ongoing.isRunning());

        try (OngoingProcess.Token token = ongoing.start("configure")) {
            assertEquals("configure", token.name());
        }
    }

    @Test
    void stopCancelsAndRunsCallbacks() {
        AtomicInteger woken = new AtomicInteger();
        try (OngoingProcess.Token token = ongoing.start("secure-join")) {
            token.onCancel(woken::incrementAndGet);

            assertTrue(ongoing.stop());

            assertTrue(token.isCancelled());
            assertEquals(1, woken.get());
        }
    }

    @Test
    void stopWithoutProcessReportsFalse() {
        assertFalse(ongoing.stop());
    }

    @Test
    void closingStaleTokenKeepsNewerProcess() {
        OngoingProcess.Token first = ongoing.start("first");
        first.close();
        OngoingProcess.Token second = ongoing.start("second");

        first.close();

        assertTrue(ongoing.isRunning());
        second.close();
        assertFalse(ongoing.isRunning());
    }
}
