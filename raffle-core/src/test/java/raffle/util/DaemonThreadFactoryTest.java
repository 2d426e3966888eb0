package raffle.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsNamedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("raffle-broadcast-");

        Thread thread = factory.newThread(() -> {
        });

        assertTrue(thread.isDaemon());
        assertEquals("raffle-broadcast-1", thread.getName());
        assertNotNull(thread.getUncaughtExceptionHandler());
    }

    @Test
    void sequentialNaming() {
        DaemonThreadFactory factory = new DaemonThreadFactory("test-");

        factory.newThread(() -> {
        });
        Thread second = factory.newThread(() -> {
        });

        assertEquals("test-2", second.getName());
        assertEquals("test-", factory.prefix());
    }

    @Test
    void rejectsMissingPrefix() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
        assertThrows(IllegalArgumentException.class, () -> new DaemonThreadFactory(" "));
    }
}
