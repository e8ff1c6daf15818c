package FacturaBot;

import FacturaBot.nlp.EntityRecognitionClient;
import FacturaBot.nlp.EntityRecognitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EntityRecognitionClientTest {

    /** Clock the test moves by hand. */
    private static final class ManualClock extends Clock {
        private Instant now = Instant.parse("2024-03-01T10:00:00Z");

        void advance(Duration duration) { now = now.plus(duration); }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant() { return now; }
    }

    /** Client whose reachability check only counts calls. */
    private static final class CountingClient extends EntityRecognitionClient {
        final AtomicInteger checks = new AtomicInteger();
        volatile boolean up;

        CountingClient(String baseUrl, Clock clock) {
            super(baseUrl, "es_core_news_sm", 1, Duration.ofSeconds(60), clock);
        }

        @Override
        public boolean isServerReachable() {
            checks.incrementAndGet();
            return up;
        }
    }

    @Test
    @DisplayName("DISPONIBILIDAD: Resultado en caché hasta que pasa el intervalo")
    void testAvailabilityCached() {
        // Arrange
        ManualClock clock = new ManualClock();
        CountingClient client = new CountingClient("http://127.0.0.1:1", clock);

        // Act + Assert
        assertFalse(client.isAvailable());
        client.up = true;
        assertFalse(client.isAvailable(), "still cached");
        assertEquals(1, client.checks.get());

        clock.advance(Duration.ofSeconds(61));
        assertTrue(client.isAvailable());
        assertTrue(client.isAvailable());
        assertEquals(2, client.checks.get());
    }

    @Test
    @DisplayName("DISPONIBILIDAD: Un fallo de conexión marca el servicio como no disponible")
    void testConnectionFailureMarksUnavailable() {
        ManualClock clock = new ManualClock();
        CountingClient client = new CountingClient("http://127.0.0.1:1", clock);
        client.up = true;
        assertTrue(client.isAvailable());

        // nothing listens on port 1
        assertThrows(EntityRecognitionException.class, () -> client.recognize("Total: 100.00"));

        assertFalse(client.isAvailable());
        assertEquals(1, client.checks.get());
    }

    @Test
    @DisplayName("DISPONIBILIDAD: Servicio inexistente no es alcanzable")
    void testDeadServiceNotReachable() {
        EntityRecognitionClient client = new EntityRecognitionClient("http://127.0.0.1:1", "es_core_news_sm", 1);

        assertFalse(client.isAvailable());
    }
}
