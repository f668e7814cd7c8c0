package me.ditto.bot;

import me.ditto.bot.domain.model.ScheduledEventFiredEvent;
import me.ditto.bot.domain.service.EventScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.event.EventListener;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
class DittoIntegrationTest {

    private static final String PING = "integration_ping";

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private EventScheduler eventScheduler;

    @Autowired
    private FiredEventCollector collector;

    @BeforeEach
    void setUp() {
        collector.events.clear();
        eventScheduler.start();
    }

    @AfterEach
    void tearDown() {
        eventScheduler.stop();
    }

    @Test
    void shouldDeliverEventScheduledOverHttp() throws InterruptedException {
        Map<String, Object> request = Map.of(
                "scheduledFor", Instant.now().plusMillis(300).toString(),
                "eventType", PING,
                "args", List.of(1, "two"),
                "kwargs", Map.of("three", 3));

        webTestClient.post().uri("/api/scheduler/events")
                .bodyValue(request)
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.id").isNotEmpty()
                .jsonPath("$.eventType").isEqualTo(PING);

        ScheduledEventFiredEvent fired = collector.events.poll(10, TimeUnit.SECONDS);
        assertNotNull(fired);
        assertEquals(List.of(1, "two"), fired.args());
        assertEquals(3, fired.kwargs().get("three"));
    }

    @Test
    void shouldScheduleEventWithoutArgumentsOverHttp() {
        Map<String, Object> request = Map.of(
                "scheduledFor", Instant.now().plusSeconds(3600).toString(),
                "eventType", "integration_later");

        webTestClient.post().uri("/api/scheduler/events")
                .bodyValue(request)
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.args").isEmpty()
                .jsonPath("$.kwargs").isEmpty();
    }

    @Test
    void shouldRejectEventInThePast() {
        Map<String, Object> request = Map.of(
                "scheduledFor", Instant.now().minusSeconds(60).toString(),
                "eventType", PING);

        webTestClient.post().uri("/api/scheduler/events")
                .bodyValue(request)
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.BAD_REQUEST)
                .expectBody()
                .jsonPath("$.status").isEqualTo(400);
    }

    @Test
    void shouldRunCommandsOverHttp() {
        webTestClient.post().uri("/api/commands/timezone")
                .bodyValue(Map.of("args", List.of("set", "Asia/Tokyo"), "userId", "42"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true);

        webTestClient.post().uri("/api/commands/timezone")
                .bodyValue(Map.of("args", List.of("get"), "userId", "42"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.output").value(output -> assertTrue(output.toString().contains("(Asia/Tokyo, UTC+09:00)")));

        webTestClient.post().uri("/api/commands/dance")
                .exchange()
                .expectStatus().isNotFound();
    }

    @TestConfiguration
    static class CollectorConfig {

        @Bean
        FiredEventCollector firedEventCollector() {
            return new FiredEventCollector();
        }
    }

    public static class FiredEventCollector {

        final BlockingQueue<ScheduledEventFiredEvent> events = new LinkedBlockingQueue<>();

        @EventListener(condition = "#event.eventType == '" + PING + "'")
        public void onPing(ScheduledEventFiredEvent event) {
            events.add(event);
        }
    }
}
