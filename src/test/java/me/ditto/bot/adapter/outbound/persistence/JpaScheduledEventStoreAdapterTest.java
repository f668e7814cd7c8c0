package me.ditto.bot.adapter.outbound.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.ditto.bot.domain.model.ScheduledEvent;
import me.ditto.bot.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({ JpaScheduledEventStoreAdapter.class, ScheduledEventPayloadCodec.class,
        JpaScheduledEventStoreAdapterTest.JacksonConfig.class })
class JpaScheduledEventStoreAdapterTest {

    private static final Instant CREATED = Instant.parse("2026-10-19T12:00:00Z");

    @Autowired
    private JpaScheduledEventStoreAdapter adapter;

    @Autowired
    private ScheduledEventRepository repository;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    @Test
    void shouldAssignIncreasingIds() {
        long first = adapter.insert(event("a", CREATED.plusSeconds(60)));
        long second = adapter.insert(event("b", CREATED.plusSeconds(30)));

        assertTrue(second > first);
        assertEquals(2, adapter.count());
    }

    @Test
    void shouldFetchSoonestEvent() {
        adapter.insert(event("later", CREATED.plusSeconds(120)));
        long soonest = adapter.insert(event("soon", CREATED.plusSeconds(10)));
        adapter.insert(event("middle", CREATED.plusSeconds(60)));

        Optional<ScheduledEvent> fetched = adapter.fetchSoonest();

        assertTrue(fetched.isPresent());
        assertEquals(soonest, fetched.get().getId());
        assertEquals("soon", fetched.get().getEventType());
        assertEquals(CREATED.plusSeconds(10), fetched.get().getScheduledFor());
        assertEquals(CREATED, fetched.get().getCreatedAt());
    }

    @Test
    void shouldBreakTiesByInsertionOrder() {
        Instant due = CREATED.plusSeconds(30);
        long first = adapter.insert(event("first", due));
        adapter.insert(event("second", due));

        assertEquals(first, adapter.fetchSoonest().orElseThrow().getId());
    }

    @Test
    void shouldRoundTripPayload() {
        ScheduledEvent event = event("ping", CREATED.plusSeconds(5));
        event.setArgs(List.of(1, 2));
        event.setKwargs(Map.of("x", "y"));

        adapter.insert(event);
        ScheduledEvent fetched = adapter.fetchSoonest().orElseThrow();

        assertEquals(List.of(1, 2), fetched.getArgs());
        assertEquals(Map.of("x", "y"), fetched.getKwargs());
    }

    @Test
    void shouldReturnEmptyWhenNothingPending() {
        assertTrue(adapter.fetchSoonest().isEmpty());
        assertEquals(0, adapter.count());
    }

    @Test
    void shouldDeleteById() {
        long first = adapter.insert(event("first", CREATED.plusSeconds(5)));
        long second = adapter.insert(event("second", CREATED.plusSeconds(10)));

        adapter.delete(first);
        adapter.delete(first);
        adapter.delete(9999L);

        assertEquals(1, adapter.count());
        assertEquals(second, adapter.fetchSoonest().orElseThrow().getId());
    }

    @Test
    void shouldTolerateMalformedPayloadRows() {
        ScheduledEventEntity entity = new ScheduledEventEntity();
        entity.setCreatedAt(CREATED);
        entity.setScheduledFor(CREATED.plusSeconds(5));
        entity.setEventType("broken");
        entity.setPayload("{oops");
        repository.save(entity);

        ScheduledEvent fetched = adapter.fetchSoonest().orElseThrow();

        assertEquals("broken", fetched.getEventType());
        assertTrue(fetched.getArgs().isEmpty());
        assertTrue(fetched.getKwargs().isEmpty());
    }

    private static ScheduledEvent event(String type, Instant scheduledFor) {
        return ScheduledEvent.builder()
                .createdAt(CREATED)
                .scheduledFor(scheduledFor)
                .eventType(type)
                .build();
    }

    @TestConfiguration
    static class JacksonConfig {

        @Bean
        ObjectMapper objectMapper() {
            return AutoConfiguration.objectMapper();
        }
    }
}
