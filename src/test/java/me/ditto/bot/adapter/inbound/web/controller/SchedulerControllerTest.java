package me.ditto.bot.adapter.inbound.web.controller;

import me.ditto.bot.domain.model.ScheduledEvent;
import me.ditto.bot.domain.service.EventScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SchedulerControllerTest {

    private static final Instant DUE = Instant.parse("2026-10-20T09:00:00Z");

    private EventScheduler eventScheduler;
    private SchedulerController controller;

    @BeforeEach
    void setUp() {
        eventScheduler = mock(EventScheduler.class);
        controller = new SchedulerController(eventScheduler);
    }

    @Test
    void getStateShouldReturnRunningFlagPendingCountAndNextEvent() {
        when(eventScheduler.isRunning()).thenReturn(true);
        when(eventScheduler.getPendingCount()).thenReturn(2L);
        when(eventScheduler.getNextScheduledEvent()).thenReturn(Optional.of(event(11L, "ping")));

        StepVerifier.create(controller.getState())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    SchedulerController.SchedulerStateResponse body = response.getBody();
                    assertNotNull(body);
                    assertTrue(body.running());
                    assertEquals(2L, body.pendingCount());
                    assertEquals(11L, body.nextEvent().id());
                    assertEquals("ping", body.nextEvent().eventType());
                })
                .verifyComplete();
    }

    @Test
    void getStateShouldOmitNextEventWhenIdle() {
        when(eventScheduler.getNextScheduledEvent()).thenReturn(Optional.empty());

        StepVerifier.create(controller.getState())
                .assertNext(response -> {
                    SchedulerController.SchedulerStateResponse body = response.getBody();
                    assertNotNull(body);
                    assertFalse(body.running());
                    assertNull(body.nextEvent());
                })
                .verifyComplete();
    }

    @Test
    void scheduleEventShouldReturnCreatedEvent() {
        ScheduledEvent created = event(12L, "ping");
        created.setArgs(List.of(1, "two"));
        created.setKwargs(Map.of("three", 3));
        when(eventScheduler.schedule(DUE, "ping", List.of(1, "two"), Map.of("three", 3))).thenReturn(created);

        SchedulerController.ScheduleEventRequest request = new SchedulerController.ScheduleEventRequest(
                DUE, " ping ", List.of(1, "two"), Map.of("three", 3));

        StepVerifier.create(controller.scheduleEvent(request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    SchedulerController.ScheduledEventDto body = response.getBody();
                    assertNotNull(body);
                    assertEquals(12L, body.id());
                    assertEquals(DUE, body.scheduledFor());
                    assertEquals(List.of(1, "two"), body.args());
                    assertEquals(Map.of("three", 3), body.kwargs());
                })
                .verifyComplete();
    }

    @Test
    void scheduleEventShouldDefaultMissingArguments() {
        when(eventScheduler.schedule(DUE, "ping", List.of(), Map.of())).thenReturn(event(13L, "ping"));

        StepVerifier.create(controller.scheduleEvent(
                new SchedulerController.ScheduleEventRequest(DUE, "ping", null, null)))
                .assertNext(response -> assertEquals(HttpStatus.CREATED, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void scheduleEventShouldRejectMissingFields() {
        ResponseStatusException noTime = assertThrows(ResponseStatusException.class,
                () -> controller.scheduleEvent(new SchedulerController.ScheduleEventRequest(null, "ping", null, null)));
        ResponseStatusException noType = assertThrows(ResponseStatusException.class,
                () -> controller.scheduleEvent(new SchedulerController.ScheduleEventRequest(DUE, " ", null, null)));

        assertEquals(HttpStatus.BAD_REQUEST, noTime.getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST, noType.getStatusCode());
        verify(eventScheduler, never()).schedule(any(), anyString(), anyList(), anyMap());
    }

    @Test
    void scheduleEventShouldPropagateSchedulerValidationErrors() {
        when(eventScheduler.schedule(DUE, "ping", List.of(), Map.of()))
                .thenThrow(new IllegalArgumentException("Event time is in the past"));

        StepVerifier.create(controller.scheduleEvent(
                new SchedulerController.ScheduleEventRequest(DUE, "ping", null, null)))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void getNextEventShouldReturnNoContentWhenIdle() {
        when(eventScheduler.getNextScheduledEvent()).thenReturn(Optional.empty());

        StepVerifier.create(controller.getNextEvent())
                .assertNext(response -> assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void restartShouldBeAcceptedWhenRunning() {
        when(eventScheduler.isRunning()).thenReturn(true);

        StepVerifier.create(controller.restart())
                .assertNext(response -> assertEquals(HttpStatus.ACCEPTED, response.getStatusCode()))
                .verifyComplete();
        verify(eventScheduler).restart();
    }

    @Test
    void restartShouldFailWhenStopped() {
        when(eventScheduler.isRunning()).thenReturn(false);

        assertThrows(IllegalStateException.class, () -> controller.restart());
        verify(eventScheduler, never()).restart();
    }

    private static ScheduledEvent event(Long id, String type) {
        return ScheduledEvent.builder()
                .id(id)
                .eventType(type)
                .createdAt(DUE.minusSeconds(3600))
                .scheduledFor(DUE)
                .build();
    }
}
