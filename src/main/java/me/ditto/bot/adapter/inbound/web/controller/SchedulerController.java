package me.ditto.bot.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.ditto.bot.domain.model.ScheduledEvent;
import me.ditto.bot.domain.service.EventScheduler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Endpoints for scheduling events and inspecting the scheduler.
 */
@RestController
@RequestMapping("/api/scheduler")
@RequiredArgsConstructor
public class SchedulerController {

    private final EventScheduler eventScheduler;

    @GetMapping
    public Mono<ResponseEntity<SchedulerStateResponse>> getState() {
        return Mono.fromCallable(() -> new SchedulerStateResponse(
                eventScheduler.isRunning(),
                eventScheduler.getPendingCount(),
                eventScheduler.getNextScheduledEvent().map(SchedulerController::toDto).orElse(null)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/events")
    public Mono<ResponseEntity<ScheduledEventDto>> scheduleEvent(@RequestBody ScheduleEventRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        if (request.scheduledFor() == null) {
            throw badRequest("scheduledFor is required");
        }
        if (request.eventType() == null || request.eventType().isBlank()) {
            throw badRequest("eventType is required");
        }

        return Mono.fromCallable(() -> eventScheduler.schedule(
                request.scheduledFor(),
                request.eventType().trim(),
                request.args() != null ? request.args() : List.of(),
                request.kwargs() != null ? request.kwargs() : Map.of()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(event -> ResponseEntity.status(HttpStatus.CREATED).body(toDto(event)));
    }

    @GetMapping("/next")
    public Mono<ResponseEntity<ScheduledEventDto>> getNextEvent() {
        return Mono.just(eventScheduler.getNextScheduledEvent()
                .map(event -> ResponseEntity.ok(toDto(event)))
                .orElseGet(() -> ResponseEntity.noContent().build()));
    }

    @PostMapping("/restart")
    public Mono<ResponseEntity<Void>> restart() {
        if (!eventScheduler.isRunning()) {
            throw new IllegalStateException("Event scheduler is not running");
        }
        eventScheduler.restart();
        return Mono.just(ResponseEntity.accepted().build());
    }

    private static ScheduledEventDto toDto(ScheduledEvent event) {
        return new ScheduledEventDto(
                event.getId(),
                event.getEventType(),
                event.getCreatedAt(),
                event.getScheduledFor(),
                event.getArgs(),
                event.getKwargs());
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    public record ScheduleEventRequest(
            Instant scheduledFor,
            String eventType,
            List<Object> args,
            Map<String, Object> kwargs) {
    }

    public record ScheduledEventDto(
            Long id,
            String eventType,
            Instant createdAt,
            Instant scheduledFor,
            List<Object> args,
            Map<String, Object> kwargs) {
    }

    public record SchedulerStateResponse(boolean running, long pendingCount, ScheduledEventDto nextEvent) {
    }
}
