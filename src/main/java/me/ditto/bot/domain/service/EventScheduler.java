package me.ditto.bot.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.ditto.bot.domain.model.InvalidScheduleException;
import me.ditto.bot.domain.model.ScheduledEvent;
import me.ditto.bot.domain.model.SchedulerStateException;
import me.ditto.bot.domain.model.StoreUnavailableException;
import me.ditto.bot.infrastructure.config.BotProperties;
import me.ditto.bot.port.outbound.EventDispatchPort;
import me.ditto.bot.port.outbound.ScheduledEventStore;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable scheduler that delivers named events at (or after) their due time.
 *
 * <p>
 * Events are persisted through {@link ScheduledEventStore}; only the soonest
 * one is held in memory. A single background thread repeatedly:
 * <ol>
 * <li>fetches the soonest pending event (or waits for {@link #schedule} when
 * the store is empty)</li>
 * <li>sleeps until the event is due</li>
 * <li>deletes it from the store</li>
 * <li>hands it to {@link EventDispatchPort}</li>
 * </ol>
 *
 * <p>
 * Scheduling an event that is due before the one currently being waited on
 * preempts the sleep and sends the loop back to step 1. Deletion happens
 * before dispatch, so delivery is at-most-once: a crash between the two loses
 * the event, a crash before the delete redelivers it after restart.
 *
 * @since 1.0
 * @see ScheduledEvent
 */
@Service
@Slf4j
public class EventScheduler {

    private static final String THREAD_NAME = "event-scheduler";

    private final ScheduledEventStore store;
    private final EventDispatchPort dispatchPort;
    private final Clock clock;
    private final BotProperties.SchedulerProperties properties;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeup = lock.newCondition();

    // guarded by lock
    private long generation;
    private long lastScheduledId;
    private long lastFetchedId;
    private boolean restartRequested;
    private boolean stopping;
    private ScheduledEvent current;

    private volatile boolean running;
    private ExecutorService executor;
    private Future<?> loopTask;

    public EventScheduler(ScheduledEventStore store, EventDispatchPort dispatchPort, Clock clock,
            BotProperties properties) {
        this.store = store;
        this.dispatchPort = dispatchPort;
        this.clock = clock;
        this.properties = properties.getScheduler();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isEnabled()) {
            log.info("[Scheduler] Event scheduler disabled");
            return;
        }
        start();
    }

    /**
     * Starts the dispatch loop. Does nothing if it is already running.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        lock.lock();
        try {
            stopping = false;
            restartRequested = false;
        } finally {
            lock.unlock();
        }
        if (executor != null) {
            // previous loop ended on its own
            executor.shutdown();
        }
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            return t;
        });
        running = true;
        loopTask = executor.submit(this::runLoop);
        log.info("[Scheduler] Started");
    }

    @PreDestroy
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        lock.lock();
        try {
            stopping = true;
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }
        loopTask.cancel(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(properties.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        loopTask = null;
        // the loop may have been cancelled before it ever ran
        running = false;
        log.info("[Scheduler] Shut down");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Schedules an event with positional arguments only.
     *
     * @see #schedule(Instant, String, List, Map)
     */
    public ScheduledEvent schedule(Instant time, String eventType, Object... args) {
        return schedule(time, eventType, args != null ? Arrays.asList(args) : List.of(), Map.of());
    }

    /**
     * Persists an event that will be dispatched as {@code eventType} once
     * {@code time} has been reached.
     *
     * @param time
     *            due instant, must not be in the past
     * @param eventType
     *            listener topic name
     * @param args
     *            positional payload, JSON-serializable
     * @param kwargs
     *            named payload, JSON-serializable
     * @return the persisted event with its store-assigned id
     * @throws InvalidScheduleException
     *             if {@code time} is in the past or the event type is blank
     */
    public ScheduledEvent schedule(Instant time, String eventType, List<?> args, Map<String, ?> kwargs) {
        if (time == null) {
            throw new InvalidScheduleException("Scheduled time is required");
        }
        if (eventType == null || eventType.isBlank()) {
            throw new InvalidScheduleException("Event type is required");
        }
        if (kwargs != null && kwargs.keySet().stream().anyMatch(Objects::isNull)) {
            throw new InvalidScheduleException("Keyword argument names must not be null");
        }

        Instant now = clock.instant();
        if (time.isBefore(now)) {
            throw InvalidScheduleException.inThePast(time, now);
        }

        ScheduledEvent event = ScheduledEvent.builder()
                .createdAt(now)
                .scheduledFor(time)
                .eventType(eventType)
                .args(args != null ? new ArrayList<>(args) : new ArrayList<>())
                .kwargs(kwargs != null ? new LinkedHashMap<>(kwargs) : new LinkedHashMap<>())
                .build();
        event.setId(store.insert(event));

        lock.lock();
        try {
            generation++;
            lastScheduledId = Math.max(lastScheduledId, event.getId());
            if (current != null && event.isDueBefore(current)) {
                log.debug("[Scheduler] Event {} is due before current event {}, restarting wait",
                        event.getId(), current.getId());
                restartRequested = true;
            }
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }

        log.debug("[Scheduler] Scheduled '{}' (id={}) for {}", eventType, event.getId(), time);
        return event;
    }

    /**
     * Abandons the current wait and re-reads the soonest event from the store.
     */
    public void restart() {
        lock.lock();
        try {
            restartRequested = true;
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * The event the loop is currently waiting on, if any.
     */
    public Optional<ScheduledEvent> getNextScheduledEvent() {
        lock.lock();
        try {
            return Optional.ofNullable(current);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of events still waiting in the store.
     */
    public long getPendingCount() {
        return store.count();
    }

    private void runLoop() {
        long expectedId = 0;
        try {
            while (!isStopping()) {
                expectedId = runIteration(expectedId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (SchedulerStateException e) {
            log.error("[Scheduler] Dispatch loop stopped: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Scheduler] Dispatch loop stopped by unexpected error", e);
        } finally {
            clearCurrent();
            running = false;
        }
    }

    /**
     * Runs one pass of the loop.
     *
     * @param expectedId
     *            highest event id announced by {@link #schedule} when the loop
     *            last woke up, 0 if none
     * @return the expected id for the next pass
     */
    private long runIteration(long expectedId) throws InterruptedException {
        long observed = beginPass();

        Optional<ScheduledEvent> next;
        try {
            next = store.fetchSoonest();
        } catch (StoreUnavailableException e) {
            log.warn("[Scheduler] Store unavailable while fetching next event, retrying in {}: {}",
                    properties.getRetryBackoff(), e.getMessage());
            pause(properties.getRetryBackoff());
            return expectedId;
        }

        if (next.isEmpty()) {
            // an announced event the loop has never fetched must still be in the store
            if (expectedId > lastFetchedId()) {
                throw new SchedulerStateException("Woken for scheduled event " + expectedId
                        + " but the store has no pending events");
            }
            return awaitSchedule(observed, expectedId);
        }

        ScheduledEvent event = next.get();
        markFetched(event);
        if (!publishCurrent(event, observed)) {
            return expectedId;
        }
        if (!sleepUntil(event.getScheduledFor())) {
            return expectedId;
        }

        try {
            if (event.isPersisted()) {
                store.delete(event.getId());
            }
        } catch (StoreUnavailableException e) {
            log.warn("[Scheduler] Store unavailable while deleting event {}, retrying in {}: {}",
                    event.getId(), properties.getRetryBackoff(), e.getMessage());
            pause(properties.getRetryBackoff());
            return expectedId;
        }
        clearCurrent();
        dispatch(event);
        return expectedId;
    }

    private long beginPass() {
        lock.lock();
        try {
            restartRequested = false;
            return generation;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until {@link #schedule} runs after the given generation was
     * observed.
     *
     * @return the highest scheduled id if woken by a schedule call, otherwise
     *         {@code expectedId}
     */
    private long awaitSchedule(long observed, long expectedId) throws InterruptedException {
        lock.lock();
        try {
            current = null;
            while (generation == observed && !restartRequested && !stopping) {
                wakeup.await();
            }
            return generation != observed && !stopping ? lastScheduledId : expectedId;
        } finally {
            lock.unlock();
        }
    }

    private void markFetched(ScheduledEvent event) {
        if (!event.isPersisted()) {
            return;
        }
        lock.lock();
        try {
            lastFetchedId = Math.max(lastFetchedId, event.getId());
        } finally {
            lock.unlock();
        }
    }

    private long lastFetchedId() {
        lock.lock();
        try {
            return lastFetchedId;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Makes the fetched event visible as current, unless something was scheduled
     * since the fetch, in which case the caller must fetch again.
     */
    private boolean publishCurrent(ScheduledEvent event, long observed) {
        lock.lock();
        try {
            if (generation != observed || restartRequested || stopping) {
                return false;
            }
            current = event;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sleeps until the due instant.
     *
     * @return true when the instant was reached, false when preempted
     */
    private boolean sleepUntil(Instant due) throws InterruptedException {
        lock.lock();
        try {
            while (!restartRequested && !stopping) {
                long remaining = Duration.between(clock.instant(), due).toNanos();
                if (remaining <= 0) {
                    return true;
                }
                wakeup.awaitNanos(remaining);
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void pause(Duration duration) throws InterruptedException {
        lock.lock();
        try {
            long remaining = duration.toNanos();
            while (remaining > 0 && !stopping) {
                remaining = wakeup.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    private void dispatch(ScheduledEvent event) {
        log.debug("[Scheduler] Dispatching '{}' (id={}) scheduled for {}",
                event.getEventType(), event.getId(), event.getScheduledFor());
        try {
            dispatchPort.dispatch(event.getId(), event.getEventType(), event.getScheduledFor(),
                    event.getArgs(), event.getKwargs());
        } catch (RuntimeException e) {
            log.error("[Scheduler] Listener for '{}' (id={}) failed", event.getEventType(), event.getId(), e);
        }
    }

    private void clearCurrent() {
        lock.lock();
        try {
            current = null;
        } finally {
            lock.unlock();
        }
    }

    private boolean isStopping() {
        lock.lock();
        try {
            return stopping;
        } finally {
            lock.unlock();
        }
    }
}
