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

import lombok.extern.slf4j.Slf4j;
import me.ditto.bot.domain.model.ScheduledEvent;
import me.ditto.bot.domain.model.ScheduledEventFiredEvent;
import me.ditto.bot.infrastructure.config.BotProperties;
import me.ditto.bot.port.outbound.NotificationPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Schedules user reminders on the {@link EventScheduler} and delivers them when
 * they fire.
 */
@Service
@Slf4j
public class ReminderService {

    public static final String EVENT_TYPE = "reminder";
    public static final String KWARG_CHANNEL = "channel";

    private static final int MAX_TEXT_LENGTH = 1500;

    private final EventScheduler scheduler;
    private final NotificationPort notificationPort;
    private final Clock clock;
    private final BotProperties.RemindersProperties properties;

    public ReminderService(EventScheduler scheduler, NotificationPort notificationPort, Clock clock,
            BotProperties properties) {
        this.scheduler = scheduler;
        this.notificationPort = notificationPort;
        this.clock = clock;
        this.properties = properties.getReminders();
    }

    /**
     * @throws IllegalArgumentException
     *             if the text is blank or too long, or the delay is not positive
     *             or exceeds the configured maximum
     */
    public ScheduledEvent scheduleReminder(String userId, String channelType, Duration delay, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Reminder text is required");
        }
        if (text.length() > MAX_TEXT_LENGTH) {
            throw new IllegalArgumentException("Reminder text is too long (max " + MAX_TEXT_LENGTH + " characters)");
        }
        if (delay == null || delay.isNegative() || delay.isZero()) {
            throw new IllegalArgumentException("Reminder delay must be positive");
        }
        if (delay.compareTo(properties.getMaxDelay()) > 0) {
            throw new IllegalArgumentException("Reminder delay exceeds the maximum of "
                    + TimeFormats.humanDuration(properties.getMaxDelay()));
        }

        return scheduler.schedule(clock.instant().plus(delay), EVENT_TYPE,
                List.of(userId, text.trim()),
                Map.of(KWARG_CHANNEL, channelType != null ? channelType : "unknown"));
    }

    @EventListener(condition = "#event.eventType == 'reminder'")
    public void onReminder(ScheduledEventFiredEvent event) {
        Object userId = event.arg(0);
        Object text = event.arg(1);
        if (userId == null || text == null) {
            log.warn("[Reminder] Dropping reminder {} with incomplete arguments: {}", event.eventId(), event.args());
            return;
        }

        String message = "<@" + userId + ">, reminder: " + text;
        if (!notificationPort.isAvailable()) {
            log.info("[Reminder] {} (channel: {})", message, event.kwargs().get(KWARG_CHANNEL));
            return;
        }
        notificationPort.notify(message).whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("[Reminder] Failed to deliver reminder {}: {}", event.eventId(), error.getMessage());
            }
        });
    }
}
