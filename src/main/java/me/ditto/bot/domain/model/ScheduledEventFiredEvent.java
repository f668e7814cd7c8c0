package me.ditto.bot.domain.model;

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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Application event published when a scheduled event becomes due.
 *
 * <p>
 * Listeners pick their topic with a SpEL condition:
 *
 * <pre>{@code
 * @EventListener(condition = "#event.eventType == 'reminder'")
 * public void onReminder(ScheduledEventFiredEvent event) { ... }
 * }</pre>
 */
public record ScheduledEventFiredEvent(
        Long eventId,
        String eventType,
        Instant scheduledFor,
        List<Object> args,
        Map<String, Object> kwargs) {

    public ScheduledEventFiredEvent {
        // values may be JSON nulls
        args = args != null ? Collections.unmodifiableList(new ArrayList<>(args)) : List.of();
        kwargs = kwargs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(kwargs)) : Map.of();
    }

    /**
     * Positional argument at {@code index}, or {@code null} when absent.
     */
    public Object arg(int index) {
        return index >= 0 && index < args.size() ? args.get(index) : null;
    }
}
