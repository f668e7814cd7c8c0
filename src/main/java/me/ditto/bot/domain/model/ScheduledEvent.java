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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named event persisted for delivery at a later instant.
 *
 * <p>
 * The {@code id} is {@code null} until the event has been written to the
 * {@link me.ditto.bot.port.outbound.ScheduledEventStore}, which assigns it.
 * Events are never updated in place: rescheduling means scheduling a new event.
 *
 * @since 1.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledEvent {

    private Long id;
    private Instant createdAt;
    private Instant scheduledFor;
    private String eventType;

    @Builder.Default
    private List<Object> args = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> kwargs = new LinkedHashMap<>();

    /**
     * Whether the store has assigned an id to this event.
     */
    @JsonIgnore
    public boolean isPersisted() {
        return id != null;
    }

    /**
     * Whether this event becomes due strictly before the other one.
     */
    public boolean isDueBefore(ScheduledEvent other) {
        return other != null && scheduledFor.isBefore(other.getScheduledFor());
    }
}
