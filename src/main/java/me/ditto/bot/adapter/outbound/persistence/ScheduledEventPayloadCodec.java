package me.ditto.bot.adapter.outbound.persistence;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.ditto.bot.domain.model.InvalidScheduleException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encodes scheduled event arguments as a single JSON document of the form
 * {@code {"args": [...], "kwargs": {...}}}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduledEventPayloadCodec {

    private final ObjectMapper objectMapper;

    /**
     * @throws InvalidScheduleException
     *             if the arguments cannot be represented as JSON
     */
    public String encode(List<Object> args, Map<String, Object> kwargs) {
        try {
            return objectMapper.writeValueAsString(new Payload(
                    args != null ? args : List.of(),
                    kwargs != null ? kwargs : Map.of()));
        } catch (JsonProcessingException e) {
            throw new InvalidScheduleException("Event arguments are not JSON-serializable: " + e.getOriginalMessage());
        }
    }

    /**
     * Decodes a stored payload. A malformed document yields empty arguments so a
     * single bad row cannot block the queue.
     */
    public Payload decode(String json) {
        if (json == null || json.isBlank()) {
            return Payload.empty();
        }
        try {
            Payload payload = objectMapper.readValue(json, Payload.class);
            return new Payload(
                    payload.args() != null ? new ArrayList<>(payload.args()) : new ArrayList<>(),
                    payload.kwargs() != null ? new LinkedHashMap<>(payload.kwargs()) : new LinkedHashMap<>());
        } catch (JsonProcessingException e) {
            log.warn("[Scheduler] Failed to decode scheduled event payload: {}", e.getOriginalMessage());
            return Payload.empty();
        }
    }

    public record Payload(List<Object> args, Map<String, Object> kwargs) {

        static Payload empty() {
            return new Payload(new ArrayList<>(), new LinkedHashMap<>());
        }
    }
}
