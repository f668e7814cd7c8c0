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
import me.ditto.bot.port.outbound.TimeZoneStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user time zone preferences with a read-through cache, plus lookup of
 * zone names typed by users.
 */
@Service
@Slf4j
public class TimeZoneService {

    private static final String SYSTEM_V_PREFIX = "SystemV";

    private final TimeZoneStore store;
    private final Clock clock;
    private final Map<String, Optional<ZoneId>> cache = new ConcurrentHashMap<>();
    private final Map<String, String> namesByLowerCase;

    public TimeZoneService(TimeZoneStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.namesByLowerCase = buildNameIndex();
    }

    /**
     * The user's stored zone, if any. Results (including "not set") are cached
     * until the next set or clear for the same user.
     */
    public Optional<ZoneId> getTimeZone(String userId) {
        return cache.computeIfAbsent(userId, this::loadTimeZone);
    }

    public void setTimeZone(String userId, ZoneId zone) {
        store.saveTimeZone(userId, zone.getId());
        cache.put(userId, Optional.of(zone));
        log.debug("[TimeZone] Set time zone of {} to {}", userId, zone.getId());
    }

    /**
     * Removes the user's zone.
     *
     * @return whether a zone was set before
     */
    public boolean clearTimeZone(String userId) {
        boolean existed = getTimeZone(userId).isPresent();
        store.deleteTimeZone(userId);
        cache.put(userId, Optional.empty());
        return existed;
    }

    /**
     * Looks up a zone by region id or short alias (e.g. {@code EST}), ignoring
     * case. Fixed offsets such as {@code UTC+05:30} are accepted as well.
     *
     * @throws IllegalArgumentException
     *             if the name matches no zone
     */
    public ZoneId resolve(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Time zone is required");
        }
        String trimmed = name.trim();
        String known = namesByLowerCase.get(trimmed.toLowerCase(Locale.ROOT));
        try {
            if (known != null) {
                return ZoneId.of(known, ZoneId.SHORT_IDS);
            }
            return ZoneId.of(trimmed);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown time zone: " + trimmed, e);
        }
    }

    /**
     * Region zones worth listing to users: no {@code SystemV} zones and no ids
     * containing digits, ordered by their current UTC offset and then by name.
     */
    public List<ZoneId> mainTimeZones() {
        Instant now = clock.instant();
        return ZoneId.getAvailableZoneIds().stream()
                .filter(TimeZoneService::isMainZone)
                .map(ZoneId::of)
                .sorted(Comparator
                        .<ZoneId>comparingInt(zone -> zone.getRules().getOffset(now).getTotalSeconds())
                        .thenComparing(ZoneId::getId))
                .toList();
    }

    public Instant now() {
        return clock.instant();
    }

    private Optional<ZoneId> loadTimeZone(String userId) {
        Optional<String> stored = store.findTimeZone(userId);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(ZoneId.of(stored.get()));
        } catch (DateTimeException e) {
            log.warn("[TimeZone] Ignoring unknown stored time zone '{}' for {}", stored.get(), userId);
            return Optional.empty();
        }
    }

    static boolean isMainZone(String id) {
        if (id.startsWith(SYSTEM_V_PREFIX)) {
            return false;
        }
        return id.chars().noneMatch(Character::isDigit);
    }

    private static Map<String, String> buildNameIndex() {
        Map<String, String> index = new HashMap<>();
        for (String id : ZoneId.getAvailableZoneIds()) {
            index.put(id.toLowerCase(Locale.ROOT), id);
        }
        for (String alias : ZoneId.SHORT_IDS.keySet()) {
            index.putIfAbsent(alias.toLowerCase(Locale.ROOT), alias);
        }
        index.putIfAbsent("utc", "UTC");
        return Map.copyOf(index);
    }
}
