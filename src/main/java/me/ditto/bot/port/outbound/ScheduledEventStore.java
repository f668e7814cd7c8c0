package me.ditto.bot.port.outbound;

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

import me.ditto.bot.domain.model.ScheduledEvent;

import java.util.Optional;

/**
 * Port for the durable queue of scheduled events.
 *
 * <p>
 * Implementations may throw
 * {@link me.ditto.bot.domain.model.StoreUnavailableException} when the
 * underlying store cannot be reached; the scheduler retries on it.
 *
 * @since 1.0
 */
public interface ScheduledEventStore {

    /**
     * Persists a new event and returns the id assigned by the store. The
     * {@code id} of the given event is ignored.
     */
    long insert(ScheduledEvent event);

    /**
     * Returns the pending event with the smallest {@code scheduledFor}. Ties are
     * broken by insertion order.
     */
    Optional<ScheduledEvent> fetchSoonest();

    /**
     * Removes the event with the given id. Unknown ids are ignored.
     */
    void delete(long id);

    /**
     * Number of pending events.
     */
    long count();
}
