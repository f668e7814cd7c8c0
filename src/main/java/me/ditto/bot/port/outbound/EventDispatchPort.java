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

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Delivers a named event with its payload to the in-process listeners that are
 * registered for that name. Delivery is fire-and-forget from the caller's point
 * of view.
 */
public interface EventDispatchPort {

    void dispatch(Long eventId, String eventType, Instant scheduledFor,
            List<Object> args, Map<String, Object> kwargs);
}
