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

import lombok.RequiredArgsConstructor;
import me.ditto.bot.port.outbound.TimeZoneStore;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * {@link TimeZoneStore} backed by the {@code user_time_zones} table, one row
 * per user.
 */
@Component
@RequiredArgsConstructor
public class JpaTimeZoneStoreAdapter implements TimeZoneStore {

    private final UserTimeZoneRepository repository;

    @Override
    public Optional<String> findTimeZone(String userId) {
        return StoreFailures.translate("time zone lookup",
                () -> repository.findById(userId).map(UserTimeZoneEntity::getTimeZone));
    }

    @Override
    public void saveTimeZone(String userId, String timeZoneId) {
        StoreFailures.run("time zone update", () -> repository.save(new UserTimeZoneEntity(userId, timeZoneId)));
    }

    @Override
    public void deleteTimeZone(String userId) {
        StoreFailures.run("time zone removal", () -> repository.deleteById(userId));
    }
}
