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

import me.ditto.bot.domain.model.StoreUnavailableException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.function.Supplier;

/**
 * Translates Spring's connectivity-related exceptions into
 * {@link StoreUnavailableException} so domain services never depend on Spring
 * data access types. All other exceptions pass through unchanged.
 */
final class StoreFailures {

    private StoreFailures() {
    }

    static <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException
                | RecoverableDataAccessException | CannotCreateTransactionException e) {
            throw new StoreUnavailableException("Store unavailable during " + operation, e);
        }
    }

    static void run(String operation, Runnable action) {
        translate(operation, () -> {
            action.run();
            return null;
        });
    }
}
