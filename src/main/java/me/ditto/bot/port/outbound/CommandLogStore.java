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

import me.ditto.bot.domain.model.CommandInvocation;

import java.util.List;

/**
 * Port for persisting command usage history.
 */
public interface CommandLogStore {

    /**
     * Writes a batch of invocations in one transaction.
     */
    void insertAll(List<CommandInvocation> invocations);

    /**
     * Most recent invocations, newest first.
     */
    List<CommandInvocation> findRecent(int limit);
}
