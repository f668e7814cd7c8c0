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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.ditto.bot.domain.model.CommandInvocation;
import me.ditto.bot.domain.model.StoreUnavailableException;
import me.ditto.bot.infrastructure.config.BotProperties;
import me.ditto.bot.port.inbound.CommandPort;
import me.ditto.bot.port.outbound.CommandLogStore;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Records command invocations in memory and writes them to the
 * {@link CommandLogStore} in periodic batches.
 */
@Service
@Slf4j
public class CommandStatsService {

    static final int MAX_BUFFERED = 10_000;

    private final CommandLogStore store;
    private final Clock clock;
    private final BotProperties.StatsProperties properties;

    private final Object bufferLock = new Object();
    private List<CommandInvocation> buffer = new ArrayList<>();

    public CommandStatsService(CommandLogStore store, Clock clock, BotProperties properties) {
        this.store = store;
        this.clock = clock;
        this.properties = properties.getStats();
    }

    /**
     * Buffers one invocation. The context uses the keys defined on
     * {@link CommandPort}.
     */
    public void record(String command, Map<String, Object> context, boolean failed) {
        if (!properties.isEnabled()) {
            return;
        }
        CommandInvocation invocation = CommandInvocation.builder()
                .channelType(stringValue(context, CommandPort.CTX_CHANNEL_TYPE))
                .chatId(stringValue(context, CommandPort.CTX_CHAT_ID))
                .userId(stringValue(context, CommandPort.CTX_USER_ID))
                .prefix(stringValue(context, CommandPort.CTX_PREFIX))
                .invokedAt(clock.instant())
                .command(command)
                .failed(failed)
                .build();
        synchronized (bufferLock) {
            if (buffer.size() >= MAX_BUFFERED) {
                buffer.remove(0);
            }
            buffer.add(invocation);
        }
    }

    /**
     * Writes all buffered invocations in one batch. When the store is
     * unreachable the batch is put back and retried on the next flush.
     *
     * @return number of invocations written
     */
    @Scheduled(fixedDelayString = "${bot.stats.flush-interval-ms:15000}",
            initialDelayString = "${bot.stats.flush-interval-ms:15000}")
    public int flush() {
        List<CommandInvocation> batch;
        synchronized (bufferLock) {
            if (buffer.isEmpty()) {
                return 0;
            }
            batch = buffer;
            buffer = new ArrayList<>();
        }
        try {
            store.insertAll(batch);
            log.debug("[Stats] Flushed {} command invocations", batch.size());
            return batch.size();
        } catch (StoreUnavailableException e) {
            log.warn("[Stats] Store unavailable, keeping {} invocations for the next flush: {}",
                    batch.size(), e.getMessage());
            synchronized (bufferLock) {
                batch.addAll(buffer);
                int overflow = batch.size() - MAX_BUFFERED;
                buffer = overflow > 0 ? new ArrayList<>(batch.subList(overflow, batch.size())) : batch;
            }
            return 0;
        }
    }

    public int getBufferedCount() {
        synchronized (bufferLock) {
            return buffer.size();
        }
    }

    /**
     * Most recent invocations, newest first. Pending invocations are flushed
     * first so the history is complete.
     */
    public List<CommandInvocation> recentInvocations() {
        flush();
        return store.findRecent(properties.getHistoryLimit());
    }

    @PreDestroy
    public void flushOnShutdown() {
        try {
            flush();
        } catch (RuntimeException e) {
            log.warn("[Stats] Failed to flush command invocations on shutdown: {}", e.getMessage());
        }
    }

    private static String stringValue(Map<String, Object> context, String key) {
        if (context == null) {
            return null;
        }
        Object value = context.get(key);
        return value != null ? value.toString() : null;
    }
}
