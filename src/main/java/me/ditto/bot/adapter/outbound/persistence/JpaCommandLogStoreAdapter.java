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
import me.ditto.bot.domain.model.CommandInvocation;
import me.ditto.bot.port.outbound.CommandLogStore;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@link CommandLogStore} backed by the {@code command_invocations} table.
 */
@Component
@RequiredArgsConstructor
public class JpaCommandLogStoreAdapter implements CommandLogStore {

    private final CommandInvocationRepository repository;

    @Override
    public void insertAll(List<CommandInvocation> invocations) {
        if (invocations.isEmpty()) {
            return;
        }
        List<CommandInvocationEntity> entities = invocations.stream()
                .map(JpaCommandLogStoreAdapter::toEntity)
                .toList();
        StoreFailures.run("command log insert", () -> repository.saveAll(entities));
    }

    @Override
    public List<CommandInvocation> findRecent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return StoreFailures.translate("command log query",
                () -> repository.findAllByOrderByInvokedAtDescIdDesc(PageRequest.of(0, limit)).stream()
                        .map(JpaCommandLogStoreAdapter::toDomain)
                        .toList());
    }

    private static CommandInvocationEntity toEntity(CommandInvocation invocation) {
        CommandInvocationEntity entity = new CommandInvocationEntity();
        entity.setChannelType(invocation.getChannelType());
        entity.setChatId(invocation.getChatId());
        entity.setUserId(invocation.getUserId());
        entity.setInvokedAt(invocation.getInvokedAt());
        entity.setPrefix(invocation.getPrefix());
        entity.setCommand(invocation.getCommand());
        entity.setFailed(invocation.isFailed());
        return entity;
    }

    private static CommandInvocation toDomain(CommandInvocationEntity entity) {
        return CommandInvocation.builder()
                .id(entity.getId())
                .channelType(entity.getChannelType())
                .chatId(entity.getChatId())
                .userId(entity.getUserId())
                .invokedAt(entity.getInvokedAt())
                .prefix(entity.getPrefix())
                .command(entity.getCommand())
                .failed(entity.isFailed())
                .build();
    }
}
