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

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(
        name = "command_invocations",
        indexes = {
                @Index(name = "idx_command_invocations_invoked_at", columnList = "invoked_at"),
                @Index(name = "idx_command_invocations_user_id", columnList = "user_id")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class CommandInvocationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "channel_type", length = 32)
    private String channelType;

    @Column(name = "chat_id", length = 64)
    private String chatId;

    @Column(name = "user_id", length = 64)
    private String userId;

    @Column(name = "invoked_at", nullable = false)
    private Instant invokedAt;

    @Column(name = "prefix", length = 16)
    private String prefix;

    @Column(name = "command", nullable = false, length = 64)
    private String command;

    @Column(name = "failed", nullable = false)
    private boolean failed;
}
