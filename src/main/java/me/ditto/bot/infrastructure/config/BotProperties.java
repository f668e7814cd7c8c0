package me.ditto.bot.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link SchedulerProperties} - durable event scheduler</li>
 * <li>{@link StatsProperties} - command usage statistics</li>
 * <li>{@link LoggingProperties} - shipping log records to a chat webhook</li>
 * <li>{@link RemindersProperties} - reminder delivery</li>
 * <li>{@link HttpProperties} - shared HTTP client</li>
 * </ul>
 *
 * <p>
 * Uses Spring Boot's {@link ConfigurationProperties} for type-safe property
 * binding.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private String appName = "ditto";
    private String prefix = "!";
    private List<String> ownerIds = new ArrayList<>();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private StatsProperties stats = new StatsProperties();
    private LoggingProperties logging = new LoggingProperties();
    private RemindersProperties reminders = new RemindersProperties();
    private HttpProperties http = new HttpProperties();

    public boolean isOwner(String userId) {
        return userId != null && ownerIds.contains(userId);
    }

    @Data
    public static class SchedulerProperties {
        private boolean enabled = true;

        /** Pause before the loop retries after the store became unreachable. */
        private Duration retryBackoff = Duration.ofSeconds(5);

        /** How long shutdown waits for the loop thread to finish. */
        private Duration shutdownTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class StatsProperties {
        private boolean enabled = true;
        private long flushIntervalMs = 15000;
        private int historyLimit = 100;
    }

    @Data
    public static class LoggingProperties {
        private WebhookLogProperties webhook = new WebhookLogProperties();
    }

    @Data
    public static class WebhookLogProperties {
        private String url;
        private String level = "WARN";
        private long flushIntervalMs = 5000;
        private int maxQueuedEvents = 1000;
    }

    @Data
    public static class RemindersProperties {
        private String webhookUrl;
        private Duration maxDelay = Duration.ofDays(365);
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
