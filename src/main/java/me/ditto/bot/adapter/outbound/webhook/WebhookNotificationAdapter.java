package me.ditto.bot.adapter.outbound.webhook;

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

import me.ditto.bot.infrastructure.config.BotProperties;
import me.ditto.bot.port.outbound.NotificationPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;

/**
 * {@link NotificationPort} that posts plain text to the reminder webhook
 * ({@code bot.reminders.webhook-url}).
 */
@Component
public class WebhookNotificationAdapter implements NotificationPort {

    private final DiscordWebhookClient client;
    private final BotProperties properties;

    public WebhookNotificationAdapter(DiscordWebhookClient client, BotProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    @Override
    public boolean isAvailable() {
        String url = properties.getReminders().getWebhookUrl();
        return url != null && !url.isBlank();
    }

    @Override
    public CompletableFuture<Void> notify(String text) {
        if (!isAvailable()) {
            return CompletableFuture.failedFuture(new IllegalStateException("No reminder webhook configured"));
        }
        String content = text.length() > DiscordWebhookClient.MAX_CONTENT_LENGTH
                ? text.substring(0, DiscordWebhookClient.MAX_CONTENT_LENGTH - 3) + "..."
                : text;
        return CompletableFuture.runAsync(() -> {
            try {
                client.send(properties.getReminders().getWebhookUrl(), WebhookMessage.text(content));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }
}
