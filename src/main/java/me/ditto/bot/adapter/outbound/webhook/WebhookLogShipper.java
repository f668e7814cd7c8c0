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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import lombok.extern.slf4j.Slf4j;
import me.ditto.bot.infrastructure.config.BotProperties;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns log events into webhook embeds and ships them in batches.
 *
 * <p>
 * Each event becomes one embed: the logger name as title, the message and
 * stack trace in a code block as description, a colour per level and the
 * caller location as a field. Queued embeds are flushed every
 * {@code bot.logging.webhook.flush-interval-ms} in messages of at most
 * {@value DiscordWebhookClient#MAX_EMBEDS} embeds and
 * {@value DiscordWebhookClient#MAX_MESSAGE_LENGTH} characters.
 */
@Component
@Slf4j
public class WebhookLogShipper {

    static final int MAX_DESCRIPTION_MESSAGE = 1987;
    private static final String ZERO_WIDTH_SPACE = "\u200B";
    private static final String OWN_PACKAGE = WebhookLogShipper.class.getPackageName();

    private static final Map<Level, Integer> COLOURS = Map.of(
            Level.TRACE, 0x979C9F,
            Level.DEBUG, 0x979C9F,
            Level.INFO, 0xF1C40F,
            Level.WARN, 0xE67E22,
            Level.ERROR, 0xE74C3C);

    private final DiscordWebhookClient client;
    private final BotProperties.WebhookLogProperties properties;
    private final Level threshold;

    private final Deque<WebhookEmbed> queue = new ConcurrentLinkedDeque<>();
    private final AtomicInteger queued = new AtomicInteger();
    private final AtomicInteger dropped = new AtomicInteger();

    public WebhookLogShipper(DiscordWebhookClient client, BotProperties properties) {
        this.client = client;
        this.properties = properties.getLogging().getWebhook();
        this.threshold = Level.toLevel(this.properties.getLevel(), Level.WARN);
    }

    public boolean isEnabled() {
        String url = properties.getUrl();
        return url != null && !url.isBlank();
    }

    /**
     * Queues the event if it passes the level threshold. Events from this
     * package are skipped so delivery failures cannot feed back into the queue.
     */
    public void append(ILoggingEvent event) {
        if (!isEnabled() || !event.getLevel().isGreaterOrEqual(threshold)) {
            return;
        }
        String loggerName = event.getLoggerName();
        if (loggerName != null && loggerName.startsWith(OWN_PACKAGE)) {
            return;
        }
        if (queued.get() >= properties.getMaxQueuedEvents()) {
            dropped.incrementAndGet();
            return;
        }
        queue.addLast(toEmbed(event));
        queued.incrementAndGet();
    }

    /**
     * Sends everything queued so far.
     *
     * @return number of embeds delivered
     */
    @Scheduled(fixedDelayString = "${bot.logging.webhook.flush-interval-ms:5000}")
    public int flush() {
        if (!isEnabled()) {
            return 0;
        }
        int lost = dropped.getAndSet(0);
        if (lost > 0) {
            log.warn("[Webhook] Dropped {} log events because the queue was full", lost);
        }

        int delivered = 0;
        List<WebhookEmbed> batch;
        while (!(batch = nextBatch()).isEmpty()) {
            try {
                client.send(properties.getUrl(), WebhookMessage.embeds(batch));
                delivered += batch.size();
            } catch (IOException | IllegalArgumentException e) {
                log.warn("[Webhook] Failed to ship {} log events: {}", batch.size(), e.getMessage());
            }
        }
        return delivered;
    }

    public int getQueuedCount() {
        return queued.get();
    }

    List<WebhookEmbed> nextBatch() {
        List<WebhookEmbed> batch = new ArrayList<>();
        int length = 0;
        while (batch.size() < DiscordWebhookClient.MAX_EMBEDS) {
            WebhookEmbed next = queue.peekFirst();
            if (next == null) {
                break;
            }
            if (!batch.isEmpty() && length + next.length() > DiscordWebhookClient.MAX_MESSAGE_LENGTH) {
                break;
            }
            queue.pollFirst();
            queued.decrementAndGet();
            batch.add(next);
            length += next.length();
        }
        return batch;
    }

    WebhookEmbed toEmbed(ILoggingEvent event) {
        StringBuilder message = new StringBuilder(String.valueOf(event.getFormattedMessage())).append('\n');
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            message.append(ThrowableProxyUtil.asString(throwable));
        }
        String text = message.length() > MAX_DESCRIPTION_MESSAGE
                ? message.substring(0, MAX_DESCRIPTION_MESSAGE) + "..."
                : message.toString();

        WebhookEmbed.WebhookEmbedBuilder builder = WebhookEmbed.builder()
                .title(event.getLoggerName())
                .description("```\n" + text + "\n```")
                .color(COLOURS.get(event.getLevel()))
                .timestamp(Instant.ofEpochMilli(event.getTimeStamp()).toString());

        StackTraceElement[] callerData = event.getCallerData();
        if (callerData != null && callerData.length > 0) {
            StackTraceElement caller = callerData[0];
            builder.field(new WebhookEmbed.Field(ZERO_WIDTH_SPACE, caller.getFileName() + ":" + caller.getLineNumber(),
                    false));
        }
        return builder.build();
    }
}
