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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Executes chat webhooks over HTTP.
 *
 * <p>
 * A webhook message carries at most {@value #MAX_EMBEDS} embeds whose combined
 * text is at most {@value #MAX_MESSAGE_LENGTH} characters, and plain content of
 * at most {@value #MAX_CONTENT_LENGTH} characters.
 */
@Component
@Slf4j
public class DiscordWebhookClient {

    public static final int MAX_EMBEDS = 10;
    public static final int MAX_MESSAGE_LENGTH = 6000;
    public static final int MAX_CONTENT_LENGTH = 2000;

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_ERROR_BODY = 200;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public DiscordWebhookClient(OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Posts the message and blocks until the response arrives.
     *
     * @throws IOException
     *             on transport failure or a non-2xx response
     * @throws IllegalArgumentException
     *             if the message exceeds the webhook limits
     */
    public void send(String webhookUrl, WebhookMessage message) throws IOException {
        validate(message);
        String body = objectMapper.writeValueAsString(message);
        Request request = new Request.Builder()
                .url(webhookUrl)
                .post(RequestBody.create(body, JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                ResponseBody responseBody = response.body();
                String detail = responseBody != null ? abbreviate(responseBody.string()) : "";
                throw new IOException("Webhook returned HTTP " + response.code() + (detail.isEmpty() ? "" : ": " + detail));
            }
            log.debug("[Webhook] Delivered message with {} embeds", message.embeds() != null ? message.embeds().size() : 0);
        }
    }

    private static void validate(WebhookMessage message) {
        boolean hasContent = message.content() != null && !message.content().isEmpty();
        boolean hasEmbeds = message.embeds() != null && !message.embeds().isEmpty();
        if (!hasContent && !hasEmbeds) {
            throw new IllegalArgumentException("Webhook message needs content or embeds");
        }
        if (hasContent && message.content().length() > MAX_CONTENT_LENGTH) {
            throw new IllegalArgumentException("Webhook content exceeds " + MAX_CONTENT_LENGTH + " characters");
        }
        if (hasEmbeds) {
            if (message.embeds().size() > MAX_EMBEDS) {
                throw new IllegalArgumentException("Webhook message carries more than " + MAX_EMBEDS + " embeds");
            }
            int total = message.embeds().stream().mapToInt(WebhookEmbed::length).sum();
            if (total > MAX_MESSAGE_LENGTH) {
                throw new IllegalArgumentException("Webhook embeds exceed " + MAX_MESSAGE_LENGTH + " characters");
            }
        }
    }

    private static String abbreviate(String text) {
        String trimmed = text.trim();
        return trimmed.length() > MAX_ERROR_BODY ? trimmed.substring(0, MAX_ERROR_BODY) + "..." : trimmed;
    }
}
