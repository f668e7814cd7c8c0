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

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * JSON body of a webhook execution: plain content and/or embeds.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record WebhookMessage(String content, List<WebhookEmbed> embeds) {

    public static WebhookMessage text(String content) {
        return new WebhookMessage(content, List.of());
    }

    public static WebhookMessage embeds(List<WebhookEmbed> embeds) {
        return new WebhookMessage(null, List.copyOf(embeds));
    }
}
