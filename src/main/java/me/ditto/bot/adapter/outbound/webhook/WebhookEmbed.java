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
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * Rich embed attached to a webhook message.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class WebhookEmbed {

    private String title;
    private String description;
    private Integer color;

    /** ISO-8601 instant. */
    private String timestamp;

    @Singular
    private List<Field> fields;

    /**
     * Number of characters that count towards the per-message text limit.
     */
    public int length() {
        int length = textLength(title) + textLength(description);
        if (fields != null) {
            for (Field field : fields) {
                length += textLength(field.name()) + textLength(field.value());
            }
        }
        return length;
    }

    private static int textLength(String text) {
        return text != null ? text.length() : 0;
    }

    public record Field(String name, String value, boolean inline) {
    }
}
