package me.ditto.bot.adapter.outbound.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.ditto.bot.infrastructure.config.AutoConfiguration;
import me.ditto.bot.infrastructure.config.BotProperties;
import me.ditto.bot.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebhookNotificationAdapterTest {

    private OkHttpMockEngine engine;
    private ObjectMapper objectMapper;
    private BotProperties properties;
    private WebhookNotificationAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        objectMapper = AutoConfiguration.objectMapper();
        properties = new BotProperties();
        properties.getReminders().setWebhookUrl("https://chat.example.com/api/webhooks/2/token");
        adapter = new WebhookNotificationAdapter(new DiscordWebhookClient(engine.client(), objectMapper), properties);
    }

    @Test
    void shouldPostReminderText() throws Exception {
        engine.enqueueStatus(204);

        adapter.notify("<@42>, reminder: stretch").get(5, TimeUnit.SECONDS);

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("<@42>, reminder: stretch", objectMapper.readTree(request.body()).get("content").asText());
    }

    @Test
    void shouldTruncateLongText() throws Exception {
        engine.enqueueStatus(204);

        adapter.notify("x".repeat(2500)).get(5, TimeUnit.SECONDS);

        String content = objectMapper.readTree(engine.takeRequest().body()).get("content").asText();
        assertEquals(DiscordWebhookClient.MAX_CONTENT_LENGTH, content.length());
        assertTrue(content.endsWith("..."));
    }

    @Test
    void shouldFailFutureOnErrorStatus() {
        engine.enqueueStatus(500);

        assertThrows(CompletionException.class, () -> adapter.notify("hello").join());
    }

    @Test
    void shouldBeUnavailableWithoutUrl() {
        properties.getReminders().setWebhookUrl(" ");

        assertFalse(adapter.isAvailable());
        assertThrows(CompletionException.class, () -> adapter.notify("hello").join());
        assertEquals(0, engine.getRequestCount());
    }
}
