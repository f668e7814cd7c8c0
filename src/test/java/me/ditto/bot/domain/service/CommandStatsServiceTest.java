package me.ditto.bot.domain.service;

import me.ditto.bot.domain.model.CommandInvocation;
import me.ditto.bot.domain.model.StoreUnavailableException;
import me.ditto.bot.infrastructure.config.BotProperties;
import me.ditto.bot.port.inbound.CommandPort;
import me.ditto.bot.port.outbound.CommandLogStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CommandStatsServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");
    private static final Map<String, Object> CONTEXT = Map.of(
            CommandPort.CTX_CHANNEL_TYPE, "discord",
            CommandPort.CTX_CHAT_ID, "100",
            CommandPort.CTX_USER_ID, "42",
            CommandPort.CTX_PREFIX, "!");

    private CommandLogStore store;
    private BotProperties properties;
    private CommandStatsService service;

    @BeforeEach
    void setUp() {
        store = mock(CommandLogStore.class);
        properties = new BotProperties();
        properties.getStats().setHistoryLimit(100);
        service = new CommandStatsService(store, Clock.fixed(NOW, ZoneOffset.UTC), properties);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldFlushBufferedInvocationsInOneBatch() {
        service.record("timezone", CONTEXT, false);
        service.record("remind", CONTEXT, true);

        assertEquals(2, service.flush());

        ArgumentCaptor<List<CommandInvocation>> captor = ArgumentCaptor.forClass(List.class);
        verify(store).insertAll(captor.capture());
        List<CommandInvocation> batch = captor.getValue();
        assertEquals(2, batch.size());
        CommandInvocation first = batch.get(0);
        assertEquals("timezone", first.getCommand());
        assertEquals("discord", first.getChannelType());
        assertEquals("100", first.getChatId());
        assertEquals("42", first.getUserId());
        assertEquals("!", first.getPrefix());
        assertEquals(NOW, first.getInvokedAt());
        assertFalse(first.isFailed());
        assertTrue(batch.get(1).isFailed());
        assertEquals(0, service.getBufferedCount());
    }

    @Test
    void shouldSkipFlushWhenNothingBuffered() {
        assertEquals(0, service.flush());

        verify(store, never()).insertAll(anyList());
    }

    @Test
    void shouldKeepBufferWhenStoreUnavailable() {
        service.record("timezone", CONTEXT, false);
        doThrow(new StoreUnavailableException("down", null)).when(store).insertAll(anyList());

        assertEquals(0, service.flush());
        assertEquals(1, service.getBufferedCount());

        service.record("remind", CONTEXT, false);
        doNothing().when(store).insertAll(anyList());

        assertEquals(2, service.flush());
        assertEquals(0, service.getBufferedCount());
    }

    @Test
    void shouldNotRecordWhenDisabled() {
        properties.getStats().setEnabled(false);

        service.record("timezone", CONTEXT, false);

        assertEquals(0, service.getBufferedCount());
    }

    @Test
    void shouldDropOldestWhenBufferIsFull() {
        for (int i = 0; i < CommandStatsService.MAX_BUFFERED + 5; i++) {
            service.record("cmd" + i, CONTEXT, false);
        }

        assertEquals(CommandStatsService.MAX_BUFFERED, service.getBufferedCount());
    }

    @Test
    void shouldFlushBeforeReadingHistory() {
        CommandInvocation stored = CommandInvocation.builder().command("help").build();
        when(store.findRecent(100)).thenReturn(List.of(stored));
        service.record("help", CONTEXT, false);

        List<CommandInvocation> recent = service.recentInvocations();

        assertEquals(List.of(stored), recent);
        verify(store).insertAll(anyList());
    }
}
