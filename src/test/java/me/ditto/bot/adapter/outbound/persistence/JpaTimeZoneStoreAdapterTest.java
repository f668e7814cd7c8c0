package me.ditto.bot.adapter.outbound.persistence;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
@Import(JpaTimeZoneStoreAdapter.class)
class JpaTimeZoneStoreAdapterTest {

    @Autowired
    private JpaTimeZoneStoreAdapter adapter;

    @Test
    void shouldReturnEmptyForUnknownUser() {
        assertTrue(adapter.findTimeZone("1").isEmpty());
    }

    @Test
    void shouldUpsertTimeZone() {
        adapter.saveTimeZone("42", "Europe/London");
        adapter.saveTimeZone("42", "Asia/Tokyo");

        assertEquals(Optional.of("Asia/Tokyo"), adapter.findTimeZone("42"));
    }

    @Test
    void shouldDeleteTimeZone() {
        adapter.saveTimeZone("42", "Europe/London");

        adapter.deleteTimeZone("42");
        adapter.deleteTimeZone("42");

        assertTrue(adapter.findTimeZone("42").isEmpty());
    }
}
