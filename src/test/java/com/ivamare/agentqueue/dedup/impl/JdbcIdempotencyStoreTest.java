package com.ivamare.agentqueue.dedup.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcIdempotencyStoreTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcIdempotencyStore store;

    @BeforeEach
    void setUp() {
        store = new JdbcIdempotencyStore(jdbcTemplate);
    }

    @Test
    void shouldReportFirstSightingWhenRowInserted() {
        when(jdbcTemplate.update(contains("ON CONFLICT"), eq("acme"), eq("k1"))).thenReturn(1);

        assertTrue(store.markIfAbsent("acme", "k1"));
    }

    @Test
    void shouldReportDuplicateWhenInsertIgnored() {
        when(jdbcTemplate.update(contains("ON CONFLICT"), eq("acme"), eq("k1"))).thenReturn(0);

        assertFalse(store.markIfAbsent("acme", "k1"));
    }

    @Test
    void shouldDeleteKeyOnRelease() {
        store.release("acme", "k1");

        verify(jdbcTemplate).update(contains("DELETE FROM agentqueue.idempotency_keys"), eq("acme"), eq("k1"));
    }

    @Test
    void shouldPurgeByCreationTime() {
        Instant cutoff = Instant.parse("2024-01-01T00:00:00Z");
        when(jdbcTemplate.update(contains("created_at <"), any(Timestamp.class))).thenReturn(4);

        assertEquals(4, store.purgeOlderThan(cutoff));
        verify(jdbcTemplate).update(anyString(), eq(Timestamp.from(cutoff)));
    }
}
