package com.collection.mint.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryAuditRepository Tests")
class InMemoryAuditRepositoryTest {

    private InMemoryAuditRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAuditRepository();
    }

    private static AuditEntry entry(long sequence, AuditAction action, String subject) {
        return AuditEntry.builder()
                .sequence(sequence)
                .action(action)
                .subject(subject)
                .actorId("0x00000000000000000000000000000000000000ad")
                .details(Map.of("sequence", sequence))
                .timestamp(Instant.EPOCH)
                .build();
    }

    @Test
    @DisplayName("Entries after a sequence should come back in log order")
    void afterSequence() {
        for (long s = 1; s <= 6; s++) {
            repository.save(entry(s, AuditAction.TOKENS_MINTED, "holder-" + (s % 2)));
        }

        assertEquals(List.of(4L, 5L, 6L), repository.findAfterSequence(3).stream().map(AuditEntry::sequence).toList());
        assertEquals(6, repository.findAfterSequence(0).size());
        assertTrue(repository.findAfterSequence(6).isEmpty());
    }

    @Test
    @DisplayName("Subject index should return only that subject's trail")
    void bySubject() {
        repository.save(entry(1, AuditAction.WITHDRAWAL_SUBMITTED, "tx-0"));
        repository.save(entry(2, AuditAction.TOKENS_MINTED, "holder"));
        repository.save(entry(3, AuditAction.WITHDRAWAL_EXECUTED, "tx-0"));

        assertEquals(List.of(AuditAction.WITHDRAWAL_SUBMITTED, AuditAction.WITHDRAWAL_EXECUTED),
                repository.findBySubject("tx-0").stream().map(AuditEntry::action).toList());
        assertTrue(repository.findBySubject("tx-1").isEmpty());
    }

    @Test
    @DisplayName("Save should stamp the next sequence regardless of the one supplied")
    void assignsSequence() {
        AuditEntry first = repository.save(entry(5, AuditAction.TOKENS_MINTED, "holder"));
        AuditEntry second = repository.save(entry(5, AuditAction.TOKENS_MINTED, "holder"));

        assertEquals(1, first.sequence());
        assertEquals(2, second.sequence());
        assertEquals(2, repository.count());
        assertEquals(List.of(1L, 2L), repository.findBySubject("holder").stream().map(AuditEntry::sequence).toList());
    }

    @Test
    @DisplayName("Recent entries should be the tail of the log")
    void recent() {
        for (long s = 1; s <= 4; s++) {
            repository.save(entry(s, AuditAction.PARAMETER_UPDATED, "Collection"));
        }

        assertEquals(List.of(3L, 4L), repository.findRecent(2).stream().map(AuditEntry::sequence).toList());
        assertEquals(4, repository.findRecent(10).size());
        assertThrows(UnsupportedOperationException.class, () -> repository.findAll().clear());
    }
}
