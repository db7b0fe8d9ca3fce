package com.collection.mint.audit;

import java.util.List;

/**
 * Repository interface for audit entry persistence.
 * Implementations must keep entries in the order they were saved and never
 * modify or delete them.
 */
public interface AuditRepository {

    /**
     * Appends an audit entry, stamping it with the next sequence number of this log.
     * Any sequence already on the entry is ignored, so several writers can share one
     * repository.
     *
     * @return the entry as stored
     */
    AuditEntry save(AuditEntry entry);

    /**
     * Gets all audit entries in log order.
     */
    List<AuditEntry> findAll();

    /**
     * Gets audit entries about a specific subject.
     */
    List<AuditEntry> findBySubject(String subject);

    /**
     * Gets audit entries by action type.
     */
    List<AuditEntry> findByAction(AuditAction action);

    /**
     * Gets audit entries by actor.
     */
    List<AuditEntry> findByActorId(String actorId);

    /**
     * Gets the total number of audit entries.
     */
    int count();

    /**
     * Gets the most recent entries, up to the specified limit.
     */
    List<AuditEntry> findRecent(int limit);

    /**
     * Gets entries with a sequence number greater than {@code sequence}, for
     * observers that poll the log.
     */
    default List<AuditEntry> findAfterSequence(long sequence) {
        return findAll().stream()
                .filter(e -> e.sequence() > sequence)
                .toList();
    }
}
