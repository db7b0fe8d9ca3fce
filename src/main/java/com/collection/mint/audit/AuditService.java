package com.collection.mint.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only notification log for successful contract calls.
 * The repository stamps each entry with the next sequence number, so observers see a
 * strictly increasing logical clock even when wall-clock timestamps collide or several
 * contracts share one repository.
 *
 * <p>The log is an output only: nothing in the contract reads it back to make a decision.
 * Entries are recorded after the call's effects are applied, so a repository failure is
 * logged and counted in {@link #failedWrites()} rather than thrown back to the caller.</p>
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;
    private final Clock clock;
    private final AtomicLong lastSequence = new AtomicLong();
    private final AtomicLong failedWrites = new AtomicLong();

    public AuditService() {
        this(new InMemoryAuditRepository(), Clock.systemUTC());
    }

    public AuditService(AuditRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public AuditService(AuditRepository repository, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Records an audit entry.
     *
     * @return the stored entry, or the unsaved entry with sequence 0 when the repository failed
     */
    public AuditEntry record(AuditAction action, String subject, String actorId,
                             Map<String, Object> details) {
        AuditEntry entry = AuditEntry.builder()
                .action(action)
                .subject(subject)
                .actorId(actorId)
                .details(details)
                .timestamp(clock.instant())
                .build();
        AuditEntry stored;
        try {
            stored = repository.save(entry);
        } catch (RuntimeException e) {
            failedWrites.incrementAndGet();
            log.error("Audit entry {} on {} by {} could not be saved", action, subject, actorId, e);
            return entry;
        }
        lastSequence.accumulateAndGet(stored.sequence(), Math::max);
        log.debug("Audit entry #{} recorded: {} on {} by {}",
                stored.sequence(), stored.action(), stored.subject(), stored.actorId());
        return stored;
    }

    /**
     * Records a simple audit entry without details.
     */
    public AuditEntry record(AuditAction action, String subject, String actorId) {
        return record(action, subject, actorId, null);
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesForSubject(String subject) {
        return repository.findBySubject(subject);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public List<AuditEntry> getEntriesByActor(String actorId) {
        return repository.findByActorId(actorId);
    }

    public List<AuditEntry> getEntriesAfter(long sequenceNumber) {
        return repository.findAfterSequence(sequenceNumber);
    }

    public List<AuditEntry> getRecentEntries(int limit) {
        return repository.findRecent(limit);
    }

    public int size() {
        return repository.count();
    }

    /**
     * Sequence number of the last entry this service recorded, 0 if none.
     */
    public long lastSequence() {
        return lastSequence.get();
    }

    /**
     * Number of entries the repository refused to save.
     */
    public long failedWrites() {
        return failedWrites.get();
    }
}
