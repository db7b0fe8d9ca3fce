package com.collection.mint.audit;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Append-only audit log held in memory, with a per-subject index so the
 * trail of one token holder or withdrawal can be read without a full scan.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final List<AuditEntry> log = new ArrayList<>();
    private final Map<String, List<AuditEntry>> bySubject = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public AuditEntry save(AuditEntry entry) {
        lock.writeLock().lock();
        try {
            AuditEntry stored = entry.withSequence(log.size() + 1L);
            log.add(stored);
            if (stored.subject() != null) {
                bySubject.computeIfAbsent(stored.subject(), s -> new ArrayList<>()).add(stored);
            }
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<AuditEntry> findAll() {
        lock.readLock().lock();
        try {
            return List.copyOf(log);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<AuditEntry> findBySubject(String subject) {
        lock.readLock().lock();
        try {
            return List.copyOf(bySubject.getOrDefault(subject, List.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return filter(e -> e.action() == action);
    }

    @Override
    public List<AuditEntry> findByActorId(String actorId) {
        return filter(e -> actorId.equals(e.actorId()));
    }

    @Override
    public int count() {
        lock.readLock().lock();
        try {
            return log.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<AuditEntry> findRecent(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        lock.readLock().lock();
        try {
            int from = Math.max(0, log.size() - limit);
            return List.copyOf(log.subList(from, log.size()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Sequences increase along the log, so the first match is found by binary search.
     */
    @Override
    public List<AuditEntry> findAfterSequence(long sequence) {
        lock.readLock().lock();
        try {
            int low = 0;
            int high = log.size();
            while (low < high) {
                int mid = (low + high) >>> 1;
                if (log.get(mid).sequence() <= sequence) {
                    low = mid + 1;
                } else {
                    high = mid;
                }
            }
            return List.copyOf(log.subList(low, log.size()));
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<AuditEntry> filter(Predicate<AuditEntry> predicate) {
        lock.readLock().lock();
        try {
            return log.stream().filter(predicate).toList();
        } finally {
            lock.readLock().unlock();
        }
    }
}
