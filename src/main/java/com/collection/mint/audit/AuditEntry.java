package com.collection.mint.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable notification record of a successful state change.
 *
 * @param id        unique id of the entry
 * @param sequence  position in the log, assigned by the repository on save
 * @param action    what happened
 * @param subject   what it happened to: a parameter name, a transaction index, an address
 * @param actorId   the caller
 * @param details   parameter name/value or index/amount pairs
 * @param timestamp wall-clock time of the call
 */
public record AuditEntry(
        String id,
        long sequence,
        AuditAction action,
        String subject,
        String actorId,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public AuditEntry withSequence(long sequence) {
        return new AuditEntry(id, sequence, action, subject, actorId, details, timestamp);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private long sequence;
        private AuditAction action;
        private String subject;
        private String actorId;
        private Map<String, Object> details;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, sequence, action, subject, actorId, details, timestamp);
        }
    }
}
