package com.collection.mint.compliance;

import com.collection.mint.core.model.Address;
import com.collection.mint.core.model.ParticipantRecord;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link ParticipantStore}.
 */
public class InMemoryParticipantStore implements ParticipantStore {

    private final ConcurrentMap<Address, ParticipantRecord> records = new ConcurrentHashMap<>();

    @Override
    public ParticipantRecord get(Address participant) {
        return records.getOrDefault(participant, ParticipantRecord.EMPTY);
    }

    @Override
    public void put(Address participant, ParticipantRecord record) {
        records.put(Objects.requireNonNull(participant, "participant is required"),
                Objects.requireNonNull(record, "record is required"));
    }

    @Override
    public int size() {
        return records.size();
    }
}
