package com.collection.mint.compliance;

import com.collection.mint.core.model.Address;
import com.collection.mint.core.model.ParticipantRecord;

/**
 * Storage for per-address purchase state.
 */
public interface ParticipantStore {

    /**
     * Returns the participant's record, or {@link ParticipantRecord#EMPTY} if none was stored.
     */
    ParticipantRecord get(Address participant);

    /**
     * Replaces the participant's record.
     */
    void put(Address participant, ParticipantRecord record);

    /**
     * Number of participants with a stored record.
     */
    int size();
}
