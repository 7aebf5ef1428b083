package com.agentflow.core.store;

/**
 * Thrown by write operations that reference an agent, task or health event
 * the store does not hold. Reads return {@link java.util.Optional} instead.
 */
public class RecordNotFoundException extends StoreException {

    private final String recordType;
    private final long recordId;

    public RecordNotFoundException(String recordType, long recordId) {
        super(recordType + " not found: " + recordId);
        this.recordType = recordType;
        this.recordId = recordId;
    }

    public String getRecordType() {
        return recordType;
    }

    public long getRecordId() {
        return recordId;
    }
}
