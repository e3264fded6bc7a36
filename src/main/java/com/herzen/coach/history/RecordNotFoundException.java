package com.herzen.coach.history;

public class RecordNotFoundException extends RuntimeException {
    private final String recordId;

    public RecordNotFoundException(String recordId) {
        super("Intervention record not found: " + recordId);
        this.recordId = recordId;
    }

    public String getRecordId() {
        return recordId;
    }
}
