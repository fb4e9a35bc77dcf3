package com.wgbot.application.ports;

import com.wgbot.domain.DomainException;

public final class RecordNotFoundException extends DomainException {

    private final String recordType;
    private final long recordId;

    public RecordNotFoundException(String recordType, long recordId) {
        super(recordType + " not found: " + recordId);
        this.recordType = recordType;
        this.recordId = recordId;
    }

    public String recordType() {
        return recordType;
    }

    public long recordId() {
        return recordId;
    }
}
