package com.parkthrive.crmops.crm;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Result of fetching a single object by id.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DetailResult {

    Status status;
    CrmRecord record;
    int httpStatus;
    String errorMessage;

    public enum Status {
        FOUND,
        /** 2xx without a usable body */
        EMPTY,
        FAILED
    }

    public static DetailResult found(int httpStatus, CrmRecord record) {
        return new DetailResult(Status.FOUND, record, httpStatus, null);
    }

    public static DetailResult empty(int httpStatus) {
        return new DetailResult(Status.EMPTY, null, httpStatus, "No data found");
    }

    public static DetailResult failed(int httpStatus, String errorMessage) {
        return new DetailResult(Status.FAILED, null, httpStatus, errorMessage);
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public Optional<CrmRecord> record() {
        return Optional.ofNullable(record);
    }
}
