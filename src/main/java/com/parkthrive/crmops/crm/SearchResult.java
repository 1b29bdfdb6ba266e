package com.parkthrive.crmops.crm;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * One page of a list or search endpoint: {@code {data: [...], cursor: ...}}.
 */
@Value
@Builder
public class SearchResult {

    Status status;

    @Singular
    List<CrmRecord> items;

    /** Opaque continuation token; absent on the last page */
    String cursor;

    int httpStatus;
    String errorMessage;

    public enum Status {
        OK,
        FAILED,
        MALFORMED
    }

    public static SearchResult failed(int httpStatus, String errorMessage) {
        return SearchResult.builder()
                .status(Status.FAILED)
                .httpStatus(httpStatus)
                .errorMessage(errorMessage)
                .build();
    }

    public static SearchResult malformed(int httpStatus) {
        return SearchResult.builder()
                .status(Status.MALFORMED)
                .httpStatus(httpStatus)
                .errorMessage("Error decoding API response")
                .build();
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public Optional<String> nextCursor() {
        return cursor == null || cursor.isEmpty() ? Optional.empty() : Optional.of(cursor);
    }
}
