package org.datayoinker.models.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Failure categories surfaced to callers. Client kinds map to 400, server kinds to 500.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {
    MISSING_TOPIC(HttpStatus.BAD_REQUEST, "Error validating topic name"),
    MULTI_VALUED_PARAMETER(HttpStatus.BAD_REQUEST, "Bad Request"),
    INVALID_NUMBER(HttpStatus.BAD_REQUEST, "Error parsing number of yoinks"),
    NUMBER_OUT_OF_RANGE(HttpStatus.BAD_REQUEST, "Error validating number of yoinks"),
    MALFORMED_CONTENT(HttpStatus.INTERNAL_SERVER_ERROR, "Error building content document"),
    CONTENT_DECODE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "Error decoding content from JSON"),
    STORAGE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "Error accessing the database");

    private final HttpStatus status;
    private final String detail;

    public boolean isClientError() {
        return status.is4xxClientError();
    }
}
