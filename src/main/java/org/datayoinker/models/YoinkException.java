package org.datayoinker.models;

import lombok.Getter;
import org.datayoinker.models.enums.ErrorKind;

/**
 * Raised by the publish and retrieval paths. The message is the cause string returned to the caller.
 */
@Getter
public class YoinkException extends RuntimeException {

    private final ErrorKind kind;

    public YoinkException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public YoinkException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
