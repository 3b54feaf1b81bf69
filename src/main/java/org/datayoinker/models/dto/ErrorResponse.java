package org.datayoinker.models.dto;

import org.datayoinker.models.YoinkException;

public record ErrorResponse(
        String error,
        String detail,
        int status
) {

    public static ErrorResponse of(YoinkException exception) {
        return new ErrorResponse(
                exception.getMessage(),
                exception.getKind().getDetail(),
                exception.getKind().getStatus().value()
        );
    }
}
