package org.datayoinker.controllers;

import lombok.extern.slf4j.Slf4j;
import org.datayoinker.models.YoinkException;
import org.datayoinker.models.dto.ErrorResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(YoinkException.class)
    public ResponseEntity<ErrorResponse> handleYoinkException(YoinkException exception) {
        if (exception.getKind().isClientError()) {
            log.warn("Rejected request ({}): {}", exception.getKind(), exception.getMessage());
        } else {
            log.error("Request failed ({}): {}", exception.getKind(), exception.getMessage(), exception);
        }
        return ResponseEntity
                .status(exception.getKind().getStatus())
                .body(ErrorResponse.of(exception));
    }
}
