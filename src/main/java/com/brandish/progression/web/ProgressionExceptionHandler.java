package com.brandish.progression.web;

import com.brandish.progression.tree.TreeConfigException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Locale;

@RestControllerAdvice
public class ProgressionExceptionHandler {

    @ExceptionHandler(ProgressionConflictException.class)
    public ResponseEntity<ProgressionErrorResponse> handleConflict(ProgressionConflictException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(new ProgressionErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(ProgressionValidationException.class)
    public ResponseEntity<ProgressionErrorResponse> handleValidation(ProgressionValidationException ex) {
        return ResponseEntity.badRequest()
                .body(new ProgressionErrorResponse("invalid_request", ex.getMessage()));
    }

    @ExceptionHandler(TreeConfigException.class)
    public ResponseEntity<ProgressionErrorResponse> handleTreeConfig(TreeConfigException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ProgressionErrorResponse(ex.getKind().name().toLowerCase(Locale.ROOT), ex.getMessage()));
    }

    public record ProgressionErrorResponse(
            String code,
            String message
    ) {
    }
}
