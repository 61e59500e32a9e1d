package com.brandish.progression.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class ProgressionConflictException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public ProgressionConflictException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public static ProgressionConflictException alreadyVoted(String detail) {
        return new ProgressionConflictException(
                HttpStatus.CONFLICT,
                "already_voted",
                detail
        );
    }

    public static ProgressionConflictException sessionAlreadyActive(String detail) {
        return new ProgressionConflictException(
                HttpStatus.CONFLICT,
                "session_already_active",
                detail
        );
    }

    public static ProgressionConflictException sessionAlreadyFrozen(String detail) {
        return new ProgressionConflictException(
                HttpStatus.CONFLICT,
                "session_already_frozen",
                detail
        );
    }

    public static ProgressionConflictException noActiveSession(String detail) {
        return new ProgressionConflictException(
                HttpStatus.CONFLICT,
                "no_active_session",
                detail
        );
    }

    public static ProgressionConflictException noNodesAvailable(String detail) {
        return new ProgressionConflictException(
                HttpStatus.CONFLICT,
                "no_nodes_available",
                detail
        );
    }

    public static ProgressionConflictException maxLevelExceeded(String detail) {
        return new ProgressionConflictException(
                HttpStatus.CONFLICT,
                "max_level_exceeded",
                detail
        );
    }

    public static ProgressionConflictException invalidTransition(String detail) {
        return new ProgressionConflictException(
                HttpStatus.CONFLICT,
                "invalid_transition",
                detail
        );
    }
}
