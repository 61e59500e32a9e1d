package com.brandish.progression.web;

/**
 * Caller input rejected before any transaction opens.
 */
public class ProgressionValidationException extends RuntimeException {

    public ProgressionValidationException(String message) {
        super(message);
    }
}
