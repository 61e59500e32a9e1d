package com.brandish.progression.tree;

import lombok.Getter;

/**
 * Tree config rejected during load or validation. Nothing is written to the database when
 * this is thrown.
 */
@Getter
public class TreeConfigException extends RuntimeException {

    public enum Kind {
        DUPLICATE_NODE_KEY,
        MISSING_PARENT,
        CYCLE_DETECTED,
        INVALID_CONFIG
    }

    private final Kind kind;

    public TreeConfigException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TreeConfigException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
