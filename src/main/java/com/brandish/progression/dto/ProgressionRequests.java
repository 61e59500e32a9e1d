package com.brandish.progression.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public final class ProgressionRequests {

    private ProgressionRequests() {
    }

    public record VoteRequest(
            @NotBlank(message = "userId is required")
            String userId,

            @NotNull(message = "optionIndex is required")
            @Min(value = 1, message = "optionIndex must be at least 1")
            Integer optionIndex
    ) {
    }

    public record RecordEngagementRequest(
            @NotBlank(message = "userId is required")
            @Size(max = 100, message = "userId must be at most 100 characters")
            String userId,

            @NotBlank(message = "metricType is required")
            @Size(max = 50, message = "metricType must be at most 50 characters")
            String metricType,

            @NotNull(message = "value is required")
            @Min(value = 0, message = "value must be non-negative")
            Integer value,

            JsonNode metadata
    ) {
    }

    public record UnlockUserProgressionRequest(
            @NotBlank(message = "progressionType is required")
            String progressionType,

            @NotBlank(message = "progressionKey is required")
            String progressionKey,

            JsonNode metadata
    ) {
    }

    public record AdminUnlockRequest(
            @NotBlank(message = "nodeKey is required")
            String nodeKey,

            @NotNull(message = "level is required")
            @Min(value = 1, message = "level must be at least 1")
            Integer level
    ) {
    }

    /**
     * Level 0 removes every unlocked level of the node.
     */
    public record AdminRelockRequest(
            @NotBlank(message = "nodeKey is required")
            String nodeKey,

            @NotNull(message = "level is required")
            @Min(value = 0, message = "level must be non-negative")
            Integer level
    ) {
    }

    public record ResetRequest(
            @NotBlank(message = "resetBy is required")
            @Size(max = 100, message = "resetBy must be at most 100 characters")
            String resetBy,

            @Size(max = 1000, message = "reason must be at most 1000 characters")
            String reason,

            boolean preserveUserData
    ) {
    }
}
