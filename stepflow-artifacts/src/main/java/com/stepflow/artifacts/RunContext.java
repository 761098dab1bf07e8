package com.stepflow.artifacts;

import java.util.Objects;
import java.util.UUID;

/**
 * Active user and workspace recorded on artifacts created while building a pipeline.
 */
public record RunContext(UUID userId, UUID workspaceId) {
    public RunContext {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(workspaceId, "workspaceId");
    }
}
