package io.agentledger.error;

import java.nio.file.Path;

public final class ArtifactMissingException extends CoordinationException {
    public static final String CODE = "artifact_missing";

    public ArtifactMissingException(String taskId, Path artifact) {
        super(CODE, "no spec artifact for task " + taskId + " at " + artifact);
    }

    public ArtifactMissingException(String taskId, Path artifact, Throwable cause) {
        super(CODE, "no spec artifact for task " + taskId + " at " + artifact, cause);
    }
}
