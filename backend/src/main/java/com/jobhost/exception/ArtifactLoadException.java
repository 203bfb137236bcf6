package com.jobhost.exception;

/** The artifact directory or one of its jars is missing or unreadable. */
public class ArtifactLoadException extends JobHostException {

    public ArtifactLoadException(String message) {
        super(message);
    }

    public ArtifactLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
