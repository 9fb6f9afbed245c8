package io.netloom.tools.cli;

/**
 * Generated artifacts could not be written to the working directory.
 */
public class ArtifactWriteException extends RuntimeException {

    public ArtifactWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
