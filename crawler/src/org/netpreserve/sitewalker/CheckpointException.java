package org.netpreserve.sitewalker;

/**
 * Thrown when a checkpoint can't be written and checkpointing is mandatory.
 */
public class CheckpointException extends SitewalkerException {
    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
