package org.smileyface.crawlcore.checkpoint;

/**
 * A checkpoint update would leave a step completed behind an unfinished earlier step.
 */
public class CheckpointViolationException extends RuntimeException {

    public CheckpointViolationException(String message) {
        super(message);
    }
}
