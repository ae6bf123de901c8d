package com.example.dbmonitor.exception;

/**
 * A target could not be reached, or its stored credential could not be decrypted.
 * Collectors skip the target and try again on the next cycle.
 */
public class TargetConnectionException extends MonitorException {

    private final String targetId;

    public TargetConnectionException(String targetId, String message, Throwable cause) {
        super(message, cause);
        this.targetId = targetId;
    }

    public String getTargetId() {
        return targetId;
    }
}
