package com.example.dbmonitor.exception;

/**
 * Base class for failures raised inside the observation pipeline.
 */
public class MonitorException extends RuntimeException {

    public MonitorException(String message) {
        super(message);
    }

    public MonitorException(String message, Throwable cause) {
        super(message, cause);
    }
}
