package com.example.dbmonitor.exception;

/**
 * The text-generation endpoint failed, timed out or answered with an error status.
 */
public class TextGenerationException extends MonitorException {

    public TextGenerationException(String message) {
        super(message);
    }

    public TextGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
