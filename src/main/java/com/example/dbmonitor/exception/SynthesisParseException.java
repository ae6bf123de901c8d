package com.example.dbmonitor.exception;

/**
 * Model output could not be turned into exactly three suggestions.
 * Never leaves the synthesis engine; it selects the fallback generator instead.
 */
public class SynthesisParseException extends MonitorException {

    public SynthesisParseException(String message) {
        super(message);
    }

    public SynthesisParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
