package com.example.dbmonitor.exception;

/**
 * A statistics or catalog query failed or returned something unusable.
 */
public class StatisticsQueryException extends MonitorException {

    public StatisticsQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
