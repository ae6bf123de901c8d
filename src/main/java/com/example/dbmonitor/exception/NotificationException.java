package com.example.dbmonitor.exception;

public class NotificationException extends MonitorException {

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
