package com.example.dbmonitor.exception;

public class TargetNotFoundException extends MonitorException {

    public TargetNotFoundException(String targetId) {
        super("Target not found: " + targetId);
    }
}
