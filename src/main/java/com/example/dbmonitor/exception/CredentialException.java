package com.example.dbmonitor.exception;

public class CredentialException extends MonitorException {

    public CredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
