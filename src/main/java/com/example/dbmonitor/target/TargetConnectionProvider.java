package com.example.dbmonitor.target;

import com.example.dbmonitor.domain.MonitoredTarget;
import com.example.dbmonitor.exception.TargetConnectionException;

import java.sql.Connection;

/**
 * Opens a short-lived connection to one target. Connections are never pooled:
 * callers close them with try-with-resources on every exit path.
 */
public interface TargetConnectionProvider {

    /**
     * @throws TargetConnectionException when the credential cannot be decrypted or the target is unreachable
     */
    Connection open(MonitoredTarget target);
}
