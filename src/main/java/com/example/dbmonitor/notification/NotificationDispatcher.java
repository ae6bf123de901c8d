package com.example.dbmonitor.notification;

import com.example.dbmonitor.domain.CriticalQueryEvent;
import com.example.dbmonitor.domain.TargetInfo;

import java.util.List;

/**
 * Delivers one alert message for a batch of critical query events of a single target.
 */
public interface NotificationDispatcher {

    /**
     * @throws com.example.dbmonitor.exception.NotificationException when no enabled channel accepted the message
     */
    void send(List<CriticalQueryEvent> events, TargetInfo target);
}
