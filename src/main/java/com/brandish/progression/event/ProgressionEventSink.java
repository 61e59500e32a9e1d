package com.brandish.progression.event;

/**
 * Outbound transport for progression events (notifications, chat announcements).
 */
public interface ProgressionEventSink {
    void publish(ProgressionEvent event);
}
