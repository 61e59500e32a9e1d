package com.brandish.progression.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class LoggingProgressionEventSink implements ProgressionEventSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingProgressionEventSink.class);

    @Override
    public void publish(ProgressionEvent event) {
        log.info("Progression event {}: nodeId={}, nodeKey={}, level={}, source={}",
                event.type(), event.nodeId(), event.nodeKey(), event.level(), event.source());
    }
}
