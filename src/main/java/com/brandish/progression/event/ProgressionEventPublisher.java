package com.brandish.progression.event;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Objects;

/**
 * Defers events until the surrounding transaction commits; rolled-back work publishes nothing.
 * Delivery failures are logged and never reach the caller.
 */
@Service
@RequiredArgsConstructor
public class ProgressionEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(ProgressionEventPublisher.class);

    private final ApplicationEventPublisher applicationEventPublisher;
    private final ProgressionEventSink progressionEventSink;

    public void publish(ProgressionEvent event) {
        ProgressionEvent requiredEvent = Objects.requireNonNull(event, "event is required");
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    publishImmediately(requiredEvent);
                }
            });
            return;
        }
        publishImmediately(requiredEvent);
    }

    private void publishImmediately(ProgressionEvent event) {
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException ex) {
            log.warn("Local listeners failed for progression event {} on node {}", event.type(), event.nodeKey(), ex);
        }
        try {
            progressionEventSink.publish(event);
        } catch (RuntimeException ex) {
            log.warn("Failed to deliver progression event {} for node {}", event.type(), event.nodeKey(), ex);
        }
    }
}
