package com.gt.recall.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Hands review events to the application event bus. Publishing happens after the review has been stored, so a
 * failing listener is logged and never fails the review that triggered it.
 */
@Component
public class ReviewNotificationPublisher {

    private static final Logger log = LoggerFactory.getLogger(ReviewNotificationPublisher.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public ReviewNotificationPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publish(ReviewNotification notification) {
        try {
            applicationEventPublisher.publishEvent(notification);
        } catch (RuntimeException ex) {
            log.warn("Failed to publish {} notification for user {} item {}",
                    notification.type(), notification.userId(), notification.itemId(), ex);
        }
    }
}
