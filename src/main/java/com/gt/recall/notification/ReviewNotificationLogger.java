package com.gt.recall.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

@Component
public class ReviewNotificationLogger {

    private static final Logger log = LoggerFactory.getLogger(ReviewNotificationLogger.class);

    @Async
    @EventListener
    public void onReviewNotification(ReviewNotification notification) {
        switch (notification.type()) {
            case LEECH_DETECTED ->
                    log.warn("Item {} became a leech for user {}: {}", notification.itemId(), notification.userId(), notification.payload());
            case SESSION_ENDED ->
                    log.info("Session {} ended for user {}: {}", notification.sessionId(), notification.userId(), notification.payload());
            default ->
                    log.debug("{} for user {} item {}: {}", notification.type(), notification.userId(), notification.itemId(), notification.payload());
        }
    }
}
