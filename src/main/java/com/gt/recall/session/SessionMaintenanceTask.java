package com.gt.recall.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Component
public class SessionMaintenanceTask {

    private static final Logger log = LoggerFactory.getLogger(SessionMaintenanceTask.class);

    private final ReviewSessionService reviewSessionService;
    private final Clock clock;
    private final int staleAfterHours;

    public SessionMaintenanceTask(ReviewSessionService reviewSessionService,
                                  Clock clock,
                                  @Value("${recall.session.staleAfterHours:12}") int staleAfterHours) {
        this.reviewSessionService = reviewSessionService;
        this.clock = clock;

        this.staleAfterHours = staleAfterHours;
    }

    @Scheduled(cron = "@daily")
    public void endStaleSessions() {
        Instant cutoff = clock.instant().minus(staleAfterHours, ChronoUnit.HOURS);

        int sessionsEnded = reviewSessionService.endStaleSessions(cutoff);

        log.info("Ended stale review sessions. {} sessions ended.", sessionsEnded);
    }
}
