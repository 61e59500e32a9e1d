package com.brandish.progression.service;

import com.brandish.progression.config.ProgressionProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class VotingDeadlineScheduler {

    private static final Logger log = LoggerFactory.getLogger(VotingDeadlineScheduler.class);

    private final ProgressionProperties progressionProperties;
    private final ProgressionService progressionService;

    @Scheduled(
            fixedRateString = "${progression.voting.deadline-check-interval-ms:60000}",
            initialDelayString = "${progression.voting.deadline-check-initial-delay-ms:30000}"
    )
    public void checkDeadlines() {
        if (!progressionProperties.getVoting().isDeadlineCheckEnabled()) {
            return;
        }

        int ended = progressionService.processExpiredSessions();
        if (ended > 0) {
            log.info("Voting deadline tick: sessionsEnded={}", ended);
        } else {
            log.debug("Voting deadline tick completed with no expired sessions");
        }
    }
}
