package com.brandish.progression.service;

import com.brandish.progression.config.ProgressionProperties;
import com.brandish.progression.model.ProgressionReset;
import com.brandish.progression.repository.EngagementMetricRepository;
import com.brandish.progression.repository.ProgressionResetRepository;
import com.brandish.progression.repository.ProgressionUnlockRepository;
import com.brandish.progression.repository.UnlockProgressRepository;
import com.brandish.progression.repository.UserProgressionRepository;
import com.brandish.progression.repository.UserSessionVoteRepository;
import com.brandish.progression.repository.VotingOptionRepository;
import com.brandish.progression.repository.VotingSessionRepository;
import com.brandish.progression.web.ProgressionValidationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Wipes the shared tree back to its root in one transaction, leaving an audit row behind.
 */
@Service
@RequiredArgsConstructor
public class ProgressionResetService {

    private static final Logger log = LoggerFactory.getLogger(ProgressionResetService.class);

    private final ProgressionResetRepository progressionResetRepository;
    private final ProgressionUnlockRepository progressionUnlockRepository;
    private final EngagementMetricRepository engagementMetricRepository;
    private final UserSessionVoteRepository userSessionVoteRepository;
    private final UnlockProgressRepository unlockProgressRepository;
    private final VotingSessionRepository votingSessionRepository;
    private final VotingOptionRepository votingOptionRepository;
    private final UserProgressionRepository userProgressionRepository;
    private final ProgressionProperties progressionProperties;

    @Transactional
    public ProgressionReset resetTree(String resetBy, String reason, boolean preserveUserData) {
        if (resetBy == null || resetBy.isBlank()) {
            throw new ProgressionValidationException("resetBy is required");
        }

        ProgressionReset audit = new ProgressionReset();
        audit.setResetAt(OffsetDateTime.now());
        audit.setResetBy(resetBy);
        audit.setReason(reason);
        audit.setNodesResetCount((int) progressionUnlockRepository.count());
        audit.setEngagementScoreAtReset(engagementMetricRepository.sumAllMetricValues());
        ProgressionReset saved = progressionResetRepository.saveAndFlush(audit);

        userSessionVoteRepository.deleteAllInBatch();
        unlockProgressRepository.deleteAllInBatch();
        votingSessionRepository.clearWinningOptions();
        votingOptionRepository.deleteAllInBatch();
        votingSessionRepository.deleteAllInBatch();
        int unlocksRemoved = progressionUnlockRepository.deleteAllExceptNode(progressionProperties.getUnlock().getRootNodeKey());
        int legacyRemoved = progressionResetRepository.deleteLegacyVoting();
        if (!preserveUserData) {
            userProgressionRepository.deleteAllInBatch();
        }

        log.info("Progression tree reset by {} (reason={}, unlocksRemoved={}, legacyVotingRemoved={}, preserveUserData={})",
                resetBy, reason, unlocksRemoved, legacyRemoved, preserveUserData);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ProgressionReset> getResetHistory() {
        return progressionResetRepository.findTop20ByOrderByResetAtDescIdDesc();
    }
}
