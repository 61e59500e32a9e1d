package com.brandish.progression.service;

import com.brandish.progression.model.UnlockProgress;
import com.brandish.progression.repository.UnlockProgressRepository;
import com.brandish.progression.web.ProgressionConflictException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Contribution cycles. Cost arithmetic belongs to callers; this service only moves counters and
 * cycle boundaries.
 */
@Service
@RequiredArgsConstructor
public class UnlockProgressService {

    private static final Logger log = LoggerFactory.getLogger(UnlockProgressService.class);

    private final UnlockProgressRepository unlockProgressRepository;

    @Transactional
    public UnlockProgress createUnlockProgress() {
        return openCycle(0);
    }

    @Transactional(readOnly = true)
    public Optional<UnlockProgress> getActiveUnlockProgress() {
        return unlockProgressRepository.findFirstByUnlockedAtIsNullOrderByStartedAtDescIdDesc();
    }

    @Transactional
    public UnlockProgress ensureActiveUnlockProgress() {
        return unlockProgressRepository.findFirstByUnlockedAtIsNullOrderByStartedAtDescIdDesc()
                .orElseGet(() -> openCycle(0));
    }

    /**
     * Active cycle locked for the rest of the transaction, or empty when none is active.
     */
    @Transactional
    public Optional<UnlockProgress> lockActiveUnlockProgress() {
        return unlockProgressRepository.findActiveForUpdate().stream().findFirst();
    }

    /**
     * @return false when the cycle completed before the increment landed
     */
    @Transactional
    public boolean addContribution(Integer progressId, int amount) {
        return unlockProgressRepository.addContribution(progressId, amount) == 1;
    }

    @Transactional
    public void setUnlockTarget(Integer progressId, Integer nodeId, int targetLevel, Integer votingSessionId) {
        int updated = unlockProgressRepository.setTarget(progressId, nodeId, targetLevel, votingSessionId);
        if (updated == 0) {
            throw new IllegalStateException("Unlock progress not found: " + progressId);
        }
        log.info("Unlock target set to node {} level {} (progressId={}, sessionId={})",
                nodeId, targetLevel, progressId, votingSessionId);
    }

    /**
     * Closes {@code progressId} and opens its successor seeded with {@code rollover}, in the
     * caller's transaction.
     */
    @Transactional
    public UnlockProgress completeUnlock(Integer progressId, int rollover) {
        if (rollover < 0) {
            throw new IllegalArgumentException("rollover must be >= 0, got " + rollover);
        }
        int completed = unlockProgressRepository.markCompleted(progressId, OffsetDateTime.now());
        if (completed == 0) {
            throw ProgressionConflictException.invalidTransition("Unlock progress already completed: " + progressId);
        }
        UnlockProgress successor = openCycle(rollover);
        log.info("Completed unlock progress {} with rollover {}; successor {}", progressId, rollover, successor.getId());
        return successor;
    }

    /**
     * Runs after the relock transaction has committed, so it needs its own.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int clearProgressForNode(Integer nodeId) {
        return unlockProgressRepository.deleteByNodeId(nodeId);
    }

    private UnlockProgress openCycle(int contributions) {
        unlockProgressRepository.insertActiveIfAbsent(contributions);
        return unlockProgressRepository.findFirstByUnlockedAtIsNullOrderByStartedAtDescIdDesc()
                .orElseThrow(() -> new IllegalStateException("No active unlock progress after insert"));
    }
}
