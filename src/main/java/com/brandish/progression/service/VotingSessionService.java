package com.brandish.progression.service;

import com.brandish.progression.config.ProgressionProperties;
import com.brandish.progression.model.VotingOption;
import com.brandish.progression.model.VotingSession;
import com.brandish.progression.model.VotingSessionStatus;
import com.brandish.progression.repository.UserSessionVoteRepository;
import com.brandish.progression.repository.VotingOptionRepository;
import com.brandish.progression.repository.VotingSessionRepository;
import com.brandish.progression.web.ProgressionConflictException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Voting session lifecycle: VOTING -> FROZEN <-> VOTING -> COMPLETED. Transitions lock the
 * session row; illegal ones raise {@link ProgressionConflictException}.
 */
@Service
@RequiredArgsConstructor
public class VotingSessionService {

    private static final Logger log = LoggerFactory.getLogger(VotingSessionService.class);

    private static final EnumSet<VotingSessionStatus> OPEN_STATUSES =
            EnumSet.of(VotingSessionStatus.VOTING, VotingSessionStatus.FROZEN);

    private final VotingSessionRepository votingSessionRepository;
    private final VotingOptionRepository votingOptionRepository;
    private final UserSessionVoteRepository userSessionVoteRepository;
    private final ProgressionProperties progressionProperties;

    @Transactional(readOnly = true)
    public Optional<VotingSession> getActiveSession() {
        return votingSessionRepository.findFirstByStatusOrderByStartedAtDescIdDesc(VotingSessionStatus.VOTING);
    }

    @Transactional(readOnly = true)
    public Optional<VotingSession> getActiveOrFrozenSession() {
        return votingSessionRepository.findFirstByStatusInOrderByStartedAtDescIdDesc(OPEN_STATUSES);
    }

    @Transactional(readOnly = true)
    public Optional<VotingSession> getMostRecentSession() {
        return votingSessionRepository.findFirstByOrderByStartedAtDescIdDesc();
    }

    @Transactional(readOnly = true)
    public List<VotingOption> getSessionOptions(Integer sessionId) {
        return votingOptionRepository.findBySessionIdOrderByIdAsc(sessionId);
    }

    @Transactional
    public VotingSession createVotingSession() {
        OffsetDateTime now = OffsetDateTime.now();
        VotingSession session = new VotingSession();
        session.setStatus(VotingSessionStatus.VOTING);
        session.setStartedAt(now);
        session.setVotingDeadline(now.plus(progressionProperties.getVoting().getSessionDuration()));
        try {
            VotingSession saved = votingSessionRepository.saveAndFlush(session);
            log.info("Created voting session {} (deadline={})", saved.getId(), saved.getVotingDeadline());
            return saved;
        } catch (DataIntegrityViolationException ex) {
            throw ProgressionConflictException.sessionAlreadyActive("Another voting session is already open");
        }
    }

    @Transactional
    public VotingOption addVotingOption(Integer sessionId, Integer nodeId, int targetLevel) {
        VotingOption option = new VotingOption();
        option.setSessionId(sessionId);
        option.setNodeId(nodeId);
        option.setTargetLevel(targetLevel);
        option.setVoteCount(0);
        return votingOptionRepository.saveAndFlush(option);
    }

    @Transactional
    public VotingSession freezeVotingSession(Integer sessionId) {
        VotingSession session = lockSession(sessionId);
        switch (session.getStatus()) {
            case FROZEN -> throw ProgressionConflictException.sessionAlreadyFrozen(
                    "Voting session " + sessionId + " is already frozen");
            case COMPLETED -> throw ProgressionConflictException.invalidTransition(
                    "Voting session " + sessionId + " is completed");
            default -> {
                session.setStatus(VotingSessionStatus.FROZEN);
                log.info("Froze voting session {}", sessionId);
                return votingSessionRepository.save(session);
            }
        }
    }

    @Transactional
    public VotingSession resumeVotingSession(Integer sessionId) {
        VotingSession session = lockSession(sessionId);
        switch (session.getStatus()) {
            case VOTING -> throw ProgressionConflictException.sessionAlreadyActive(
                    "Voting session " + sessionId + " is already accepting votes");
            case COMPLETED -> throw ProgressionConflictException.invalidTransition(
                    "Voting session " + sessionId + " is completed");
            default -> {
                session.setStatus(VotingSessionStatus.VOTING);
                log.info("Resumed voting session {}", sessionId);
                return votingSessionRepository.save(session);
            }
        }
    }

    /**
     * @param winningOptionId may be {@code null} when the session closes without a winner
     */
    @Transactional
    public VotingSession endVotingSession(Integer sessionId, Integer winningOptionId) {
        VotingSession session = lockSession(sessionId);
        if (session.getStatus() == VotingSessionStatus.COMPLETED) {
            throw ProgressionConflictException.invalidTransition("Voting session " + sessionId + " already ended");
        }
        session.setStatus(VotingSessionStatus.COMPLETED);
        session.setEndedAt(OffsetDateTime.now());
        session.setWinningOptionId(winningOptionId);
        log.info("Ended voting session {} (winningOptionId={})", sessionId, winningOptionId);
        return votingSessionRepository.save(session);
    }

    /**
     * Records one vote per (user, session). The marker insert serializes concurrent votes by the
     * same user, so exactly one of them increments the count. The session must still be accepting
     * votes once its row is share-locked.
     */
    @Transactional
    public void checkAndRecordVoteAtomic(String userId, Integer sessionId, Integer optionId, Integer nodeId) {
        VotingSession session = votingSessionRepository.findByIdForShare(sessionId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Voting session not found: " + sessionId));
        if (session.getStatus() != VotingSessionStatus.VOTING) {
            throw ProgressionConflictException.noActiveSession(
                    "Voting session " + sessionId + " is " + session.getStatus().name().toLowerCase(Locale.ROOT));
        }
        int inserted = userSessionVoteRepository.insertIfAbsent(userId, sessionId, optionId, nodeId);
        if (inserted == 0) {
            throw ProgressionConflictException.alreadyVoted(
                    "User " + userId + " already voted in session " + sessionId);
        }
        if (votingOptionRepository.incrementVoteCount(sessionId, optionId) == 0) {
            throw new IllegalStateException("Voting option " + optionId + " does not belong to session " + sessionId);
        }
        votingOptionRepository.markHighestIfLeading(optionId);
        log.debug("Recorded vote by {} for option {} in session {}", userId, optionId, sessionId);
    }

    @Transactional(readOnly = true)
    public boolean hasUserVotedInSession(String userId, Integer sessionId) {
        return userSessionVoteRepository.existsByUserIdAndSessionId(userId, sessionId);
    }

    @Transactional(readOnly = true)
    public List<String> getSessionVoters(Integer sessionId) {
        if (!votingSessionRepository.existsById(sessionId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Voting session not found: " + sessionId);
        }
        return userSessionVoteRepository.findVoterIdsBySessionId(sessionId);
    }

    @Transactional(readOnly = true)
    public List<VotingSession> findExpiredSessions(OffsetDateTime now) {
        return votingSessionRepository.findByStatusAndVotingDeadlineBeforeOrderByIdAsc(VotingSessionStatus.VOTING, now);
    }

    private VotingSession lockSession(Integer sessionId) {
        return votingSessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Voting session not found: " + sessionId));
    }
}
