package com.brandish.progression.service;

import com.brandish.progression.config.ProgressionProperties;
import com.brandish.progression.model.ProgressionNode;
import com.brandish.progression.model.UnlockProgress;
import com.brandish.progression.model.VotingOption;
import com.brandish.progression.model.VotingSession;
import com.brandish.progression.model.VotingSessionStatus;
import com.brandish.progression.web.ProgressionConflictException;
import com.brandish.progression.web.ProgressionValidationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Drives the unlock cycle: ballots pick the next target, contributions fill it, and an unlock
 * rolls the surplus into the next cycle and opens the following ballot.
 * <p>
 * Unlocks commit before the follow-up transition runs, so a failed transition never undoes an
 * unlock.
 */
@Service
@RequiredArgsConstructor
public class ProgressionService {

    public static final String SOURCE_VOTE = "vote";
    public static final String SOURCE_INSTANT_OVERRIDE = "instant_override";

    private static final Logger log = LoggerFactory.getLogger(ProgressionService.class);

    private final UnlockGraphService unlockGraphService;
    private final UnlockProgressService unlockProgressService;
    private final VotingSessionService votingSessionService;
    private final EngagementLedgerService engagementLedgerService;
    private final EngagementAnalyticsService engagementAnalyticsService;
    private final ProgressionProperties progressionProperties;
    private final TransactionTemplate transactionTemplate;
    private final Random random = new Random();

    /**
     * Opens a ballot for the cycle after the current target. When a single zero-cost node is
     * auto-selected it is unlocked right after the ballot commits.
     *
     * @param unlockedNodeId node whose unlock triggered this ballot, for logging only
     */
    public void startVotingSession(Integer unlockedNodeId) {
        Boolean zeroCostTarget = transactionTemplate.execute(status -> openBallot(unlockedNodeId));
        if (Boolean.TRUE.equals(zeroCostTarget)) {
            log.info("Auto-selected target is free, unlocking immediately");
            checkAndUnlockNode();
        }
    }

    private boolean openBallot(Integer unlockedNodeId) {
        Optional<VotingSession> existing = votingSessionService.getActiveOrFrozenSession();
        if (existing.isPresent()) {
            throw ProgressionConflictException.sessionAlreadyActive(
                    "Voting session " + existing.get().getId() + " is already " + existing.get().getStatus());
        }

        UnlockProgress progress = unlockProgressService.ensureActiveUnlockProgress();
        List<ProgressionNode> candidates = candidatesExcludingTarget(progress);
        if (candidates.isEmpty()) {
            throw ProgressionConflictException.noNodesAvailable("No nodes available for voting");
        }
        if (candidates.size() == 1 && !progress.hasTarget()) {
            return autoSelectTarget(progress, candidates.get(0));
        }
        VotingSession session = startVotingWithOptions(candidates);
        log.info("Started voting session {} (previous unlock: node {})", session.getId(), unlockedNodeId);
        return false;
    }

    /**
     * Ends the current ballot. The winner becomes the unlock target when none is set yet.
     *
     * @return the winning option, empty when the ballot had no options
     */
    @Transactional
    public Optional<VotingOption> endVoting() {
        VotingSession session = votingSessionService.getActiveSession()
                .orElseThrow(() -> ProgressionConflictException.noActiveSession("No active voting session"));
        Optional<VotingOption> winner = closeWithWinner(session);
        winner.ifPresent(option -> assignTargetIfUnset(option, session.getId()));
        return winner;
    }

    /**
     * Casts {@code userId}'s vote for the {@code optionIndex}-th (1-based) option of the active
     * ballot, then credits a {@code vote_cast} engagement.
     */
    public void recordVote(String userId, int optionIndex) {
        if (userId == null || userId.isBlank()) {
            throw new ProgressionValidationException("userId is required");
        }
        if (optionIndex < 1) {
            throw new ProgressionValidationException("optionIndex must be >= 1, got " + optionIndex);
        }

        VotingSession session = votingSessionService.getActiveSession()
                .orElseThrow(() -> ProgressionConflictException.noActiveSession("No active voting session"));
        List<VotingOption> options = votingSessionService.getSessionOptions(session.getId());
        if (optionIndex > options.size()) {
            throw new ProgressionValidationException(
                    "optionIndex must be between 1 and " + options.size() + ", got " + optionIndex);
        }
        VotingOption option = options.get(optionIndex - 1);
        votingSessionService.checkAndRecordVoteAtomic(userId, session.getId(), option.getId(), option.getNodeId());
        log.info("User {} voted for option {} (node {}) in session {}",
                userId, option.getId(), option.getNodeId(), session.getId());

        try {
            engagementLedgerService.recordEngagement(userId, EngagementLedgerService.METRIC_VOTE_CAST, 1, null);
        } catch (RuntimeException ex) {
            log.warn("Failed to record vote_cast engagement for user {}", userId, ex);
        }
    }

    /**
     * Unlocks the current target when its cost is met, then opens the next cycle in a separate
     * transaction.
     *
     * @return the unlocked node, empty when nothing was unlocked
     */
    public Optional<UnlockOutcome> checkAndUnlockNode() {
        UnlockOutcome outcome = transactionTemplate.execute(status -> unlockTargetIfFunded());
        if (outcome == null) {
            return Optional.empty();
        }
        try {
            transactionTemplate.executeWithoutResult(status -> handlePostUnlockTransition(outcome.node()));
        } catch (ProgressionConflictException ex) {
            log.info("Post-unlock transition after {} skipped: {}", outcome.node().getNodeKey(), ex.getMessage());
        } catch (RuntimeException ex) {
            log.warn("Post-unlock transition after {} failed", outcome.node().getNodeKey(), ex);
        }
        return Optional.of(outcome);
    }

    /**
     * Unlocks a funded target, otherwise opens a ballot when none is running.
     */
    public Optional<UnlockOutcome> checkAndUnlockCriteria() {
        Optional<UnlockOutcome> unlocked = checkAndUnlockNode();
        if (unlocked.isPresent() || votingSessionService.getActiveOrFrozenSession().isPresent()) {
            return unlocked;
        }
        try {
            startVotingSession(null);
        } catch (ProgressionConflictException ex) {
            log.info("Did not start a voting session: {}", ex.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Ends the ballot, unlocks its winner at once and starts the next ballot.
     */
    public UnlockOutcome forceInstantUnlock() {
        UnlockOutcome outcome = Objects.requireNonNull(transactionTemplate.execute(status -> {
            VotingSession session = votingSessionService.getActiveSession()
                    .orElseThrow(() -> ProgressionConflictException.noActiveSession("No active voting session"));
            VotingOption winner = closeWithWinner(session)
                    .orElseThrow(() -> ProgressionConflictException.noActiveSession(
                            "Voting session " + session.getId() + " has no options"));
            ProgressionNode node = requireNode(winner.getNodeId());

            UnlockProgress progress = unlockProgressService.ensureActiveUnlockProgress();
            unlockProgressService.setUnlockTarget(progress.getId(), node.getId(), winner.getTargetLevel(), session.getId());
            long engagementScore = engagementLedgerService.getEngagementScore(null);
            unlockGraphService.unlockNode(node.getId(), winner.getTargetLevel(), SOURCE_INSTANT_OVERRIDE, engagementScore);
            unlockProgressService.completeUnlock(progress.getId(), 0);
            log.info("Instant unlock of {} level {} from session {}", node.getNodeKey(), winner.getTargetLevel(), session.getId());
            return new UnlockOutcome(node, winner.getTargetLevel(), SOURCE_INSTANT_OVERRIDE, engagementScore, 0);
        }));

        try {
            startVotingSession(outcome.node().getId());
        } catch (ProgressionConflictException ex) {
            log.info("No voting session after instant unlock of {}: {}", outcome.node().getNodeKey(), ex.getMessage());
        }
        return outcome;
    }

    /**
     * Ends every VOTING session past its deadline, each in its own transaction.
     *
     * @return number of sessions ended
     */
    public int processExpiredSessions() {
        List<VotingSession> expired = votingSessionService.findExpiredSessions(OffsetDateTime.now());
        int ended = 0;
        for (VotingSession candidate : expired) {
            try {
                Boolean closed = transactionTemplate.execute(status -> endExpiredSession(candidate.getId()));
                if (Boolean.TRUE.equals(closed)) {
                    ended++;
                }
            } catch (ProgressionConflictException ex) {
                log.debug("Expired session {} already closed: {}", candidate.getId(), ex.getMessage());
            } catch (RuntimeException ex) {
                log.warn("Failed to end expired voting session {}", candidate.getId(), ex);
            }
        }
        return ended;
    }

    @Transactional
    public VotingSession adminFreezeVoting() {
        VotingSession session = votingSessionService.getActiveOrFrozenSession()
                .orElseThrow(() -> ProgressionConflictException.noActiveSession("No voting session to freeze"));
        if (session.getStatus() == VotingSessionStatus.FROZEN) {
            throw ProgressionConflictException.sessionAlreadyFrozen("Voting session " + session.getId() + " is already frozen");
        }
        log.info("Admin freezing voting session {}", session.getId());
        return votingSessionService.freezeVotingSession(session.getId());
    }

    /**
     * Resumes a frozen ballot, or picks a target when none is set and opens a new ballot over
     * what remains.
     */
    public void adminStartVoting() {
        Boolean ballotNeeded = transactionTemplate.execute(status -> {
            Optional<VotingSession> open = votingSessionService.getActiveOrFrozenSession();
            if (open.isPresent()) {
                VotingSession session = open.get();
                if (session.getStatus() == VotingSessionStatus.FROZEN) {
                    votingSessionService.resumeVotingSession(session.getId());
                    log.info("Admin resumed voting session {}", session.getId());
                    return false;
                }
                throw ProgressionConflictException.sessionAlreadyActive("Voting session " + session.getId() + " is already active");
            }

            List<ProgressionNode> available = unlockGraphService.getAvailableUnlocks();
            if (available.isEmpty()) {
                throw ProgressionConflictException.noNodesAvailable("No nodes available for voting");
            }
            UnlockProgress progress = unlockProgressService.ensureActiveUnlockProgress();
            if (!progress.hasTarget()) {
                progress = setInitialTarget(available);
            }
            if (candidatesExcludingTarget(progress).isEmpty()) {
                log.info("Only the current target is available, no voting needed");
                return false;
            }
            return true;
        });
        if (Boolean.TRUE.equals(ballotNeeded)) {
            startVotingSession(null);
        }
    }

    /**
     * Startup repair: makes sure a target is set and a ballot is open while nodes remain.
     */
    public void initializeProgressionState() {
        Optional<UnlockProgress> progress = unlockProgressService.getActiveUnlockProgress();
        if (progress.isPresent() && progress.get().hasTarget()) {
            log.info("Progression state: target node {} level {} already set",
                    progress.get().getNodeId(), progress.get().getTargetLevel());
            return;
        }

        List<ProgressionNode> available = unlockGraphService.getAvailableUnlocks();
        if (available.isEmpty()) {
            log.info("Progression state: all nodes unlocked");
            return;
        }

        UnlockProgress withTarget = Objects.requireNonNull(
                transactionTemplate.execute(status -> setInitialTarget(available)));
        if (candidatesExcludingTarget(withTarget).isEmpty()) {
            return;
        }
        try {
            startVotingSession(null);
        } catch (ProgressionConflictException ex) {
            log.warn("Failed to start voting session during initialization: {}", ex.getMessage());
        }
    }

    @Transactional(readOnly = true)
    public Optional<SessionWithOptions> getActiveOrFrozenSession() {
        return votingSessionService.getActiveOrFrozenSession().map(this::withOptions);
    }

    @Transactional(readOnly = true)
    public Optional<SessionWithOptions> getMostRecentSession() {
        return votingSessionService.getMostRecentSession().map(this::withOptions);
    }

    @Transactional(readOnly = true)
    public ProgressionStatus getProgressionStatus() {
        List<ProgressionNode> nodes = unlockGraphService.getAllNodes();
        Map<Integer, Integer> unlockedLevels = unlockGraphService.getUnlockedLevels();
        long totalUnlocked = unlockGraphService.countUnlockRows();
        boolean allUnlocked = !nodes.isEmpty() && nodes.stream().allMatch(node ->
                unlockedLevels.getOrDefault(node.getId(), 0) >= node.getMaxLevel());

        Optional<SessionWithOptions> activeSession = votingSessionService.getActiveSession().map(this::withOptions);
        Optional<SessionWithOptions> openSession = activeSession.isPresent()
                ? activeSession
                : votingSessionService.getActiveOrFrozenSession().map(this::withOptions);
        UnlockProgress progress = unlockProgressService.getActiveUnlockProgress().orElse(null);

        OffsetDateTime estimatedUnlockAt = null;
        if (progress != null && progress.hasTarget()) {
            Optional<ProgressionNode> target = unlockGraphService.getNodeById(progress.getNodeId());
            if (target.isPresent()) {
                estimatedUnlockAt = engagementAnalyticsService.estimateUnlockTime(target.get().getNodeKey()).estimatedUnlockAt();
            }
        }

        boolean transitioning = openSession.isEmpty() && !allUnlocked && (progress == null || !progress.hasTarget());
        return new ProgressionStatus(
                totalUnlocked,
                nodes.size(),
                allUnlocked,
                engagementLedgerService.getEngagementScore(null),
                activeSession.orElse(null),
                progress,
                estimatedUnlockAt,
                transitioning
        );
    }

    private UnlockOutcome unlockTargetIfFunded() {
        Optional<UnlockProgress> locked = unlockProgressService.lockActiveUnlockProgress();
        if (locked.isEmpty() || !locked.get().hasTarget()) {
            return null;
        }
        UnlockProgress progress = locked.get();
        ProgressionNode node = requireNode(progress.getNodeId());
        int accumulated = progress.getContributionsAccumulated();
        if (accumulated < node.getUnlockCost()) {
            log.debug("Waiting for contribution threshold on {}: {}/{}", node.getNodeKey(), accumulated, node.getUnlockCost());
            return null;
        }

        unlockGraphService.unlockNode(node.getId(), progress.getTargetLevel(), SOURCE_VOTE, accumulated);
        closeSessionTiedTo(progress);

        int maxRollover = progressionProperties.getUnlock().getMaxRolloverPoints();
        int surplus = Math.max(0, accumulated - node.getUnlockCost());
        int rollover = Math.min(surplus, maxRollover);
        if (surplus > rollover) {
            log.info("Capping contribution rollover from {} to {}", surplus, rollover);
        }
        unlockProgressService.completeUnlock(progress.getId(), rollover);
        log.info("Node {} unlocked at level {} with {} contributions (rollover={})",
                node.getNodeKey(), progress.getTargetLevel(), accumulated, rollover);
        return new UnlockOutcome(node, progress.getTargetLevel(), SOURCE_VOTE, accumulated, rollover);
    }

    private void closeSessionTiedTo(UnlockProgress progress) {
        if (progress.getVotingSessionId() == null) {
            return;
        }
        Optional<VotingSession> session = votingSessionService.getActiveOrFrozenSession()
                .filter(open -> open.getId().equals(progress.getVotingSessionId()));
        if (session.isEmpty()) {
            return;
        }
        votingSessionService.getSessionOptions(session.get().getId()).stream()
                .filter(option -> option.getNodeId().equals(progress.getNodeId()))
                .findFirst()
                .ifPresent(option -> votingSessionService.endVotingSession(session.get().getId(), option.getId()));
    }

    private void handlePostUnlockTransition(ProgressionNode unlockedNode) {
        UnlockProgress successor = unlockProgressService.ensureActiveUnlockProgress();
        if (successor.hasTarget()) {
            return;
        }
        Optional<NextTarget> next = resolveNextTarget(unlockedNode);
        if (next.isEmpty()) {
            log.info("All nodes unlocked after {}", unlockedNode.getNodeKey());
            return;
        }

        NextTarget target = next.get();
        unlockProgressService.setUnlockTarget(successor.getId(), target.node().getId(), target.level(), target.sessionId());
        log.info("Next unlock target is {} level {} (after {})", target.node().getNodeKey(), target.level(), unlockedNode.getNodeKey());

        List<ProgressionNode> remaining = unlockGraphService.getAvailableUnlocks().stream()
                .filter(node -> !node.getId().equals(target.node().getId()))
                .toList();
        if (remaining.size() >= 2) {
            startVotingWithOptions(remaining);
        } else if (remaining.size() == 1) {
            log.info("Only {} remains after the next target, no voting needed", remaining.get(0).getNodeKey());
        }
    }

    /**
     * Open ballot winner first, then the winner of the latest completed ballot if it is still
     * available, then a random available node.
     */
    private Optional<NextTarget> resolveNextTarget(ProgressionNode unlockedNode) {
        Optional<VotingSession> open = votingSessionService.getActiveOrFrozenSession();
        if (open.isPresent()) {
            VotingSession session = open.get();
            if (session.getStatus() == VotingSessionStatus.FROZEN) {
                votingSessionService.resumeVotingSession(session.getId());
            }
            Optional<VotingOption> winner = closeWithWinner(session);
            if (winner.isPresent()) {
                log.info("Next target taken from voting session {}", session.getId());
                return Optional.of(new NextTarget(requireNode(winner.get().getNodeId()), winner.get().getTargetLevel(), session.getId()));
            }
        }

        List<ProgressionNode> available = unlockGraphService.getAvailableUnlocks();
        Optional<NextTarget> fromLastBallot = votingSessionService.getMostRecentSession()
                .filter(session -> session.getStatus() == VotingSessionStatus.COMPLETED && session.getWinningOptionId() != null)
                .flatMap(session -> votingSessionService.getSessionOptions(session.getId()).stream()
                        .filter(option -> option.getId().equals(session.getWinningOptionId()))
                        .findFirst()
                        .flatMap(option -> available.stream()
                                .filter(node -> node.getId().equals(option.getNodeId()))
                                .filter(node -> !node.getId().equals(unlockedNode.getId()))
                                .filter(node -> unlockGraphService.calculateNextTargetLevel(node) == option.getTargetLevel())
                                .findFirst()
                                .map(node -> new NextTarget(node, option.getTargetLevel(), session.getId()))));
        if (fromLastBallot.isPresent()) {
            log.info("Next target taken from completed voting session {}", fromLastBallot.get().sessionId());
            return fromLastBallot;
        }

        if (available.isEmpty()) {
            return Optional.empty();
        }
        ProgressionNode node = available.get(random.nextInt(available.size()));
        log.info("No ballot winner, picked random next target {}", node.getNodeKey());
        return Optional.of(new NextTarget(node, unlockGraphService.calculateNextTargetLevel(node), null));
    }

    private Boolean endExpiredSession(Integer sessionId) {
        Optional<VotingSession> session = votingSessionService.getActiveSession()
                .filter(active -> active.getId().equals(sessionId));
        if (session.isEmpty()) {
            return false;
        }
        Optional<VotingOption> winner = closeWithWinner(session.get());
        winner.ifPresent(option -> assignTargetIfUnset(option, sessionId));
        log.info("Voting session {} reached its deadline (winningOptionId={})",
                sessionId, winner.map(VotingOption::getId).orElse(null));
        return true;
    }

    private Optional<VotingOption> closeWithWinner(VotingSession session) {
        List<VotingOption> options = votingSessionService.getSessionOptions(session.getId());
        Optional<VotingOption> winner = WinningOptionSelector.select(options, random);
        votingSessionService.endVotingSession(session.getId(), winner.map(VotingOption::getId).orElse(null));
        winner.ifPresent(option -> log.info("Voting session {} won by node {} level {} with {} votes",
                session.getId(), option.getNodeId(), option.getTargetLevel(), option.getVoteCount()));
        return winner;
    }

    private void assignTargetIfUnset(VotingOption winner, Integer sessionId) {
        UnlockProgress progress = unlockProgressService.ensureActiveUnlockProgress();
        if (!progress.hasTarget()) {
            unlockProgressService.setUnlockTarget(progress.getId(), winner.getNodeId(), winner.getTargetLevel(), sessionId);
        }
    }

    private boolean autoSelectTarget(UnlockProgress progress, ProgressionNode node) {
        int targetLevel = unlockGraphService.calculateNextTargetLevel(node);
        VotingSession session = votingSessionService.createVotingSession();
        VotingOption option = votingSessionService.addVotingOption(session.getId(), node.getId(), targetLevel);
        unlockProgressService.setUnlockTarget(progress.getId(), node.getId(), targetLevel, session.getId());
        votingSessionService.endVotingSession(session.getId(), option.getId());
        log.info("Only {} is available, auto-selected as target at level {}", node.getNodeKey(), targetLevel);
        return node.getUnlockCost() == 0;
    }

    private UnlockProgress setInitialTarget(List<ProgressionNode> available) {
        ProgressionNode node = available.get(random.nextInt(available.size()));
        UnlockProgress progress = unlockProgressService.ensureActiveUnlockProgress();
        int targetLevel = unlockGraphService.calculateNextTargetLevel(node);
        VotingSession session = votingSessionService.createVotingSession();
        VotingOption option = votingSessionService.addVotingOption(session.getId(), node.getId(), targetLevel);
        unlockProgressService.setUnlockTarget(progress.getId(), node.getId(), targetLevel, session.getId());
        votingSessionService.endVotingSession(session.getId(), option.getId());
        log.info("Initial unlock target set to {} level {}", node.getNodeKey(), targetLevel);
        return unlockProgressService.ensureActiveUnlockProgress();
    }

    private VotingSession startVotingWithOptions(List<ProgressionNode> candidates) {
        List<ProgressionNode> selected = new ArrayList<>(WinningOptionSelector.sample(
                candidates, progressionProperties.getVoting().getMaxOptions(), random));
        selected.sort(Comparator.comparing(ProgressionNode::getNodeKey));

        VotingSession session = votingSessionService.createVotingSession();
        for (ProgressionNode node : selected) {
            votingSessionService.addVotingOption(session.getId(), node.getId(), unlockGraphService.calculateNextTargetLevel(node));
        }
        log.info("Voting session {} opened with options {}", session.getId(),
                selected.stream().map(ProgressionNode::getNodeKey).collect(Collectors.joining(", ")));
        return session;
    }

    private List<ProgressionNode> candidatesExcludingTarget(UnlockProgress progress) {
        return unlockGraphService.getAvailableUnlocksWithFutureTarget().stream()
                .filter(node -> !node.getId().equals(progress.getNodeId()))
                .toList();
    }

    private SessionWithOptions withOptions(VotingSession session) {
        return new SessionWithOptions(session, votingSessionService.getSessionOptions(session.getId()));
    }

    private ProgressionNode requireNode(Integer nodeId) {
        return unlockGraphService.getNodeById(nodeId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Node not found: " + nodeId));
    }

    public record UnlockOutcome(
            ProgressionNode node,
            int level,
            String source,
            long engagementScore,
            int rollover
    ) {
    }

    public record SessionWithOptions(
            VotingSession session,
            List<VotingOption> options
    ) {
    }

    public record ProgressionStatus(
            long totalUnlocked,
            int totalNodes,
            boolean allNodesUnlocked,
            long contributionScore,
            SessionWithOptions activeSession,
            UnlockProgress activeUnlockProgress,
            OffsetDateTime estimatedUnlockAt,
            boolean transitioning
    ) {
    }

    private record NextTarget(
            ProgressionNode node,
            int level,
            Integer sessionId
    ) {
    }

}
