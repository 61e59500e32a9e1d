package com.brandish.progression.service;

import com.brandish.progression.config.ProgressionProperties;
import com.brandish.progression.model.ProgressionNode;
import com.brandish.progression.model.UnlockProgress;
import com.brandish.progression.model.VotingOption;
import com.brandish.progression.model.VotingSession;
import com.brandish.progression.model.VotingSessionStatus;
import com.brandish.progression.web.ProgressionConflictException;
import com.brandish.progression.web.ProgressionValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProgressionServiceTest {

    @Mock
    private UnlockGraphService unlockGraphService;

    @Mock
    private UnlockProgressService unlockProgressService;

    @Mock
    private VotingSessionService votingSessionService;

    @Mock
    private EngagementLedgerService engagementLedgerService;

    @Mock
    private EngagementAnalyticsService engagementAnalyticsService;

    @Mock
    private TransactionTemplate transactionTemplate;

    private ProgressionService progressionService;

    @BeforeEach
    void setUp() {
        lenient().when(transactionTemplate.execute(any()))
                .thenAnswer(invocation -> invocation.<TransactionCallback<?>>getArgument(0).doInTransaction(null));
        lenient().doAnswer(invocation -> {
            invocation.<Consumer<TransactionStatus>>getArgument(0).accept(null);
            return null;
        }).when(transactionTemplate).executeWithoutResult(any());

        progressionService = new ProgressionService(
                unlockGraphService,
                unlockProgressService,
                votingSessionService,
                engagementLedgerService,
                engagementAnalyticsService,
                new ProgressionProperties(),
                transactionTemplate
        );
    }

    @Test
    void recordVoteRejectsBlankUserAndNonPositiveIndexBeforeLookingUpSession() {
        assertThrows(ProgressionValidationException.class, () -> progressionService.recordVote(" ", 1));
        assertThrows(ProgressionValidationException.class, () -> progressionService.recordVote("user-1", 0));

        verify(votingSessionService, never()).getActiveSession();
    }

    @Test
    void recordVoteRejectsIndexBeyondOptionCount() {
        when(votingSessionService.getActiveSession()).thenReturn(Optional.of(session(5, VotingSessionStatus.VOTING)));
        when(votingSessionService.getSessionOptions(5)).thenReturn(List.of(option(11, 21, 0), option(12, 22, 0)));

        assertThrows(ProgressionValidationException.class, () -> progressionService.recordVote("user-1", 3));

        verify(votingSessionService, never()).checkAndRecordVoteAtomic(anyString(), anyInt(), anyInt(), anyInt());
    }

    @Test
    void recordVoteMapsOneBasedIndexAndCreditsVoteCast() {
        when(votingSessionService.getActiveSession()).thenReturn(Optional.of(session(5, VotingSessionStatus.VOTING)));
        when(votingSessionService.getSessionOptions(5)).thenReturn(List.of(option(11, 21, 0), option(12, 22, 0)));

        progressionService.recordVote("user-1", 2);

        verify(votingSessionService).checkAndRecordVoteAtomic("user-1", 5, 12, 22);
        verify(engagementLedgerService).recordEngagement(eq("user-1"), eq("vote_cast"), eq(1), isNull());
    }

    @Test
    void recordVoteKeepsTheVoteWhenEngagementCreditFails() {
        when(votingSessionService.getActiveSession()).thenReturn(Optional.of(session(5, VotingSessionStatus.VOTING)));
        when(votingSessionService.getSessionOptions(5)).thenReturn(List.of(option(11, 21, 0)));
        when(engagementLedgerService.recordEngagement(anyString(), anyString(), anyInt(), any()))
                .thenThrow(new IllegalStateException("ledger down"));

        progressionService.recordVote("user-1", 1);

        verify(votingSessionService).checkAndRecordVoteAtomic("user-1", 5, 11, 21);
    }

    @Test
    void recordVoteWithoutActiveSessionIsConflict() {
        when(votingSessionService.getActiveSession()).thenReturn(Optional.empty());

        ProgressionConflictException ex = assertThrows(ProgressionConflictException.class,
                () -> progressionService.recordVote("user-1", 1));

        assertEquals("no_active_session", ex.getCode());
    }

    @Test
    void endVotingWithoutActiveSessionIsConflict() {
        when(votingSessionService.getActiveSession()).thenReturn(Optional.empty());

        ProgressionConflictException ex = assertThrows(ProgressionConflictException.class,
                () -> progressionService.endVoting());

        assertEquals("no_active_session", ex.getCode());
    }

    @Test
    void endVotingAssignsWinnerAsTargetWhenNoneSet() {
        when(votingSessionService.getActiveSession()).thenReturn(Optional.of(session(5, VotingSessionStatus.VOTING)));
        when(votingSessionService.getSessionOptions(5)).thenReturn(List.of(option(11, 21, 3), option(12, 22, 1)));
        when(unlockProgressService.ensureActiveUnlockProgress()).thenReturn(progress(1, null, 0, null));

        Optional<VotingOption> winner = progressionService.endVoting();

        assertTrue(winner.isPresent());
        assertEquals(11, winner.get().getId());
        verify(votingSessionService).endVotingSession(5, 11);
        verify(unlockProgressService).setUnlockTarget(1, 21, 1, 5);
    }

    @Test
    void endVotingLeavesExistingTargetAlone() {
        when(votingSessionService.getActiveSession()).thenReturn(Optional.of(session(5, VotingSessionStatus.VOTING)));
        when(votingSessionService.getSessionOptions(5)).thenReturn(List.of(option(11, 21, 3)));
        when(unlockProgressService.ensureActiveUnlockProgress()).thenReturn(progress(1, 30, 0, null));

        progressionService.endVoting();

        verify(unlockProgressService, never()).setUnlockTarget(anyInt(), anyInt(), anyInt(), any());
    }

    @Test
    void freezeRejectsAlreadyFrozenSession() {
        when(votingSessionService.getActiveOrFrozenSession()).thenReturn(Optional.of(session(5, VotingSessionStatus.FROZEN)));

        ProgressionConflictException ex = assertThrows(ProgressionConflictException.class,
                () -> progressionService.adminFreezeVoting());

        assertEquals("session_already_frozen", ex.getCode());
        verify(votingSessionService, never()).freezeVotingSession(anyInt());
    }

    @Test
    void freezeWithoutSessionIsConflict() {
        when(votingSessionService.getActiveOrFrozenSession()).thenReturn(Optional.empty());

        ProgressionConflictException ex = assertThrows(ProgressionConflictException.class,
                () -> progressionService.adminFreezeVoting());

        assertEquals("no_active_session", ex.getCode());
    }

    @Test
    void startVotingRefusesWhileSessionOpen() {
        when(votingSessionService.getActiveOrFrozenSession()).thenReturn(Optional.of(session(5, VotingSessionStatus.FROZEN)));

        ProgressionConflictException ex = assertThrows(ProgressionConflictException.class,
                () -> progressionService.startVotingSession(null));

        assertEquals("session_already_active", ex.getCode());
        verify(votingSessionService, never()).createVotingSession();
    }

    @Test
    void startVotingCapsOptionsAtConfiguredMaximum() {
        when(unlockProgressService.ensureActiveUnlockProgress()).thenReturn(progress(1, 99, 0, null));
        when(unlockGraphService.getAvailableUnlocksWithFutureTarget()).thenReturn(List.of(
                node(1, "a", 100), node(2, "b", 100), node(3, "c", 100),
                node(4, "d", 100), node(5, "e", 100), node(6, "f", 100), node(99, "target", 100)));
        when(votingSessionService.createVotingSession()).thenReturn(session(8, VotingSessionStatus.VOTING));

        progressionService.startVotingSession(null);

        verify(votingSessionService, times(4)).addVotingOption(eq(8), anyInt(), anyInt());
        verify(votingSessionService, never()).addVotingOption(eq(8), eq(99), anyInt());
        verify(unlockProgressService, never()).setUnlockTarget(anyInt(), anyInt(), anyInt(), any());
    }

    @Test
    void startVotingAutoSelectsSingleCandidateWhenNoTarget() {
        ProgressionNode only = node(7, "only", 500);
        VotingOption option = option(31, 7, 0);
        when(unlockProgressService.ensureActiveUnlockProgress()).thenReturn(progress(1, null, 0, null));
        when(unlockGraphService.getAvailableUnlocksWithFutureTarget()).thenReturn(List.of(only));
        when(unlockGraphService.calculateNextTargetLevel(only)).thenReturn(1);
        when(votingSessionService.createVotingSession()).thenReturn(session(8, VotingSessionStatus.VOTING));
        when(votingSessionService.addVotingOption(8, 7, 1)).thenReturn(option);

        progressionService.startVotingSession(null);

        verify(unlockProgressService).setUnlockTarget(1, 7, 1, 8);
        verify(votingSessionService).endVotingSession(8, 31);
        verify(unlockProgressService, never()).lockActiveUnlockProgress();
    }

    @Test
    void checkAndUnlockWaitsBelowCost() {
        when(unlockProgressService.lockActiveUnlockProgress()).thenReturn(Optional.of(progress(1, 21, 999, null)));
        when(unlockGraphService.getNodeById(21)).thenReturn(Optional.of(node(21, "alpha", 1000)));

        Optional<ProgressionService.UnlockOutcome> outcome = progressionService.checkAndUnlockNode();

        assertFalse(outcome.isPresent());
        verify(unlockGraphService, never()).unlockNode(anyInt(), anyInt(), anyString(), anyLong());
    }

    @Test
    void checkAndUnlockCapsRolloverAndPicksNextTarget() {
        ProgressionNode alpha = node(21, "alpha", 1000);
        ProgressionNode beta = node(22, "beta", 500);
        when(unlockProgressService.lockActiveUnlockProgress()).thenReturn(Optional.of(progress(1, 21, 1300, null)));
        when(unlockGraphService.getNodeById(21)).thenReturn(Optional.of(alpha));
        when(unlockProgressService.ensureActiveUnlockProgress()).thenReturn(progress(2, null, 200, null));
        when(votingSessionService.getActiveOrFrozenSession()).thenReturn(Optional.empty());
        when(votingSessionService.getMostRecentSession()).thenReturn(Optional.empty());
        when(unlockGraphService.getAvailableUnlocks()).thenReturn(List.of(beta));
        when(unlockGraphService.calculateNextTargetLevel(beta)).thenReturn(1);

        ProgressionService.UnlockOutcome outcome = progressionService.checkAndUnlockNode().orElseThrow();

        assertEquals(200, outcome.rollover());
        assertEquals("vote", outcome.source());
        assertEquals(1300L, outcome.engagementScore());
        verify(unlockGraphService).unlockNode(21, 1, "vote", 1300L);
        verify(unlockProgressService).completeUnlock(1, 200);
        verify(unlockProgressService).setUnlockTarget(2, 22, 1, null);
        verify(votingSessionService, never()).createVotingSession();
    }

    @Test
    void checkAndUnlockCarriesSmallSurplusInFull() {
        when(unlockProgressService.lockActiveUnlockProgress()).thenReturn(Optional.of(progress(1, 21, 1050, null)));
        when(unlockGraphService.getNodeById(21)).thenReturn(Optional.of(node(21, "alpha", 1000)));
        when(unlockProgressService.ensureActiveUnlockProgress()).thenReturn(progress(2, 40, 50, null));

        ProgressionService.UnlockOutcome outcome = progressionService.checkAndUnlockNode().orElseThrow();

        assertEquals(50, outcome.rollover());
        verify(unlockProgressService).completeUnlock(1, 50);
    }

    @Test
    void statusReportsTransitioningWithoutSessionOrTarget() {
        ProgressionNode alpha = node(21, "alpha", 1000);
        when(unlockGraphService.getAllNodes()).thenReturn(List.of(alpha));
        when(unlockGraphService.getUnlockedLevels()).thenReturn(Map.of());
        when(unlockGraphService.countUnlockRows()).thenReturn(0L);
        when(votingSessionService.getActiveSession()).thenReturn(Optional.empty());
        when(votingSessionService.getActiveOrFrozenSession()).thenReturn(Optional.empty());
        when(unlockProgressService.getActiveUnlockProgress()).thenReturn(Optional.of(progress(1, null, 0, null)));
        when(engagementLedgerService.getEngagementScore(null)).thenReturn(42L);

        ProgressionService.ProgressionStatus status = progressionService.getProgressionStatus();

        assertTrue(status.transitioning());
        assertFalse(status.allNodesUnlocked());
        assertEquals(42L, status.contributionScore());
        assertEquals(1, status.totalNodes());
    }

    private static VotingSession session(int id, VotingSessionStatus status) {
        VotingSession session = new VotingSession();
        session.setId(id);
        session.setStatus(status);
        return session;
    }

    private static VotingOption option(int id, int nodeId, int votes) {
        VotingOption option = new VotingOption();
        option.setId(id);
        option.setSessionId(5);
        option.setNodeId(nodeId);
        option.setTargetLevel(1);
        option.setVoteCount(votes);
        return option;
    }

    private static UnlockProgress progress(int id, Integer nodeId, int contributions, Integer sessionId) {
        UnlockProgress progress = new UnlockProgress();
        progress.setId(id);
        progress.setNodeId(nodeId);
        progress.setTargetLevel(nodeId == null ? null : 1);
        progress.setContributionsAccumulated(contributions);
        progress.setVotingSessionId(sessionId);
        return progress;
    }

    private static ProgressionNode node(int id, String key, int cost) {
        ProgressionNode node = new ProgressionNode();
        node.setId(id);
        node.setNodeKey(key);
        node.setDisplayName(key);
        node.setUnlockCost(cost);
        return node;
    }
}
