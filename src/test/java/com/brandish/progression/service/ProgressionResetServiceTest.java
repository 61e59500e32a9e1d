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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProgressionResetServiceTest {

    @Mock
    private ProgressionResetRepository progressionResetRepository;

    @Mock
    private ProgressionUnlockRepository progressionUnlockRepository;

    @Mock
    private EngagementMetricRepository engagementMetricRepository;

    @Mock
    private UserSessionVoteRepository userSessionVoteRepository;

    @Mock
    private UnlockProgressRepository unlockProgressRepository;

    @Mock
    private VotingSessionRepository votingSessionRepository;

    @Mock
    private VotingOptionRepository votingOptionRepository;

    @Mock
    private UserProgressionRepository userProgressionRepository;

    private ProgressionResetService progressionResetService;

    @BeforeEach
    void setUp() {
        progressionResetService = new ProgressionResetService(
                progressionResetRepository,
                progressionUnlockRepository,
                engagementMetricRepository,
                userSessionVoteRepository,
                unlockProgressRepository,
                votingSessionRepository,
                votingOptionRepository,
                userProgressionRepository,
                new ProgressionProperties()
        );
    }

    @Test
    void resetWritesAuditThenClearsInForeignKeyOrderKeepingRoot() {
        when(progressionUnlockRepository.count()).thenReturn(4L);
        when(engagementMetricRepository.sumAllMetricValues()).thenReturn(900L);
        when(progressionResetRepository.saveAndFlush(any(ProgressionReset.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(progressionUnlockRepository.deleteAllExceptNode("progression_system")).thenReturn(3);

        ProgressionReset audit = progressionResetService.resetTree("ops", "season rollover", true);

        assertEquals("ops", audit.getResetBy());
        assertEquals("season rollover", audit.getReason());
        assertEquals(4, audit.getNodesResetCount());
        assertEquals(900L, audit.getEngagementScoreAtReset());

        InOrder order = inOrder(progressionResetRepository, userSessionVoteRepository, unlockProgressRepository,
                votingSessionRepository, votingOptionRepository, progressionUnlockRepository);
        order.verify(progressionResetRepository).saveAndFlush(audit);
        order.verify(userSessionVoteRepository).deleteAllInBatch();
        order.verify(unlockProgressRepository).deleteAllInBatch();
        order.verify(votingSessionRepository).clearWinningOptions();
        order.verify(votingOptionRepository).deleteAllInBatch();
        order.verify(votingSessionRepository).deleteAllInBatch();
        order.verify(progressionUnlockRepository).deleteAllExceptNode("progression_system");
        order.verify(progressionResetRepository).deleteLegacyVoting();
        verify(userProgressionRepository, never()).deleteAllInBatch();
    }

    @Test
    void resetWithoutPreserveAlsoClearsUserProgression() {
        when(progressionResetRepository.saveAndFlush(any(ProgressionReset.class))).thenAnswer(invocation -> invocation.getArgument(0));

        progressionResetService.resetTree("ops", null, false);

        verify(userProgressionRepository).deleteAllInBatch();
    }

    @Test
    void resetRequiresActor() {
        assertThrows(ProgressionValidationException.class, () -> progressionResetService.resetTree(" ", "why", true));

        verify(progressionResetRepository, never()).saveAndFlush(any());
        verify(userSessionVoteRepository, never()).deleteAllInBatch();
    }
}
