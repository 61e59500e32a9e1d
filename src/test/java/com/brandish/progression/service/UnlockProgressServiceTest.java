package com.brandish.progression.service;

import com.brandish.progression.model.UnlockProgress;
import com.brandish.progression.repository.UnlockProgressRepository;
import com.brandish.progression.web.ProgressionConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UnlockProgressServiceTest {

    @Mock
    private UnlockProgressRepository unlockProgressRepository;

    private UnlockProgressService unlockProgressService;

    @BeforeEach
    void setUp() {
        unlockProgressService = new UnlockProgressService(unlockProgressRepository);
    }

    @Test
    void completeClosesCycleThenSeedsSuccessorWithRollover() {
        UnlockProgress successor = progress(8, 120);
        when(unlockProgressRepository.markCompleted(eq(7), any(OffsetDateTime.class))).thenReturn(1);
        when(unlockProgressRepository.insertActiveIfAbsent(120)).thenReturn(1);
        when(unlockProgressRepository.findFirstByUnlockedAtIsNullOrderByStartedAtDescIdDesc()).thenReturn(Optional.of(successor));

        UnlockProgress next = unlockProgressService.completeUnlock(7, 120);

        assertEquals(120, next.getContributionsAccumulated());
        InOrder order = inOrder(unlockProgressRepository);
        order.verify(unlockProgressRepository).markCompleted(eq(7), any(OffsetDateTime.class));
        order.verify(unlockProgressRepository).insertActiveIfAbsent(120);
    }

    @Test
    void completingTwiceIsAConflict() {
        when(unlockProgressRepository.markCompleted(eq(7), any(OffsetDateTime.class))).thenReturn(0);

        ProgressionConflictException ex = assertThrows(ProgressionConflictException.class,
                () -> unlockProgressService.completeUnlock(7, 0));

        assertEquals("invalid_transition", ex.getCode());
        verify(unlockProgressRepository, never()).insertActiveIfAbsent(anyInt());
    }

    @Test
    void negativeRolloverIsRejectedBeforeAnyWrite() {
        assertThrows(IllegalArgumentException.class, () -> unlockProgressService.completeUnlock(7, -1));

        verify(unlockProgressRepository, never()).markCompleted(any(), any());
    }

    @Test
    void contributionToCompletedCycleReportsFalse() {
        when(unlockProgressRepository.addContribution(7, 25)).thenReturn(0);

        assertFalse(unlockProgressService.addContribution(7, 25));
    }

    @Test
    void settingTargetOnMissingCycleFails() {
        when(unlockProgressRepository.setTarget(9, 2, 1, 3)).thenReturn(0);

        assertThrows(IllegalStateException.class, () -> unlockProgressService.setUnlockTarget(9, 2, 1, 3));
    }

    @Test
    void ensureReusesTheActiveCycle() {
        UnlockProgress active = progress(4, 40);
        when(unlockProgressRepository.findFirstByUnlockedAtIsNullOrderByStartedAtDescIdDesc()).thenReturn(Optional.of(active));

        assertSame(active, unlockProgressService.ensureActiveUnlockProgress());
        verify(unlockProgressRepository, never()).insertActiveIfAbsent(anyInt());
    }

    private static UnlockProgress progress(int id, int contributions) {
        UnlockProgress progress = new UnlockProgress();
        progress.setId(id);
        progress.setContributionsAccumulated(contributions);
        return progress;
    }
}
