package com.brandish.progression.service;

import com.brandish.progression.model.ProgressionNode;
import com.brandish.progression.model.ProgressionReset;
import com.brandish.progression.tree.ProgressionTreeLoader;
import com.brandish.progression.tree.TreeSyncResult;
import com.brandish.progression.web.ProgressionConflictException;
import com.brandish.progression.web.ProgressionValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProgressionAdminServiceTest {

    @Mock
    private UnlockGraphService unlockGraphService;

    @Mock
    private EngagementLedgerService engagementLedgerService;

    @Mock
    private EngagementWeightService engagementWeightService;

    @Mock
    private ModifierService modifierService;

    @Mock
    private ProgressionResetService progressionResetService;

    @Mock
    private ProgressionService progressionService;

    @Mock
    private ProgressionTreeLoader progressionTreeLoader;

    @InjectMocks
    private ProgressionAdminService progressionAdminService;

    @Test
    void adminUnlockRecordsCurrentEngagementScore() {
        when(unlockGraphService.requireNodeByKey("feature_crafting")).thenReturn(node(4, "feature_crafting", 3));
        when(engagementLedgerService.getEngagementScore(null)).thenReturn(4200L);
        when(unlockGraphService.unlockNode(4, 2, ProgressionAdminService.SOURCE_ADMIN, 4200L)).thenReturn(true);

        assertTrue(progressionAdminService.adminUnlock("feature_crafting", 2));
    }

    @Test
    void adminUnlockRejectsLevelsOutsideTheNode() {
        assertThrows(ProgressionValidationException.class, () -> progressionAdminService.adminUnlock("feature_crafting", 0));

        when(unlockGraphService.requireNodeByKey("feature_crafting")).thenReturn(node(4, "feature_crafting", 3));
        ProgressionConflictException ex = assertThrows(ProgressionConflictException.class,
                () -> progressionAdminService.adminUnlock("feature_crafting", 4));
        assertEquals("max_level_exceeded", ex.getCode());
        verify(unlockGraphService, never()).unlockNode(anyInt(), anyInt(), anyString(), anyLong());
    }

    @Test
    void adminUnlockAllContinuesPastFailures() {
        ProgressionNode economy = node(1, "feature_economy", 1);
        ProgressionNode crafting = node(2, "feature_crafting", 3);
        when(unlockGraphService.getAllNodes()).thenReturn(List.of(economy, crafting));
        when(unlockGraphService.requireNodeByKey("feature_economy")).thenReturn(economy);
        when(unlockGraphService.requireNodeByKey("feature_crafting")).thenReturn(crafting);
        when(engagementLedgerService.getEngagementScore(null)).thenReturn(0L);
        when(unlockGraphService.unlockNode(1, 1, ProgressionAdminService.SOURCE_ADMIN, 0L))
                .thenThrow(new IllegalStateException("constraint"));
        when(unlockGraphService.unlockNode(2, 3, ProgressionAdminService.SOURCE_ADMIN, 0L)).thenReturn(true);

        assertEquals(1, progressionAdminService.adminUnlockAll());
    }

    @Test
    void adminRelockRejectsNegativeLevel() {
        assertThrows(ProgressionValidationException.class, () -> progressionAdminService.adminRelock("feature_crafting", -1));
    }

    @Test
    void resetInvalidatesModifiersThenReinitializes() {
        ProgressionReset reset = new ProgressionReset();
        reset.setId(9);
        when(progressionResetService.resetTree("ops", "season end", true)).thenReturn(reset);

        assertSame(reset, progressionAdminService.resetTree("ops", "season end", true));

        InOrder order = inOrder(progressionResetService, modifierService, progressionService);
        order.verify(progressionResetService).resetTree("ops", "season end", true);
        order.verify(modifierService).invalidateAll();
        order.verify(progressionService).initializeProgressionState();
    }

    @Test
    void resetSucceedsEvenWhenReinitializationFails() {
        ProgressionReset reset = new ProgressionReset();
        when(progressionResetService.resetTree("ops", null, false)).thenReturn(reset);
        doThrow(new IllegalStateException("no nodes")).when(progressionService).initializeProgressionState();

        assertSame(reset, progressionAdminService.resetTree("ops", null, false));
    }

    @Test
    void syncTreeForcesSyncAndReinitializesWhenNodesWereAdded() {
        when(progressionTreeLoader.sync(true)).thenReturn(new TreeSyncResult(2, 0, 7, 0, false));

        progressionAdminService.syncTree();

        verify(progressionService).initializeProgressionState();
    }

    private static ProgressionNode node(int id, String key, int maxLevel) {
        ProgressionNode node = new ProgressionNode();
        node.setId(id);
        node.setNodeKey(key);
        node.setMaxLevel(maxLevel);
        return node;
    }
}
