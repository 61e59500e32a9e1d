package com.brandish.progression.service;

import com.brandish.progression.event.ProgressionEvent;
import com.brandish.progression.event.ProgressionEventPublisher;
import com.brandish.progression.model.DynamicPrerequisite;
import com.brandish.progression.model.DynamicPrerequisiteJsonCodec;
import com.brandish.progression.model.ProgressionNode;
import com.brandish.progression.model.ProgressionPrerequisite;
import com.brandish.progression.repository.NodeLevelRow;
import com.brandish.progression.repository.ProgressionNodeRepository;
import com.brandish.progression.repository.ProgressionPrerequisiteRepository;
import com.brandish.progression.repository.ProgressionUnlockRepository;
import com.brandish.progression.tree.TreeConfigException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UnlockGraphServiceTest {

    @Mock
    private ProgressionNodeRepository progressionNodeRepository;

    @Mock
    private ProgressionPrerequisiteRepository progressionPrerequisiteRepository;

    @Mock
    private ProgressionUnlockRepository progressionUnlockRepository;

    @Mock
    private UnlockProgressService unlockProgressService;

    @Mock
    private ProgressionEventPublisher progressionEventPublisher;

    @Captor
    private ArgumentCaptor<List<ProgressionPrerequisite>> rowsCaptor;

    private UnlockGraphService unlockGraphService;

    @BeforeEach
    void setUp() {
        unlockGraphService = new UnlockGraphService(
                progressionNodeRepository,
                progressionPrerequisiteRepository,
                progressionUnlockRepository,
                unlockProgressService,
                progressionEventPublisher
        );
    }

    @Test
    void syncRejectsSelfEdge() {
        TreeConfigException ex = assertThrows(TreeConfigException.class,
                () -> unlockGraphService.syncPrerequisites(1, List.of(1)));

        assertEquals(TreeConfigException.Kind.CYCLE_DETECTED, ex.getKind());
        assertEdgesUntouched();
    }

    @Test
    void syncRejectsTwoNodeCycle() {
        when(progressionPrerequisiteRepository.findAll()).thenReturn(List.of(edge(2, 1)));

        TreeConfigException ex = assertThrows(TreeConfigException.class,
                () -> unlockGraphService.syncPrerequisites(1, List.of(2)));

        assertEquals(TreeConfigException.Kind.CYCLE_DETECTED, ex.getKind());
        assertEdgesUntouched();
    }

    @Test
    void syncRejectsCycleThroughExistingEdges() {
        when(progressionPrerequisiteRepository.findAll()).thenReturn(List.of(edge(2, 1), edge(3, 2), edge(4, 3)));

        TreeConfigException ex = assertThrows(TreeConfigException.class,
                () -> unlockGraphService.syncPrerequisites(1, List.of(4)));

        assertEquals(TreeConfigException.Kind.CYCLE_DETECTED, ex.getKind());
        assertEdgesUntouched();
    }

    @Test
    void syncReplacesEdgesOfAcyclicGraph() {
        // the existing 3 -> 4 edge is replaced, not merged
        when(progressionPrerequisiteRepository.findAll()).thenReturn(List.of(edge(2, 1), edge(3, 4), edge(4, 1)));

        unlockGraphService.syncPrerequisites(3, List.of(1, 2, 2));

        verify(progressionPrerequisiteRepository).deleteByNodeId(3);
        verify(progressionPrerequisiteRepository).saveAll(rowsCaptor.capture());
        List<ProgressionPrerequisite> rows = rowsCaptor.getValue();
        assertEquals(2, rows.size());
        assertTrue(rows.stream().allMatch(row -> row.getNodeId().equals(3)));
        assertEquals(List.of(1, 2), rows.stream().map(ProgressionPrerequisite::getPrerequisiteNodeId).toList());
    }

    @Test
    void availableUnlocksHonorStaticAndDynamicPrerequisites() {
        ProgressionNode root = node(1, "progression_system", 0);
        ProgressionNode economy = node(2, "feature_economy", 1);
        ProgressionNode belowTier = node(3, "feature_market", 2);
        belowTier.setDynamicPrerequisites(DynamicPrerequisiteJsonCodec.toJson(
                List.of(DynamicPrerequisite.nodesUnlockedBelowTier(2, 2))));
        ProgressionNode total = node(4, "feature_guilds", 2);
        total.setDynamicPrerequisites(DynamicPrerequisiteJsonCodec.toJson(
                List.of(DynamicPrerequisite.totalNodesUnlocked(3))));
        ProgressionNode blocked = node(5, "item_lootbox", 3);
        when(progressionNodeRepository.findAllByOrderByTierAscSortOrderAscIdAsc())
                .thenReturn(List.of(root, economy, belowTier, total, blocked));
        when(progressionPrerequisiteRepository.findAll()).thenReturn(List.of(edge(2, 1), edge(5, 4)));
        when(progressionUnlockRepository.findUnlockedLevels()).thenReturn(List.of(level(1, 1), level(2, 1)));
        when(progressionUnlockRepository.countUnlockedNodesBelowTier(2)).thenReturn(2L);
        when(progressionUnlockRepository.countUnlockedNodes()).thenReturn(2L);

        List<ProgressionNode> available = unlockGraphService.getAvailableUnlocks();

        assertEquals(List.of("feature_market"), available.stream().map(ProgressionNode::getNodeKey).toList());
    }

    @Test
    void duplicateUnlockIsIgnoredWithoutEvent() {
        when(progressionNodeRepository.findById(2)).thenReturn(Optional.of(node(2, "feature_economy", 1)));
        when(progressionUnlockRepository.insertIfAbsent(2, 1, "vote", 40L)).thenReturn(0);

        assertFalse(unlockGraphService.unlockNode(2, 1, "vote", 40L));

        verify(progressionEventPublisher, never()).publish(any());
    }

    @Test
    void unlockPublishesNodeUnlocked() {
        when(progressionNodeRepository.findById(2)).thenReturn(Optional.of(node(2, "feature_economy", 1)));
        when(progressionUnlockRepository.insertIfAbsent(2, 1, "vote", 40L)).thenReturn(1);

        assertTrue(unlockGraphService.unlockNode(2, 1, "vote", 40L));

        verify(progressionEventPublisher).publish(argThat(event ->
                ProgressionEvent.NODE_UNLOCKED.equals(event.type())
                        && "feature_economy".equals(event.nodeKey())
                        && event.level() == 1));
    }

    @Test
    void relockOfLockedNodeRemovesNothingAndPublishesNothing() {
        when(progressionNodeRepository.findById(2)).thenReturn(Optional.of(node(2, "feature_economy", 1)));
        when(progressionUnlockRepository.deleteByNodeIdAndLevel(2, 0)).thenReturn(0);

        assertEquals(0, unlockGraphService.relockNode(2, 0));

        verify(progressionEventPublisher, never()).publish(any());
    }

    @Test
    void relockCleanupFailureIsLoggedNotThrown() {
        when(unlockProgressService.clearProgressForNode(2)).thenThrow(new IllegalStateException("db down"));

        unlockGraphService.onNodeRelocked(ProgressionEvent.nodeRelocked(2, "feature_economy", 0));

        verify(unlockProgressService).clearProgressForNode(2);
    }

    @Test
    void unlockEventsDoNotClearProgress() {
        unlockGraphService.onNodeRelocked(ProgressionEvent.nodeUnlocked(2, "feature_economy", 1, "vote"));

        verify(unlockProgressService, never()).clearProgressForNode(anyInt());
    }

    private void assertEdgesUntouched() {
        verify(progressionPrerequisiteRepository, never()).deleteByNodeId(anyInt());
        verify(progressionPrerequisiteRepository, never()).saveAll(any());
    }

    private static ProgressionPrerequisite edge(int nodeId, int prerequisiteNodeId) {
        return new ProgressionPrerequisite(nodeId, prerequisiteNodeId);
    }

    private static ProgressionNode node(int id, String key, int tier) {
        ProgressionNode node = new ProgressionNode();
        node.setId(id);
        node.setNodeKey(key);
        node.setTier(tier);
        node.setMaxLevel(1);
        return node;
    }

    private static NodeLevelRow level(int nodeId, int level) {
        return new NodeLevelRow() {
            @Override
            public Integer getNodeId() {
                return nodeId;
            }

            @Override
            public Integer getLevel() {
                return level;
            }
        };
    }
}
