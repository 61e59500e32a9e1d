package com.brandish.progression.controller;

import com.brandish.progression.dto.ProgressionRequests;
import com.brandish.progression.dto.ProgressionResponses;
import com.brandish.progression.mapper.ProgressionResponseMapper;
import com.brandish.progression.model.ProgressionNode;
import com.brandish.progression.service.ModifierService;
import com.brandish.progression.service.ProgressionService;
import com.brandish.progression.service.UnlockGraphService;
import com.brandish.progression.service.VotingSessionService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/progression")
public class ProgressionController {

    private final UnlockGraphService unlockGraphService;
    private final ProgressionService progressionService;
    private final VotingSessionService votingSessionService;
    private final ModifierService modifierService;
    private final ProgressionResponseMapper progressionResponseMapper;

    public ProgressionController(
            UnlockGraphService unlockGraphService,
            ProgressionService progressionService,
            VotingSessionService votingSessionService,
            ModifierService modifierService,
            ProgressionResponseMapper progressionResponseMapper
    ) {
        this.unlockGraphService = unlockGraphService;
        this.progressionService = progressionService;
        this.votingSessionService = votingSessionService;
        this.modifierService = modifierService;
        this.progressionResponseMapper = progressionResponseMapper;
    }

    @GetMapping("/tree")
    public ResponseEntity<List<ProgressionResponses.TreeNode>> getTree() {
        return ResponseEntity.ok(progressionResponseMapper.toTreeResponses(unlockGraphService.getProgressionTree()));
    }

    @GetMapping("/available")
    public ResponseEntity<List<ProgressionResponses.Node>> getAvailableUnlocks() {
        return ResponseEntity.ok(progressionResponseMapper.toNodeResponses(unlockGraphService.getAvailableUnlocks()));
    }

    @GetMapping("/status")
    public ResponseEntity<ProgressionResponses.ProgressionStatus> getStatus() {
        return ResponseEntity.ok(progressionResponseMapper.toStatusResponse(
                progressionService.getProgressionStatus(), nodesById()));
    }

    @GetMapping("/nodes/{nodeKey}")
    public ResponseEntity<ProgressionResponses.Node> getNode(@PathVariable String nodeKey) {
        return ResponseEntity.ok(progressionResponseMapper.toNodeResponse(unlockGraphService.requireNodeByKey(nodeKey)));
    }

    @GetMapping("/nodes/{nodeKey}/required")
    public ResponseEntity<List<ProgressionResponses.Node>> getRequiredNodes(@PathVariable String nodeKey) {
        return ResponseEntity.ok(progressionResponseMapper.toNodeResponses(unlockGraphService.getRequiredNodes(nodeKey)));
    }

    @GetMapping("/features/{featureKey}/unlocked")
    public ResponseEntity<ProgressionResponses.FeatureUnlocked> isFeatureUnlocked(@PathVariable String featureKey) {
        return ResponseEntity.ok(new ProgressionResponses.FeatureUnlocked(
                featureKey, unlockGraphService.isFeatureUnlocked(featureKey)));
    }

    @GetMapping("/modifiers/{featureKey}")
    public ResponseEntity<ProgressionResponses.ModifiedValue> getModifiedValue(
            @PathVariable String featureKey,
            @RequestParam double base
    ) {
        return ResponseEntity.ok(new ProgressionResponses.ModifiedValue(
                featureKey, base, modifierService.getModifiedValue(featureKey, base)));
    }

    /**
     * The open session when there is one, otherwise the most recent closed one.
     */
    @GetMapping("/session")
    public ResponseEntity<ProgressionResponses.VotingSession> getSession() {
        Optional<ProgressionService.SessionWithOptions> session = progressionService.getActiveOrFrozenSession()
                .or(progressionService::getMostRecentSession);
        return session
                .map(found -> ResponseEntity.ok(progressionResponseMapper.toSessionResponse(found, nodesById())))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/sessions/{sessionId}/voters")
    public ResponseEntity<List<String>> getSessionVoters(@PathVariable Integer sessionId) {
        return ResponseEntity.ok(votingSessionService.getSessionVoters(sessionId));
    }

    @PostMapping("/vote")
    public ResponseEntity<Void> vote(@Valid @RequestBody ProgressionRequests.VoteRequest request) {
        progressionService.recordVote(request.userId(), request.optionIndex());
        return ResponseEntity.noContent().build();
    }

    private Map<Integer, ProgressionNode> nodesById() {
        return unlockGraphService.getAllNodes().stream()
                .collect(Collectors.toMap(ProgressionNode::getId, Function.identity()));
    }
}
