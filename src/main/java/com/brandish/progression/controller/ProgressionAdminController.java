package com.brandish.progression.controller;

import com.brandish.progression.dto.ProgressionRequests;
import com.brandish.progression.dto.ProgressionResponses;
import com.brandish.progression.mapper.ProgressionResponseMapper;
import com.brandish.progression.model.ProgressionNode;
import com.brandish.progression.model.ProgressionReset;
import com.brandish.progression.model.VotingOption;
import com.brandish.progression.model.VotingSession;
import com.brandish.progression.service.ProgressionAdminService;
import com.brandish.progression.service.ProgressionResetService;
import com.brandish.progression.service.ProgressionService;
import com.brandish.progression.service.UnlockGraphService;
import com.brandish.progression.service.VotingSessionService;
import com.brandish.progression.tree.TreeSyncResult;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Operator endpoints. Authorization is enforced in front of the service.
 */
@RestController
@RequestMapping("/api/progression/admin")
public class ProgressionAdminController {

    private final ProgressionAdminService progressionAdminService;
    private final ProgressionResetService progressionResetService;
    private final ProgressionService progressionService;
    private final VotingSessionService votingSessionService;
    private final UnlockGraphService unlockGraphService;
    private final ProgressionResponseMapper progressionResponseMapper;

    public ProgressionAdminController(
            ProgressionAdminService progressionAdminService,
            ProgressionResetService progressionResetService,
            ProgressionService progressionService,
            VotingSessionService votingSessionService,
            UnlockGraphService unlockGraphService,
            ProgressionResponseMapper progressionResponseMapper
    ) {
        this.progressionAdminService = progressionAdminService;
        this.progressionResetService = progressionResetService;
        this.progressionService = progressionService;
        this.votingSessionService = votingSessionService;
        this.unlockGraphService = unlockGraphService;
        this.progressionResponseMapper = progressionResponseMapper;
    }

    @PostMapping("/unlock")
    public ResponseEntity<ProgressionResponses.AdminUnlock> unlock(
            @Valid @RequestBody ProgressionRequests.AdminUnlockRequest request
    ) {
        boolean unlocked = progressionAdminService.adminUnlock(request.nodeKey(), request.level());
        return ResponseEntity.ok(new ProgressionResponses.AdminUnlock(request.nodeKey(), request.level(), unlocked));
    }

    @PostMapping("/unlock-all")
    public ResponseEntity<ProgressionResponses.AdminUnlockAll> unlockAll() {
        return ResponseEntity.ok(new ProgressionResponses.AdminUnlockAll(progressionAdminService.adminUnlockAll()));
    }

    @PostMapping("/relock")
    public ResponseEntity<ProgressionResponses.AdminRelock> relock(
            @Valid @RequestBody ProgressionRequests.AdminRelockRequest request
    ) {
        int removed = progressionAdminService.adminRelock(request.nodeKey(), request.level());
        return ResponseEntity.ok(new ProgressionResponses.AdminRelock(request.nodeKey(), request.level(), removed));
    }

    @PostMapping("/reset")
    public ResponseEntity<ProgressionResponses.Reset> reset(@Valid @RequestBody ProgressionRequests.ResetRequest request) {
        ProgressionReset reset = progressionAdminService.resetTree(
                request.resetBy(), request.reason(), request.preserveUserData());
        return ResponseEntity.ok(progressionResponseMapper.toResetResponse(reset));
    }

    @GetMapping("/resets")
    public ResponseEntity<List<ProgressionResponses.Reset>> getResetHistory() {
        return ResponseEntity.ok(progressionResetService.getResetHistory().stream()
                .map(progressionResponseMapper::toResetResponse)
                .toList());
    }

    @PostMapping("/freeze")
    public ResponseEntity<ProgressionResponses.VotingSession> freeze() {
        VotingSession frozen = progressionService.adminFreezeVoting();
        return ResponseEntity.ok(progressionResponseMapper.toSessionResponse(
                new ProgressionService.SessionWithOptions(frozen, votingSessionService.getSessionOptions(frozen.getId())),
                nodesById()
        ));
    }

    @PostMapping("/start-voting")
    public ResponseEntity<ProgressionResponses.VotingSession> startVoting() {
        progressionService.adminStartVoting();
        Optional<ProgressionService.SessionWithOptions> session = progressionService.getActiveOrFrozenSession();
        return session
                .map(found -> ResponseEntity.ok(progressionResponseMapper.toSessionResponse(found, nodesById())))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/end-voting")
    public ResponseEntity<ProgressionResponses.VotingOption> endVoting() {
        Optional<VotingOption> winner = progressionService.endVoting();
        return winner
                .map(option -> ResponseEntity.ok(progressionResponseMapper.toOptionResponse(
                        optionIndexOf(option), option, nodesById().get(option.getNodeId()))))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/instant-unlock")
    public ResponseEntity<ProgressionResponses.UnlockOutcome> instantUnlock() {
        return ResponseEntity.ok(progressionResponseMapper.toUnlockOutcomeResponse(progressionService.forceInstantUnlock()));
    }

    @PostMapping("/reload-weights")
    public ResponseEntity<Void> reloadWeights() {
        progressionAdminService.invalidateWeightCache();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/sync-tree")
    public ResponseEntity<TreeSyncResult> syncTree() {
        return ResponseEntity.ok(progressionAdminService.syncTree());
    }

    private int optionIndexOf(VotingOption option) {
        List<VotingOption> options = votingSessionService.getSessionOptions(option.getSessionId());
        for (int i = 0; i < options.size(); i++) {
            if (options.get(i).getId().equals(option.getId())) {
                return i + 1;
            }
        }
        return 0;
    }

    private Map<Integer, ProgressionNode> nodesById() {
        return unlockGraphService.getAllNodes().stream()
                .collect(Collectors.toMap(ProgressionNode::getId, Function.identity()));
    }
}
