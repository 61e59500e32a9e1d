package com.brandish.progression.controller;

import com.brandish.progression.dto.ProgressionRequests;
import com.brandish.progression.dto.ProgressionResponses;
import com.brandish.progression.mapper.ProgressionResponseMapper;
import com.brandish.progression.service.UserProgressionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/progression/users/{userId}/progressions")
public class UserProgressionController {

    private final UserProgressionService userProgressionService;
    private final ProgressionResponseMapper progressionResponseMapper;

    public UserProgressionController(
            UserProgressionService userProgressionService,
            ProgressionResponseMapper progressionResponseMapper
    ) {
        this.userProgressionService = userProgressionService;
        this.progressionResponseMapper = progressionResponseMapper;
    }

    @GetMapping
    public ResponseEntity<List<ProgressionResponses.UserProgression>> getUserProgressions(@PathVariable String userId) {
        return ResponseEntity.ok(progressionResponseMapper.toUserProgressionResponses(
                userProgressionService.getUserProgressions(userId)));
    }

    // 201 on first unlock, 200 when the user already had it.
    @PostMapping
    public ResponseEntity<ProgressionResponses.UserProgressionUnlock> unlockUserProgression(
            @PathVariable String userId,
            @Valid @RequestBody ProgressionRequests.UnlockUserProgressionRequest request
    ) {
        boolean unlocked = userProgressionService.unlockUserProgression(
                userId, request.progressionType(), request.progressionKey(), request.metadata());
        ProgressionResponses.UserProgressionUnlock body = new ProgressionResponses.UserProgressionUnlock(
                userId, request.progressionType(), request.progressionKey(), unlocked);
        return ResponseEntity.status(unlocked ? HttpStatus.CREATED : HttpStatus.OK).body(body);
    }

    @GetMapping("/{progressionType}/{progressionKey}")
    public ResponseEntity<ProgressionResponses.FeatureUnlocked> isUserProgressionUnlocked(
            @PathVariable String userId,
            @PathVariable String progressionType,
            @PathVariable String progressionKey
    ) {
        return ResponseEntity.ok(new ProgressionResponses.FeatureUnlocked(
                progressionKey,
                userProgressionService.isUserProgressionUnlocked(userId, progressionType, progressionKey)
        ));
    }
}
