package com.brandish.progression.service;

import com.brandish.progression.model.UserProgression;
import com.brandish.progression.repository.UserProgressionRepository;
import com.brandish.progression.web.ProgressionValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class UserProgressionService {

    private static final Logger log = LoggerFactory.getLogger(UserProgressionService.class);

    private final UserProgressionRepository userProgressionRepository;

    /**
     * @return false when the user already had this unlock
     */
    @Transactional
    public boolean unlockUserProgression(String userId, String progressionType, String progressionKey, JsonNode metadata) {
        requireText(userId, "userId");
        requireText(progressionType, "progressionType");
        requireText(progressionKey, "progressionKey");

        String metadataJson = metadata == null || metadata.isNull() ? null : metadata.toString();
        boolean inserted = userProgressionRepository.insertIfAbsent(userId, progressionType, progressionKey, metadataJson) == 1;
        if (inserted) {
            log.info("User {} unlocked {} {}", userId, progressionType, progressionKey);
        }
        return inserted;
    }

    @Transactional(readOnly = true)
    public boolean isUserProgressionUnlocked(String userId, String progressionType, String progressionKey) {
        return userProgressionRepository.existsByUserIdAndProgressionTypeAndProgressionKey(userId, progressionType, progressionKey);
    }

    @Transactional(readOnly = true)
    public List<UserProgression> getUserProgressions(String userId) {
        return userProgressionRepository.findByUserIdOrderByUnlockedAtAscIdAsc(userId);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ProgressionValidationException(name + " is required");
        }
    }
}
