package com.brandish.progression.repository;

import com.brandish.progression.model.UserProgression;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserProgressionRepository extends JpaRepository<UserProgression, Integer> {
    List<UserProgression> findByUserIdOrderByUnlockedAtAscIdAsc(String userId);

    boolean existsByUserIdAndProgressionTypeAndProgressionKey(
            String userId,
            String progressionType,
            String progressionKey
    );

    @Modifying
    @Query(value = """
            INSERT INTO user_progression (user_id, progression_type, progression_key, unlocked_at, metadata)
            VALUES (:userId, :progressionType, :progressionKey, NOW(), CAST(:metadata AS jsonb))
            ON CONFLICT (user_id, progression_type, progression_key) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(
            @Param("userId") String userId,
            @Param("progressionType") String progressionType,
            @Param("progressionKey") String progressionKey,
            @Param("metadata") String metadata
    );
}
