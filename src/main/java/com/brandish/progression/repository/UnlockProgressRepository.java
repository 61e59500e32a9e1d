package com.brandish.progression.repository;

import com.brandish.progression.model.UnlockProgress;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface UnlockProgressRepository extends JpaRepository<UnlockProgress, Integer> {

    Optional<UnlockProgress> findFirstByUnlockedAtIsNullOrderByStartedAtDescIdDesc();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from UnlockProgress p where p.unlockedAt is null order by p.startedAt desc, p.id desc")
    List<UnlockProgress> findActiveForUpdate();

    /**
     * Opens a cycle unless one is already active; the partial unique index on
     * {@code unlocked_at IS NULL} turns a concurrent second insert into a no-op.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            INSERT INTO progression_unlock_progress (contributions_accumulated, started_at)
            VALUES (:contributions, NOW())
            ON CONFLICT DO NOTHING
            """, nativeQuery = true)
    int insertActiveIfAbsent(@Param("contributions") int contributions);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update UnlockProgress p
            set p.contributionsAccumulated = p.contributionsAccumulated + :amount
            where p.id = :progressId
              and p.unlockedAt is null
            """)
    int addContribution(@Param("progressId") Integer progressId, @Param("amount") int amount);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update UnlockProgress p
            set p.nodeId = :nodeId,
                p.targetLevel = :targetLevel,
                p.votingSessionId = :votingSessionId
            where p.id = :progressId
            """)
    int setTarget(
            @Param("progressId") Integer progressId,
            @Param("nodeId") Integer nodeId,
            @Param("targetLevel") Integer targetLevel,
            @Param("votingSessionId") Integer votingSessionId
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update UnlockProgress p set p.unlockedAt = :unlockedAt where p.id = :progressId and p.unlockedAt is null")
    int markCompleted(@Param("progressId") Integer progressId, @Param("unlockedAt") OffsetDateTime unlockedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from UnlockProgress p where p.nodeId = :nodeId")
    int deleteByNodeId(@Param("nodeId") Integer nodeId);
}
