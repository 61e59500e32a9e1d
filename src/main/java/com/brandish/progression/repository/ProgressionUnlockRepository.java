package com.brandish.progression.repository;

import com.brandish.progression.model.ProgressionUnlock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProgressionUnlockRepository extends JpaRepository<ProgressionUnlock, Integer> {

    List<ProgressionUnlock> findByNodeIdOrderByCurrentLevelAsc(Integer nodeId);

    /**
     * @return 1 when the row was inserted, 0 when (node, level) was already unlocked
     */
    @Modifying
    @Query(
            value = """
                    INSERT INTO progression_unlocks (node_id, current_level, unlocked_by, engagement_score, unlocked_at)
                    VALUES (:nodeId, :level, :unlockedBy, :engagementScore, NOW())
                    ON CONFLICT (node_id, current_level) DO NOTHING
                    """,
            nativeQuery = true
    )
    int insertIfAbsent(
            @Param("nodeId") Integer nodeId,
            @Param("level") int level,
            @Param("unlockedBy") String unlockedBy,
            @Param("engagementScore") long engagementScore
    );

    @Query("""
            select count(u) > 0
            from ProgressionUnlock u, ProgressionNode n
            where n.id = u.nodeId
              and n.nodeKey = :nodeKey
              and u.currentLevel >= :level
            """)
    boolean isNodeUnlocked(@Param("nodeKey") String nodeKey, @Param("level") int level);

    @Query("select max(u.currentLevel) from ProgressionUnlock u where u.nodeId = :nodeId")
    Integer findMaxLevelByNodeId(@Param("nodeId") Integer nodeId);

    @Query("select u.nodeId as nodeId, max(u.currentLevel) as level from ProgressionUnlock u group by u.nodeId")
    List<NodeLevelRow> findUnlockedLevels();

    /**
     * Level 0 removes every level of the node.
     */
    @Modifying
    @Query("delete from ProgressionUnlock u where u.nodeId = :nodeId and (u.currentLevel = :level or :level = 0)")
    int deleteByNodeIdAndLevel(@Param("nodeId") Integer nodeId, @Param("level") int level);

    @Query("""
            select count(distinct u.nodeId)
            from ProgressionUnlock u, ProgressionNode n
            where n.id = u.nodeId
              and n.tier < :tier
            """)
    long countUnlockedNodesBelowTier(@Param("tier") int tier);

    @Query("select count(distinct u.nodeId) from ProgressionUnlock u")
    long countUnlockedNodes();

    @Modifying
    @Query("""
            delete from ProgressionUnlock u
            where u.nodeId not in (select n.id from ProgressionNode n where n.nodeKey = :rootNodeKey)
            """)
    int deleteAllExceptNode(@Param("rootNodeKey") String rootNodeKey);
}
