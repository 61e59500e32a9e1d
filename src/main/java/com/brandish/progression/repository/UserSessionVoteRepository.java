package com.brandish.progression.repository;

import com.brandish.progression.model.UserSessionVote;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserSessionVoteRepository extends JpaRepository<UserSessionVote, Integer> {

    boolean existsByUserIdAndSessionId(String userId, Integer sessionId);

    /**
     * Inserting the marker takes the row lock on (user_id, session_id); a concurrent insert for
     * the same key waits for this transaction and then inserts nothing.
     *
     * @return 1 when this call recorded the vote, 0 when the user had already voted
     */
    @Modifying
    @Query(
            value = """
                    INSERT INTO progression_user_votes (user_id, session_id, option_id, node_id, voted_at)
                    VALUES (:userId, :sessionId, :optionId, :nodeId, NOW())
                    ON CONFLICT (user_id, session_id) DO NOTHING
                    """,
            nativeQuery = true
    )
    int insertIfAbsent(
            @Param("userId") String userId,
            @Param("sessionId") Integer sessionId,
            @Param("optionId") Integer optionId,
            @Param("nodeId") Integer nodeId
    );

    @Query("select distinct v.userId from UserSessionVote v where v.sessionId = :sessionId order by v.userId")
    List<String> findVoterIdsBySessionId(@Param("sessionId") Integer sessionId);
}
