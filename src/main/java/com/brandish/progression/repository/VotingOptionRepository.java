package com.brandish.progression.repository;

import com.brandish.progression.model.VotingOption;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface VotingOptionRepository extends JpaRepository<VotingOption, Integer> {
    List<VotingOption> findBySessionIdOrderByIdAsc(Integer sessionId);

    @Modifying(clearAutomatically = true)
    @Query(
            value = """
                    UPDATE progression_voting_options
                    SET vote_count = vote_count + 1
                    WHERE id = :optionId
                      AND session_id = :sessionId
                    """,
            nativeQuery = true
    )
    int incrementVoteCount(@Param("sessionId") Integer sessionId, @Param("optionId") Integer optionId);

    /**
     * Stamps the option when its count ties or exceeds every other option in the session.
     */
    @Modifying(clearAutomatically = true)
    @Query(
            value = """
                    UPDATE progression_voting_options option_row
                    SET last_highest_vote_at = NOW()
                    WHERE option_row.id = :optionId
                      AND option_row.vote_count >= (
                          SELECT MAX(other.vote_count)
                          FROM progression_voting_options other
                          WHERE other.session_id = option_row.session_id
                      )
                    """,
            nativeQuery = true
    )
    int markHighestIfLeading(@Param("optionId") Integer optionId);
}
