package com.brandish.progression.repository;

import com.brandish.progression.model.VotingSession;
import com.brandish.progression.model.VotingSessionStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface VotingSessionRepository extends JpaRepository<VotingSession, Integer> {
    Optional<VotingSession> findFirstByStatusOrderByStartedAtDescIdDesc(VotingSessionStatus status);

    Optional<VotingSession> findFirstByStatusInOrderByStartedAtDescIdDesc(Collection<VotingSessionStatus> statuses);

    Optional<VotingSession> findFirstByOrderByStartedAtDescIdDesc();

    List<VotingSession> findByStatusAndVotingDeadlineBeforeOrderByIdAsc(
            VotingSessionStatus status,
            OffsetDateTime deadline
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from VotingSession s where s.id = :sessionId")
    Optional<VotingSession> findByIdForUpdate(@Param("sessionId") Integer sessionId);

    /**
     * FOR SHARE: votes run side by side but wait for a freeze or an end holding the row.
     */
    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("select s from VotingSession s where s.id = :sessionId")
    Optional<VotingSession> findByIdForShare(@Param("sessionId") Integer sessionId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update VotingSession s set s.winningOptionId = null where s.winningOptionId is not null")
    int clearWinningOptions();
}
