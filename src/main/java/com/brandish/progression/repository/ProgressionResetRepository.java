package com.brandish.progression.repository;

import com.brandish.progression.model.ProgressionReset;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProgressionResetRepository extends JpaRepository<ProgressionReset, Integer> {
    List<ProgressionReset> findTop20ByOrderByResetAtDescIdDesc();

    // Legacy single-option ballot table, no entity maps it any more.
    @Modifying
    @Query(value = "DELETE FROM progression_voting", nativeQuery = true)
    int deleteLegacyVoting();
}
