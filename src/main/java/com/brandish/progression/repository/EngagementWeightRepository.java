package com.brandish.progression.repository;

import com.brandish.progression.model.EngagementWeight;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface EngagementWeightRepository extends JpaRepository<EngagementWeight, String> {
}
