package com.brandish.progression.repository;

import com.brandish.progression.model.ProgressionNode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProgressionNodeRepository extends JpaRepository<ProgressionNode, Integer> {
    Optional<ProgressionNode> findByNodeKey(String nodeKey);

    List<ProgressionNode> findAllByOrderByTierAscSortOrderAscIdAsc();

    @Query(
            value = """
                    SELECT node.*
                    FROM progression_nodes node
                    WHERE node.modifier_config ->> 'feature_key' = :featureKey
                    ORDER BY node.tier ASC, node.id ASC
                    """,
            nativeQuery = true
    )
    List<ProgressionNode> findByModifierFeatureKey(@Param("featureKey") String featureKey);
}
