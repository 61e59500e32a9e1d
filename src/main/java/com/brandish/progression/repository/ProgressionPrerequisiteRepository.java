package com.brandish.progression.repository;

import com.brandish.progression.model.ProgressionPrerequisite;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProgressionPrerequisiteRepository extends JpaRepository<ProgressionPrerequisite, Integer> {
    List<ProgressionPrerequisite> findByNodeId(Integer nodeId);

    List<ProgressionPrerequisite> findByPrerequisiteNodeId(Integer prerequisiteNodeId);

    @Modifying(flushAutomatically = true)
    @Query("delete from ProgressionPrerequisite p where p.nodeId = :nodeId")
    int deleteByNodeId(@Param("nodeId") Integer nodeId);
}
