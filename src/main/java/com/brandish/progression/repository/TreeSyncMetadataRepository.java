package com.brandish.progression.repository;

import com.brandish.progression.model.TreeSyncMetadata;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TreeSyncMetadataRepository extends JpaRepository<TreeSyncMetadata, String> {
}
