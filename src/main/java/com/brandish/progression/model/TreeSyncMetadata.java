package com.brandish.progression.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "progression_tree_sync_metadata")
public class TreeSyncMetadata {

    @Id
    @Column(name = "config_name", nullable = false, length = 100)
    private String configName;

    @Column(name = "file_hash", nullable = false, length = 64)
    private String fileHash;

    @Column(name = "last_synced_at", nullable = false)
    private OffsetDateTime lastSyncedAt = OffsetDateTime.now();
}
