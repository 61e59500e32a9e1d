package com.brandish.progression.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "progression_nodes")
public class ProgressionNode {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "node_key", nullable = false, length = 100)
    private String nodeKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "node_type", nullable = false, length = 32)
    private ProgressionNodeType nodeType;

    @Column(name = "display_name", nullable = false, length = 200)
    private String displayName;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "max_level", nullable = false)
    private Integer maxLevel = 1;

    @Column(name = "unlock_cost", nullable = false)
    private Integer unlockCost = 0;

    @Column(name = "tier", nullable = false)
    private Integer tier = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "size", nullable = false, length = 32)
    private NodeSize size = NodeSize.MEDIUM;

    @Column(name = "category", nullable = false, length = 64)
    private String category = "general";

    @Column(name = "sort_order", nullable = false)
    private Integer sortOrder = 0;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "modifier_config", columnDefinition = "jsonb")
    private JsonNode modifierConfig;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "dynamic_prerequisites", nullable = false, columnDefinition = "jsonb")
    private JsonNode dynamicPrerequisites = JsonNodeFactory.instance.arrayNode();

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
