package com.brandish.progression.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

/**
 * Per-user unlock (recipes and similar), separate from the shared tree. Resets keep these rows
 * when asked to preserve user data.
 */
@Getter
@Setter
@Entity
@Table(name = "user_progression")
public class UserProgression {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Column(name = "progression_type", nullable = false, length = 50)
    private String progressionType;

    @Column(name = "progression_key", nullable = false, length = 100)
    private String progressionKey;

    @Column(name = "unlocked_at", nullable = false)
    private OffsetDateTime unlockedAt = OffsetDateTime.now();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    private JsonNode metadata;
}
