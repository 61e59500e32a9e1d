package com.brandish.progression.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "progression_prerequisites")
public class ProgressionPrerequisite {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "node_id", nullable = false)
    private Integer nodeId;

    @Column(name = "prerequisite_node_id", nullable = false)
    private Integer prerequisiteNodeId;

    public ProgressionPrerequisite(Integer nodeId, Integer prerequisiteNodeId) {
        this.nodeId = nodeId;
        this.prerequisiteNodeId = prerequisiteNodeId;
    }
}
