package com.db.ecd.assessment.entity;

import com.db.ecd.assessment.constant.ScoreDimension;
import com.db.ecd.assessment.constant.ScoreLevel;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Entity
@Table(name = "assessments")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Assessment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @OneToOne
    @JoinColumn(name = "idea_id", nullable = false, unique = true)
    private Idea idea;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "assessment_scores", joinColumns = @JoinColumn(name = "assessment_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "dimension")
    @Enumerated(EnumType.STRING)
    @Column(name = "score_level", nullable = false)
    private Map<ScoreDimension, ScoreLevel> scores = new HashMap<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "assessment_rationales", joinColumns = @JoinColumn(name = "assessment_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "dimension")
    @Column(name = "rationale", length = 2000)
    private Map<ScoreDimension, String> rationales = new HashMap<>();

    @Column(nullable = false)
    private String assessedBy;

    @Column(nullable = false, updatable = false)
    private LocalDateTime assessedAt;

    private Double valueScore;

    private Double feasibilityScore;

    public Long getIdeaId() {
        return idea != null ? idea.getId() : null;
    }
}
