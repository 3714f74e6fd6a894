package com.db.ecd.assessment.service;

import com.db.ecd.assessment.constant.IdeaStatus;
import com.db.ecd.assessment.entity.Assessment;
import com.db.ecd.assessment.entity.Idea;
import com.db.ecd.assessment.exception.IdeaNotFoundException;
import com.db.ecd.assessment.exception.IdeaStoreException;
import com.db.ecd.assessment.exception.InvalidStatusTransitionException;
import com.db.ecd.assessment.model.AssessmentRecord;
import com.db.ecd.assessment.model.AxisScores;
import com.db.ecd.assessment.repository.AssessmentRepository;
import com.db.ecd.assessment.repository.IdeaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class JpaIdeaStore implements IdeaStore {

    private final IdeaRepository ideaRepository;
    private final AssessmentRepository assessmentRepository;
    private final ScoringModel scoringModel;

    @Override
    @Cacheable(value = "ideasByStatus", key = "#status")
    public List<Idea> queryByStatus(IdeaStatus status) {
        return ideaRepository.findByStatusOrderByCreatedAtAscIdAsc(status);
    }

    @Override
    @Transactional
    @CacheEvict(value = "ideasByStatus", allEntries = true)
    public Idea updateStatus(Long ideaId, IdeaStatus newStatus) {
        Idea idea = ideaRepository.findById(ideaId)
                .orElseThrow(() -> new IdeaNotFoundException(ideaId));

        if (idea.getStatus() == newStatus) {
            log.debug("Idea {} already {}, nothing to update", ideaId, newStatus);
            return idea;
        }
        if (!idea.getStatus().canTransitionTo(newStatus)) {
            throw new InvalidStatusTransitionException(ideaId, idea.getStatus(), newStatus);
        }

        log.info("Idea {} status {} -> {}", ideaId, idea.getStatus(), newStatus);
        idea.setStatus(newStatus);
        return ideaRepository.save(idea);
    }

    @Override
    @Transactional
    @CacheEvict(value = "ideasByStatus", allEntries = true)
    public Assessment submitAssessment(Long ideaId, AssessmentRecord record) {
        if (!record.isComplete()) {
            throw new IdeaStoreException("Assessment for idea " + ideaId + " does not score every dimension");
        }

        Idea idea = ideaRepository.findById(ideaId)
                .orElseThrow(() -> new IdeaNotFoundException(ideaId));
        if (assessmentRepository.existsByIdeaId(ideaId)) {
            throw new InvalidStatusTransitionException("Idea " + ideaId + " has already been assessed");
        }
        if (!idea.getStatus().canTransitionTo(IdeaStatus.ASSESSED)) {
            throw new InvalidStatusTransitionException(ideaId, idea.getStatus(), IdeaStatus.ASSESSED);
        }

        AxisScores axisScores = scoringModel.score(record.getScores());

        Assessment assessment = new Assessment();
        assessment.setIdea(idea);
        assessment.setScores(new EnumMap<>(record.getScores()));
        if (record.getRationales() != null && !record.getRationales().isEmpty()) {
            assessment.setRationales(new EnumMap<>(record.getRationales()));
        }
        assessment.setAssessedBy(record.getAssessedBy());
        assessment.setAssessedAt(LocalDateTime.now());
        assessment.setValueScore(axisScores.getValue());
        assessment.setFeasibilityScore(axisScores.getFeasibility());

        idea.setStatus(IdeaStatus.ASSESSED);
        ideaRepository.save(idea);
        Assessment saved = assessmentRepository.save(assessment);

        log.info("Idea {} assessed by {}: value={}, feasibility={}",
                ideaId, record.getAssessedBy(), axisScores.getValue(), axisScores.getFeasibility());
        return saved;
    }
}
