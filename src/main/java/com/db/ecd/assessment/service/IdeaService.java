package com.db.ecd.assessment.service;

import com.db.ecd.assessment.constant.IdeaStatus;
import com.db.ecd.assessment.entity.Assessment;
import com.db.ecd.assessment.entity.Idea;
import com.db.ecd.assessment.exception.IdeaNotFoundException;
import com.db.ecd.assessment.exception.InvalidStatusTransitionException;
import com.db.ecd.assessment.repository.AssessmentRepository;
import com.db.ecd.assessment.repository.IdeaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read access to ideas and assessments, plus rejection, which happens outside the assessment workflow.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdeaService {

    private final IdeaRepository ideaRepository;
    private final AssessmentRepository assessmentRepository;
    private final IdeaStore ideaStore;

    public List<Idea> getAllIdeas() {
        return ideaRepository.findAll();
    }

    public Optional<Idea> getIdeaById(Long id) {
        return ideaRepository.findById(id);
    }

    public Idea requireIdea(Long id) {
        return getIdeaById(id).orElseThrow(() -> new IdeaNotFoundException(id));
    }

    public Optional<Assessment> getAssessment(Long ideaId) {
        return assessmentRepository.findByIdeaId(ideaId);
    }

    public Idea rejectIdea(Long ideaId) {
        Idea idea = requireIdea(ideaId);
        if (!idea.getStatus().isPending()) {
            throw new InvalidStatusTransitionException(ideaId, idea.getStatus(), IdeaStatus.REJECTED);
        }
        log.info("Rejecting idea {} ({})", ideaId, idea.getTitle());
        return ideaStore.updateStatus(ideaId, IdeaStatus.REJECTED);
    }
}
