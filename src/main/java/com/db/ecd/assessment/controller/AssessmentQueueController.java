package com.db.ecd.assessment.controller;

import com.db.ecd.assessment.constant.ScoreDimension;
import com.db.ecd.assessment.constant.ScoreLevel;
import com.db.ecd.assessment.constant.WorkflowError;
import com.db.ecd.assessment.entity.Assessment;
import com.db.ecd.assessment.entity.Idea;
import com.db.ecd.assessment.model.DimensionView;
import com.db.ecd.assessment.model.DraftView;
import com.db.ecd.assessment.model.ErrorResponse;
import com.db.ecd.assessment.model.RationaleRequest;
import com.db.ecd.assessment.model.ReviewSession;
import com.db.ecd.assessment.model.ScoreRequest;
import com.db.ecd.assessment.model.SubmitAssessmentRequest;
import com.db.ecd.assessment.model.WorkflowResult;
import com.db.ecd.assessment.service.AssessmentWorkflowService;
import com.db.ecd.assessment.service.IdeaService;
import com.db.ecd.assessment.service.ScoringModel;
import jakarta.servlet.http.HttpSession;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/assessment-queue")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class AssessmentQueueController {

    static final String SESSION_ATTRIBUTE = "reviewSession";

    private final AssessmentWorkflowService workflowService;
    private final IdeaService ideaService;
    private final ScoringModel scoringModel;

    @Value("${assessment.default-assessor:Assessment Team}")
    private String defaultAssessor;

    @GetMapping("/dimensions")
    public ResponseEntity<List<DimensionView>> getDimensions() {
        return ResponseEntity.ok(scoringModel.dimensions().stream()
                .map(DimensionView::of)
                .collect(Collectors.toList()));
    }

    @GetMapping("/pending")
    public ResponseEntity<?> getPendingIdeas(HttpSession httpSession) {
        return toResponse(workflowService.refreshPending(reviewSession(httpSession)));
    }

    @PostMapping("/selection/{ideaId}")
    public ResponseEntity<?> selectIdea(@PathVariable Long ideaId, HttpSession httpSession) {
        Idea idea = ideaService.requireIdea(ideaId);
        return toResponse(workflowService.selectIdea(reviewSession(httpSession), idea));
    }

    @DeleteMapping("/selection")
    public ResponseEntity<DraftView> cancelSelection(HttpSession httpSession) {
        ReviewSession session = reviewSession(httpSession);
        workflowService.cancelSelection(session);
        return ResponseEntity.ok(draftView(session));
    }

    @GetMapping("/draft")
    public ResponseEntity<DraftView> getDraft(HttpSession httpSession) {
        return ResponseEntity.ok(draftView(reviewSession(httpSession)));
    }

    @PutMapping("/draft/scores/{dimension}")
    public ResponseEntity<DraftView> setScore(@PathVariable String dimension,
                                              @Valid @RequestBody ScoreRequest request,
                                              HttpSession httpSession) {
        ReviewSession session = reviewSession(httpSession);
        workflowService.setScore(session, ScoreDimension.fromKey(dimension), ScoreLevel.fromName(request.getLevel()));
        return ResponseEntity.ok(draftView(session));
    }

    @PutMapping("/draft/rationales/{dimension}")
    public ResponseEntity<DraftView> setRationale(@PathVariable String dimension,
                                                  @RequestBody RationaleRequest request,
                                                  HttpSession httpSession) {
        ReviewSession session = reviewSession(httpSession);
        workflowService.setRationale(session, ScoreDimension.fromKey(dimension), request.getRationale());
        return ResponseEntity.ok(draftView(session));
    }

    @PostMapping("/submit")
    public ResponseEntity<?> submitAssessment(@RequestBody(required = false) SubmitAssessmentRequest request,
                                              HttpSession httpSession) {
        String assessedBy = request != null && request.getAssessedBy() != null
                ? request.getAssessedBy()
                : defaultAssessor;
        WorkflowResult<Assessment> result = workflowService.submitAssessment(reviewSession(httpSession), assessedBy);
        return toResponse(result);
    }

    private ReviewSession reviewSession(HttpSession httpSession) {
        synchronized (httpSession) {
            ReviewSession session = (ReviewSession) httpSession.getAttribute(SESSION_ATTRIBUTE);
            if (session == null) {
                session = new ReviewSession();
                httpSession.setAttribute(SESSION_ATTRIBUTE, session);
            }
            return session;
        }
    }

    private DraftView draftView(ReviewSession session) {
        return DraftView.of(session, workflowService.previewScores(session).orElse(null));
    }

    private static ResponseEntity<?> toResponse(WorkflowResult<?> result) {
        if (result.isSuccess()) {
            return ResponseEntity.ok(result.getValue());
        }
        HttpStatus status = statusFor(result.getError());
        ErrorResponse error = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(result.getError().name())
                .message(result.getMessage())
                .build();
        return ResponseEntity.status(status).body(error);
    }

    private static HttpStatus statusFor(WorkflowError error) {
        switch (error) {
            case VALIDATION:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case IN_PROGRESS:
                return HttpStatus.CONFLICT;
            default:
                return HttpStatus.SERVICE_UNAVAILABLE;
        }
    }
}
