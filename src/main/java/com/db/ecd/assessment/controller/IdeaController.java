package com.db.ecd.assessment.controller;

import com.db.ecd.assessment.entity.Assessment;
import com.db.ecd.assessment.entity.Idea;
import com.db.ecd.assessment.service.IdeaService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/ideas")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class IdeaController {

    private final IdeaService ideaService;

    @GetMapping
    public ResponseEntity<List<Idea>> getAllIdeas() {
        return ResponseEntity.ok(ideaService.getAllIdeas());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Idea> getIdea(@PathVariable Long id) {
        return ideaService.getIdeaById(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/assessment")
    public ResponseEntity<Assessment> getAssessment(@PathVariable Long id) {
        return ideaService.getAssessment(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<Idea> rejectIdea(@PathVariable Long id) {
        return ResponseEntity.ok(ideaService.rejectIdea(id));
    }
}
