package com.db.ecd.assessment.repository;

import com.db.ecd.assessment.entity.Assessment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AssessmentRepository extends JpaRepository<Assessment, Long> {
    @Query("select a from Assessment a where a.idea.id = :ideaId")
    Optional<Assessment> findByIdeaId(@Param("ideaId") Long ideaId);

    @Query("select count(a) > 0 from Assessment a where a.idea.id = :ideaId")
    boolean existsByIdeaId(@Param("ideaId") Long ideaId);
}
