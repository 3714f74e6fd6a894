package com.db.ecd.assessment.repository;

import com.db.ecd.assessment.constant.IdeaStatus;
import com.db.ecd.assessment.entity.Idea;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IdeaRepository extends JpaRepository<Idea, Long> {
    List<Idea> findByStatusOrderByCreatedAtAscIdAsc(IdeaStatus status);
}
