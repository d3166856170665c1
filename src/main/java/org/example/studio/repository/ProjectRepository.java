package org.example.studio.repository;

import org.example.studio.entity.ProjectEntity;
import org.example.studio.entity.ProjectStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProjectRepository extends JpaRepository<ProjectEntity, String> {

    Optional<ProjectEntity> findByReviewToken(String reviewToken);

    List<ProjectEntity> findByStatus(ProjectStatus status);

    List<ProjectEntity> findAllByOrderByCreatedAtDesc();
}
