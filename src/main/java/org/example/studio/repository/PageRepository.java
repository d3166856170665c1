package org.example.studio.repository;

import org.example.studio.entity.ArtifactStatus;
import org.example.studio.entity.PageEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PageRepository extends JpaRepository<PageEntity, String> {

    @Query("SELECT p FROM PageEntity p JOIN FETCH p.project WHERE p.id = :id")
    Optional<PageEntity> findByIdWithProject(@Param("id") String id);

    List<PageEntity> findByProjectIdOrderByPageNumber(String projectId);

    Optional<PageEntity> findByProjectIdAndPageNumber(String projectId, int pageNumber);

    @Query("SELECT p FROM PageEntity p WHERE p.project.id = :projectId " +
           "AND (p.illustration.status IS NULL OR p.illustration.status IN :statuses) ORDER BY p.pageNumber")
    List<PageEntity> findByProjectAndIllustrationStatusIn(
            @Param("projectId") String projectId,
            @Param("statuses") List<ArtifactStatus> statuses);

    @Query("SELECT p FROM PageEntity p WHERE p.illustration.status = :status OR p.sketch.status = :status")
    List<PageEntity> findWithAnyArtifactInStatus(@Param("status") ArtifactStatus status);

    @Query("SELECT COUNT(p) FROM PageEntity p WHERE p.project.id = :projectId AND p.illustration.status = :status")
    long countByProjectAndIllustrationStatus(
            @Param("projectId") String projectId,
            @Param("status") ArtifactStatus status);

    @Query("SELECT COUNT(p) FROM PageEntity p WHERE p.project.id = :projectId AND p.illustration.status IS NULL")
    long countByProjectWithoutIllustrationStatus(@Param("projectId") String projectId);

    @Query("SELECT COUNT(p) FROM PageEntity p WHERE p.project.id = :projectId " +
           "AND p.feedback.feedbackNotes IS NOT NULL AND p.feedback.feedbackNotes <> '' " +
           "AND p.feedback.resolved = false")
    long countOpenFeedbackByProject(@Param("projectId") String projectId);
}
