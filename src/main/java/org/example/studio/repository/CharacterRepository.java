package org.example.studio.repository;

import org.example.studio.entity.ArtifactStatus;
import org.example.studio.entity.CharacterEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CharacterRepository extends JpaRepository<CharacterEntity, String> {

    @Query("SELECT c FROM CharacterEntity c JOIN FETCH c.project WHERE c.id = :id")
    Optional<CharacterEntity> findByIdWithProject(@Param("id") String id);

    List<CharacterEntity> findByProjectIdOrderByCreatedAt(String projectId);

    Optional<CharacterEntity> findFirstByProjectIdAndMainTrue(String projectId);

    @Query("SELECT c FROM CharacterEntity c WHERE c.project.id = :projectId AND c.main = false " +
           "AND (c.image.status IS NULL OR c.image.status IN :statuses) ORDER BY c.createdAt")
    List<CharacterEntity> findSecondaryByProjectAndImageStatusIn(
            @Param("projectId") String projectId,
            @Param("statuses") List<ArtifactStatus> statuses);

    @Query("SELECT c FROM CharacterEntity c WHERE c.image.status = :status OR c.sketch.status = :status")
    List<CharacterEntity> findWithAnyArtifactInStatus(@Param("status") ArtifactStatus status);

    @Query("SELECT COUNT(c) FROM CharacterEntity c WHERE c.project.id = :projectId AND c.main = false " +
           "AND c.image.status = :status")
    long countSecondaryByProjectAndImageStatus(
            @Param("projectId") String projectId,
            @Param("status") ArtifactStatus status);

    @Query("SELECT COUNT(c) FROM CharacterEntity c WHERE c.project.id = :projectId AND c.main = false " +
           "AND c.image.status IS NULL")
    long countSecondaryByProjectWithoutImageStatus(@Param("projectId") String projectId);

    @Query("SELECT COUNT(c) FROM CharacterEntity c WHERE c.project.id = :projectId " +
           "AND c.feedback.feedbackNotes IS NOT NULL AND c.feedback.feedbackNotes <> '' " +
           "AND c.feedback.resolved = false")
    long countOpenFeedbackByProject(@Param("projectId") String projectId);
}
