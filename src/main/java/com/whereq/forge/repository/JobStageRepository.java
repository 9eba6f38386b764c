package com.whereq.forge.repository;

import com.whereq.forge.entity.JobStage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for the {@link JobStage} entity.
 */
@Repository
public interface JobStageRepository extends JpaRepository<JobStage, Long> {

    List<JobStage> findByJobIdOrderByStageIndexAsc(String jobId);

    Optional<JobStage> findByJobIdAndStageName(String jobId, String stageName);
}
