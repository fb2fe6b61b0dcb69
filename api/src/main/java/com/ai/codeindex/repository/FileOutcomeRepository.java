package com.ai.codeindex.repository;

import com.ai.codeindex.entity.FileOutcome;
import com.ai.codeindex.entity.FileOutcomeStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FileOutcomeRepository extends JpaRepository<FileOutcome, Long> {

    List<FileOutcome> findByJobIdOrderByIdAsc(UUID jobId);

    @Query("""
            SELECT DISTINCT o.filePath FROM FileOutcome o
            WHERE o.status = :status
              AND o.jobId IN (SELECT j.id FROM IndexJob j WHERE j.repoId = :repoId AND j.commitRef = :commitRef)
            """)
    List<String> findPathsWithStatus(@Param("repoId") String repoId,
                                     @Param("commitRef") String commitRef,
                                     @Param("status") FileOutcomeStatus status);
}
