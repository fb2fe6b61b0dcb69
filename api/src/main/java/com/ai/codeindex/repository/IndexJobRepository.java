package com.ai.codeindex.repository;

import com.ai.codeindex.entity.IndexJob;
import com.ai.codeindex.entity.JobStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface IndexJobRepository extends JpaRepository<IndexJob, UUID> {

    List<IndexJob> findByStatusOrderByCreatedAtAsc(JobStatus status);

    Page<IndexJob> findByStatus(JobStatus status, Pageable pageable);
}
