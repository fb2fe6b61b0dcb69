package com.ai.codeindex.repository;

import com.ai.codeindex.entity.Checkpoint;
import com.ai.codeindex.entity.FileErrorType;
import com.ai.codeindex.entity.FileOutcome;
import com.ai.codeindex.entity.FileOutcomeStatus;
import com.ai.codeindex.entity.IndexJob;
import com.ai.codeindex.entity.JobStatus;
import com.ai.codeindex.entity.JobType;
import com.ai.codeindex.entity.StopReason;
import com.ai.codeindex.service.JobPage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(JpaCheckpointStore.class)
class JpaCheckpointStoreTest {

    @Autowired
    private JpaCheckpointStore store;

    @Autowired
    private TestEntityManager entityManager;

    private IndexJob newJob(List<String> order) {
        IndexJob job = new IndexJob("/srv/repos/demo", "demo", "c0ffee", order.size(), 25, "nomic-embed-text");
        return store.createJob(job, new Checkpoint(job.getId(), order));
    }

    private void flushAndClear() {
        entityManager.flush();
        entityManager.clear();
    }

    @Test
    void createJob_persistsJobAndFrozenOrder() {
        IndexJob job = newJob(List.of("a/A.java", "b/B.java", "c/C.java"));
        flushAndClear();

        IndexJob loaded = store.findJob(job.getId()).orElseThrow();
        Checkpoint checkpoint = store.loadCheckpoint(job.getId()).orElseThrow();

        assertThat(loaded.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(loaded.getCreatedAt()).isNotNull();
        assertThat(checkpoint.getProcessingOrder()).containsExactly("a/A.java", "b/B.java", "c/C.java");
        assertThat(checkpoint.getNextIndex()).isZero();
        assertThat(checkpoint.getLayoutVersion()).isEqualTo(Checkpoint.LAYOUT_VERSION);
    }

    @Test
    void saveCheckpoint_persistsWatermark() {
        IndexJob job = newJob(List.of("a", "b", "c"));
        Checkpoint checkpoint = store.loadCheckpoint(job.getId()).orElseThrow();

        assertThat(checkpoint.advanceTo(2)).isTrue();
        assertThat(checkpoint.advanceTo(1)).isFalse();
        store.saveCheckpoint(checkpoint);
        flushAndClear();

        assertThat(store.loadCheckpoint(job.getId()).orElseThrow().getNextIndex()).isEqualTo(2);
    }

    @Test
    void outcomes_areAppendOnlyAndLatestWins() {
        IndexJob job = newJob(List.of("a", "b"));
        OffsetDateTime now = OffsetDateTime.now();
        store.appendOutcome(FileOutcome.success(job.getId(), "a", 2, 1, now));
        store.appendOutcome(FileOutcome.error(job.getId(), "b", FileErrorType.TIMEOUT, "slow", 1, now));
        store.appendOutcome(FileOutcome.success(job.getId(), "b", 1, 2, now));
        flushAndClear();

        List<FileOutcome> history = store.findOutcomes(job.getId());
        Map<String, FileOutcome> effective = store.effectiveOutcomes(job.getId());

        assertThat(history).extracting(FileOutcome::getFilePath).containsExactly("a", "b", "b");
        assertThat(effective).hasSize(2);
        assertThat(effective.get("b").getStatus()).isEqualTo(FileOutcomeStatus.SUCCESS);
        assertThat(effective.get("b").getAttempt()).isEqualTo(2);
    }

    @Test
    void appendOutcome_rejectsRewritingRecordedRow() {
        IndexJob job = newJob(List.of("a"));
        FileOutcome recorded = store.appendOutcome(
                FileOutcome.success(job.getId(), "a", 1, 1, OffsetDateTime.now()));

        assertThatThrownBy(() -> store.appendOutcome(recorded)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void findJobsByStatus_filtersOnStatus() {
        IndexJob running = newJob(List.of("a"));
        running.setStatus(JobStatus.RUNNING);
        store.saveJob(running);
        IndexJob paused = newJob(List.of("b"));
        paused.setStatus(JobStatus.PAUSED);
        paused.setStopReason(StopReason.SHUTDOWN);
        store.saveJob(paused);
        flushAndClear();

        assertThat(store.findJobsByStatus(JobStatus.RUNNING)).extracting(IndexJob::getId)
                .containsExactly(running.getId());
        assertThat(store.findJobsByStatus(JobStatus.PAUSED)).singleElement()
                .satisfies(j -> assertThat(j.getStopReason()).isEqualTo(StopReason.SHUTDOWN));
    }

    @Test
    void appendOutcome_truncatesLongErrorDetailToColumnLength() {
        IndexJob job = newJob(List.of("a"));
        store.appendOutcome(FileOutcome.error(job.getId(), "a", FileErrorType.PARSE, "x".repeat(5000), 1,
                OffsetDateTime.now()));
        flushAndClear();

        String detail = store.findOutcomes(job.getId()).get(0).getErrorDetail();
        assertThat(detail).hasSize(FileOutcome.MAX_ERROR_DETAIL).endsWith("...");
    }

    // ------ listJobs() ------

    @Test
    void listJobs_pagesNewestFirstAndKeepsSelection() throws Exception {
        IndexJob oldest = newJob(List.of("a"));
        Thread.sleep(5);
        IndexJob middle = new IndexJob("/srv/repos/demo", "demo", "c0ffee", 1, 25, "nomic-embed-text");
        middle.setJobType(JobType.INCREMENTAL);
        middle.setFilePatterns(List.of("*.java"));
        middle.setExcludePatterns(List.of("**/test/**"));
        store.createJob(middle, new Checkpoint(middle.getId(), List.of("A.java")));
        Thread.sleep(5);
        IndexJob newest = newJob(List.of("c"));
        newest.setStatus(JobStatus.COMPLETED);
        store.saveJob(newest);
        flushAndClear();

        JobPage first = store.listJobs(null, 0, 2);
        JobPage second = store.listJobs(null, 1, 2);
        JobPage pending = store.listJobs(JobStatus.PENDING, 0, 10);

        assertThat(first.jobs()).extracting(IndexJob::getId).containsExactly(newest.getId(), middle.getId());
        assertThat(first.totalCount()).isEqualTo(3);
        assertThat(second.jobs()).extracting(IndexJob::getId).containsExactly(oldest.getId());
        assertThat(pending.jobs()).extracting(IndexJob::getId).containsExactly(middle.getId(), oldest.getId());

        IndexJob loaded = first.jobs().get(1);
        assertThat(loaded.getJobType()).isEqualTo(JobType.INCREMENTAL);
        assertThat(loaded.getFilePatterns()).containsExactly("*.java");
        assertThat(loaded.getExcludePatterns()).containsExactly("**/test/**");
        assertThat(first.jobs().get(0).getFilePatterns()).isEmpty();
    }

    // ------ succeededPaths() ------

    @Test
    void succeededPaths_onlyCountsSuccessesAtTheSameRepositorySnapshot() {
        OffsetDateTime now = OffsetDateTime.now();
        IndexJob sameCommit = newJob(List.of("a", "b"));
        store.appendOutcome(FileOutcome.success(sameCommit.getId(), "a", 1, 1, now));
        store.appendOutcome(FileOutcome.error(sameCommit.getId(), "b", FileErrorType.READ, "gone", 1, now));
        IndexJob otherCommit = new IndexJob("/srv/repos/demo", "demo", "beef", 1, 25, "nomic-embed-text");
        store.createJob(otherCommit, new Checkpoint(otherCommit.getId(), List.of("c")));
        store.appendOutcome(FileOutcome.success(otherCommit.getId(), "c", 1, 1, now));
        flushAndClear();

        assertThat(store.succeededPaths("demo", "c0ffee")).containsExactly("a");
        assertThat(store.succeededPaths("demo", "beef")).containsExactly("c");
        assertThat(store.succeededPaths("other", "c0ffee")).isEmpty();
    }

    @Test
    void findJob_unknownIsEmpty() {
        assertThat(store.findJob(UUID.randomUUID())).isEmpty();
    }
}
