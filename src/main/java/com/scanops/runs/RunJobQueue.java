package com.scanops.runs;

import com.scanops.entity.RunJob;
import com.scanops.entity.RunJobStatus;
import com.scanops.repository.RunJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable FIFO of run jobs backed by the {@code run_job} table.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RunJobQueue {

    private final RunJobRepository jobRepository;

    @Transactional
    public RunJob enqueue(UUID runId) {
        RunJob job = jobRepository.save(RunJob.builder()
                .runId(runId)
                .status(RunJobStatus.QUEUED)
                .build());
        log.debug("Enqueued job {} for run {}", job.getId(), runId);
        return job;
    }

    /**
     * Best-effort removal of a job that has not started yet.
     *
     * @return true when a queued job was removed
     */
    @Transactional
    public boolean removeQueued(UUID runId) {
        return jobRepository.deleteQueuedByRunId(runId) > 0;
    }

    @Transactional
    public Optional<RunJob> claimNext() {
        return jobRepository.findFirstByStatusOrderByEnqueuedAtAsc(RunJobStatus.QUEUED)
                .map(job -> {
                    job.setStatus(RunJobStatus.ACTIVE);
                    job.setStartedAt(OffsetDateTime.now());
                    return jobRepository.save(job);
                });
    }

    @Transactional
    public void finish(UUID jobId, RunJobStatus status, @Nullable String error) {
        jobRepository.findById(jobId).ifPresent(job -> {
            job.setStatus(status);
            job.setError(error);
            job.setFinishedAt(OffsetDateTime.now());
            jobRepository.save(job);
        });
    }

    @Transactional
    public void requeue(UUID jobId) {
        jobRepository.findById(jobId).ifPresent(job -> {
            job.setStatus(RunJobStatus.QUEUED);
            job.setStartedAt(null);
            jobRepository.save(job);
        });
    }

    @Transactional(readOnly = true)
    public List<RunJob> activeJobs() {
        return jobRepository.findByStatus(RunJobStatus.ACTIVE);
    }
}
