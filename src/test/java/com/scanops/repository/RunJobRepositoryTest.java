package com.scanops.repository;

import com.scanops.entity.RunJob;
import com.scanops.entity.RunJobStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.OffsetDateTime;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class RunJobRepositoryTest extends BaseRepositoryTest {

    @Autowired
    private RunJobRepository runJobRepository;

    @Test
    void testNextJobSkipsActiveJobs() {
        runJobRepository.save(job(UUID.randomUUID(), RunJobStatus.ACTIVE, OffsetDateTime.now()));
        RunJob queued = runJobRepository.save(job(UUID.randomUUID(), RunJobStatus.QUEUED, OffsetDateTime.now()));

        RunJob next = runJobRepository.findFirstByStatusOrderByEnqueuedAtAsc(RunJobStatus.QUEUED).orElseThrow();
        assertEquals(queued.getId(), next.getId());
        assertTrue(runJobRepository.findFirstByStatusOrderByEnqueuedAtAsc(RunJobStatus.DONE).isEmpty());
    }

    @Test
    void testDeleteQueuedLeavesActiveJobs() {
        UUID runId = UUID.randomUUID();
        runJobRepository.save(job(runId, RunJobStatus.ACTIVE, OffsetDateTime.now()));

        assertEquals(0, runJobRepository.deleteQueuedByRunId(runId));
        assertEquals(1, runJobRepository.count());

        UUID queuedRun = UUID.randomUUID();
        runJobRepository.save(job(queuedRun, RunJobStatus.QUEUED, OffsetDateTime.now()));
        assertEquals(1, runJobRepository.deleteQueuedByRunId(queuedRun));
    }

    private static RunJob job(UUID runId, RunJobStatus status, OffsetDateTime enqueuedAt) {
        return RunJob.builder().runId(runId).status(status).enqueuedAt(enqueuedAt).build();
    }
}
