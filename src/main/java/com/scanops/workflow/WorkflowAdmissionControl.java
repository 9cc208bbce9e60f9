package com.scanops.workflow;

import com.scanops.entity.ActiveWorkflowMarker;
import com.scanops.repository.ActiveWorkflowMarkerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Guards the single workflow slot. A claim is a conditional update on the marker row, so two
 * concurrent starts cannot both see the slot as free.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowAdmissionControl {

    private final ActiveWorkflowMarkerRepository markerRepository;
    private final Clock clock;

    @Transactional
    public boolean tryClaim(UUID sessionId) {
        ensureMarker();
        boolean claimed = markerRepository.claim(sessionId, OffsetDateTime.now(clock)) == 1;
        log.debug("Workflow slot claim for session {}: {}", sessionId, claimed ? "granted" : "busy");
        return claimed;
    }

    /**
     * Frees the slot if the given session holds it; a no-op otherwise.
     */
    @Transactional
    public boolean release(UUID sessionId) {
        return markerRepository.release(sessionId) == 1;
    }

    @Transactional(readOnly = true)
    public Optional<UUID> holder() {
        return markerRepository.findById(ActiveWorkflowMarker.SINGLETON_ID)
                .map(ActiveWorkflowMarker::getSessionId);
    }

    private void ensureMarker() {
        if (!markerRepository.existsById(ActiveWorkflowMarker.SINGLETON_ID)) {
            markerRepository.saveAndFlush(ActiveWorkflowMarker.builder()
                    .id(ActiveWorkflowMarker.SINGLETON_ID)
                    .build());
        }
    }
}
