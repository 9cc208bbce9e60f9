package com.scanops.scope;

import com.scanops.entity.Scope;
import com.scanops.repository.ScopeAssignmentRepository;
import com.scanops.repository.ScopeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.Optional;
import java.util.UUID;

/**
 * Gatekeeper for run submission: checks scope assignment, scope activity and target membership.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScopeAccessService {

    private final ScopeRepository scopeRepository;
    private final ScopeAssignmentRepository assignmentRepository;
    private final TargetAuthorizer targetAuthorizer;

    /**
     * Validates that the caller may scan the target inside the scope.
     *
     * @return the resolved scope, empty when no scope was given or the caller is elevated without one
     * @throws ResponseStatusException NOT_FOUND for an unknown scope, FORBIDDEN when access is denied
     */
    @Transactional(readOnly = true)
    public Optional<Scope> checkAccess(Caller caller, @Nullable UUID scopeId, String target) {
        if (scopeId == null) {
            return Optional.empty();
        }
        Scope scope = scopeRepository.findById(scopeId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Scope not found: " + scopeId));
        if (caller.elevated()) {
            return Optional.of(scope);
        }
        if (!assignmentRepository.existsByUserIdAndScopeId(caller.userId(), scopeId)) {
            log.info("Scope access denied: user={} is not assigned to scope={}", caller.userId(), scopeId);
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "You do not have access to this scope");
        }
        if (!scope.isActive()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Scope is not active");
        }
        if (!targetAuthorizer.isAuthorized(target, scope)) {
            log.info("Target {} rejected for scope={} (user={})", target, scopeId, caller.userId());
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Target is outside the authorized scope");
        }
        return Optional.of(scope);
    }
}
