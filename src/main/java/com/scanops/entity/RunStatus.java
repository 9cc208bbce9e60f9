package com.scanops.entity;

public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    TIMEOUT,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    public boolean isActive() {
        return !isTerminal();
    }

    /**
     * PENDING may start or be cancelled, RUNNING may only finish, terminal states never move.
     */
    public boolean canTransitionTo(RunStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == CANCELLED;
            case RUNNING -> next.isTerminal();
            default -> false;
        };
    }
}
