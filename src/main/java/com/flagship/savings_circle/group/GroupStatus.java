package com.flagship.savings_circle.group;

/**
 * Lifecycle of a savings group.
 *
 * FORMING → ACTIVE → COMPLETED is the only forward path. PAUSED and CANCELLED
 * are reachable from FORMING or ACTIVE; COMPLETED and CANCELLED are terminal.
 */
public enum GroupStatus {
    /**
     * Slots are being filled. Entry payments are accepted only in this state.
     */
    FORMING,

    /**
     * Every slot is held by an active member and cycles are running.
     */
    ACTIVE,

    /**
     * Temporarily halted. Cycles do not advance while paused.
     */
    PAUSED,

    /**
     * The last cycle has paid out.
     */
    COMPLETED,

    /**
     * Abandoned by an operator.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean canTransitionTo(GroupStatus target) {
        if (this == target) {
            return true;
        }
        return switch (this) {
            case FORMING -> target == ACTIVE || target == PAUSED || target == CANCELLED;
            case ACTIVE -> target == COMPLETED || target == PAUSED || target == CANCELLED;
            case PAUSED -> target == FORMING || target == ACTIVE;
            case COMPLETED, CANCELLED -> false;
        };
    }
}
