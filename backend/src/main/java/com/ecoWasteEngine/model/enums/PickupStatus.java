package com.ecoWasteEngine.model.enums;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Pickup lifecycle. The allowed edges are the only way a pickup moves:
 *
 * <pre>
 * REQUESTED -> ASSIGNED | CANCELLED
 * ASSIGNED  -> EN_ROUTE | REQUESTED | CANCELLED | FAILED
 * EN_ROUTE  -> ARRIVED  | FAILED
 * ARRIVED   -> COLLECTED | FAILED
 * </pre>
 *
 * ASSIGNED -> REQUESTED is the unassign edge a reassignment has to go through.
 */
public enum PickupStatus {
    REQUESTED,
    ASSIGNED,
    EN_ROUTE,
    ARRIVED,
    COLLECTED,
    CANCELLED,
    FAILED;

    public Set<PickupStatus> allowedTargets() {
        return switch (this) {
            case REQUESTED -> EnumSet.of(ASSIGNED, CANCELLED);
            case ASSIGNED -> EnumSet.of(EN_ROUTE, REQUESTED, CANCELLED, FAILED);
            case EN_ROUTE -> EnumSet.of(ARRIVED, FAILED);
            case ARRIVED -> EnumSet.of(COLLECTED, FAILED);
            case COLLECTED, CANCELLED, FAILED -> Collections.emptySet();
        };
    }

    public boolean canTransitionTo(PickupStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }

    /** Steps only the assigned driver performs */
    public boolean isDriverStep() {
        return switch (this) {
            case EN_ROUTE, ARRIVED, COLLECTED, FAILED -> true;
            default -> false;
        };
    }
}
