package ch.battleship.matchserver.domain;

import java.util.List;

/**
 * Outcome of a fleet placement validation.
 *
 * @param violations human-readable rule violations; empty if the placement is legal
 */
public record PlacementValidationResult(List<String> violations) {

    public PlacementValidationResult {
        violations = List.copyOf(violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }
}
