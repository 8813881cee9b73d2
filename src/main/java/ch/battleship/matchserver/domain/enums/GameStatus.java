package ch.battleship.matchserver.domain.enums;

public enum GameStatus {
    /**
     * Setup phase: both players are paired and submit their fleets.
     * Shooting is NOT allowed.
     */
    SETUP,
    IN_PROGRESS,
    /**
     * Terminal state, reached by a win or by a disconnect.
     */
    FINISHED
}
