package ch.battleship.matchserver.domain.enums;

/**
 * Defines the orientation of a ship on the game board.
 */
public enum Orientation {
    HORIZONTAL,
    VERTICAL
}
