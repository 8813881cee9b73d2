package ch.battleship.matchserver.domain;

import lombok.Getter;

import java.util.Comparator;
import java.util.List;

/**
 * Immutable value object representing a cell on the game board.
 *
 * <p>Coordinates are 0-based ({@code row: 0..size-1, col: 0..size-1}) and travel over the wire as
 * {@code [row, col]} pairs. Implements {@link #equals(Object)} and {@link #hashCode()} to support
 * set operations (e.g. overlap detection and duplicate-target checks).
 */
@Getter
public final class Coordinate {

    /**
     * Reading order: by row, then by column.
     */
    public static final Comparator<Coordinate> ROW_MAJOR =
            Comparator.comparingInt(Coordinate::getRow).thenComparingInt(Coordinate::getCol);

    private final int row;

    private final int col;

    public Coordinate(int row, int col) {
        this.row = row;
        this.col = col;
    }

    /**
     * Creates a coordinate from its wire representation.
     *
     * @param pair {@code [row, col]} as decoded from JSON
     * @return the coordinate
     * @throws IllegalArgumentException if the pair is missing, has the wrong length or contains nulls
     */
    public static Coordinate fromPair(List<Integer> pair) {
        if (pair == null || pair.size() != 2 || pair.get(0) == null || pair.get(1) == null) {
            throw new IllegalArgumentException("Coordinates must be a [row, col] pair");
        }
        return new Coordinate(pair.get(0), pair.get(1));
    }

    /**
     * Checks whether this coordinate lies on a square board of the given size.
     *
     * @param boardSize number of rows (and columns)
     * @return {@code true} if {@code 0 <= row, col < boardSize}
     */
    public boolean isWithin(int boardSize) {
        return row >= 0 && row < boardSize && col >= 0 && col < boardSize;
    }

    public List<Integer> toPair() {
        return List.of(row, col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Coordinate other)) return false;
        return row == other.row && col == other.col;
    }

    @Override
    public int hashCode() {
        return 31 * row + col;
    }

    @Override
    public String toString() {
        return "[" + row + "," + col + "]";
    }
}
