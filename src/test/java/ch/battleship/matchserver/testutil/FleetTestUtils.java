package ch.battleship.matchserver.testutil;

import ch.battleship.matchserver.domain.Coordinate;
import ch.battleship.matchserver.domain.ShipPlacement;
import ch.battleship.matchserver.domain.enums.ShipType;

import java.util.ArrayList;
import java.util.List;

public final class FleetTestUtils {

    private FleetTestUtils() {
        // utility class
    }

    /**
     * Builds a straight ship starting at (row, col).
     */
    public static ShipPlacement ship(ShipType type, int row, int col, boolean horizontal) {
        List<Coordinate> cells = new ArrayList<>();
        for (int i = 0; i < type.getSize(); i++) {
            cells.add(horizontal ? new Coordinate(row, col + i) : new Coordinate(row + i, col));
        }
        return new ShipPlacement(type, cells);
    }

    public static ShipPlacement ship(ShipType type, Coordinate... cells) {
        return new ShipPlacement(type, List.of(cells));
    }

    /**
     * A legal default fleet: every ship horizontal on its own even row, starting in column 0.
     */
    public static List<ShipPlacement> standardFleet() {
        return List.of(
                ship(ShipType.CARRIER, 0, 0, true),
                ship(ShipType.BATTLESHIP, 2, 0, true),
                ship(ShipType.CRUISER, 4, 0, true),
                ship(ShipType.SUBMARINE, 6, 0, true),
                ship(ShipType.DESTROYER, 8, 0, true)
        );
    }

    /**
     * Same ship types as {@link #standardFleet()}, all placed vertically.
     */
    public static List<ShipPlacement> verticalFleet() {
        return List.of(
                ship(ShipType.CARRIER, 0, 0, false),
                ship(ShipType.BATTLESHIP, 0, 2, false),
                ship(ShipType.CRUISER, 0, 4, false),
                ship(ShipType.SUBMARINE, 0, 6, false),
                ship(ShipType.DESTROYER, 0, 8, false)
        );
    }

    /**
     * Copy of {@code fleet} with the ship of the given type replaced.
     */
    public static List<ShipPlacement> replace(List<ShipPlacement> fleet, ShipPlacement replacement) {
        List<ShipPlacement> result = new ArrayList<>();
        for (ShipPlacement p : fleet) {
            result.add(p.getType() == replacement.getType() ? replacement : p);
        }
        return result;
    }
}
