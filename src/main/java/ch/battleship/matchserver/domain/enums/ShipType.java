package ch.battleship.matchserver.domain.enums;

import java.util.Arrays;

/**
 * Defines the available ship types and their corresponding sizes.
 *
 * <p>The size represents the number of board cells occupied by the ship. The wire name is the
 * lower-case identifier clients use in {@code setup_complete} and {@code fire_result} messages.
 */
public enum ShipType {

    /**
     * Ship occupying 5 cells.
     */
    CARRIER(5, "carrier"),

    /**
     * Ship occupying 4 cells.
     */
    BATTLESHIP(4, "battleship"),

    /**
     * Ship occupying 3 cells.
     */
    CRUISER(3, "cruiser"),

    /**
     * Ship occupying 3 cells.
     */
    SUBMARINE(3, "submarine"),

    /**
     * Ship occupying 2 cells.
     */
    DESTROYER(2, "destroyer");

    /**
     * Number of board cells occupied by the ship.
     */
    private final int size;

    private final String wireName;

    ShipType(int size, String wireName) {
        this.size = size;
        this.wireName = wireName;
    }

    /**
     * Returns the size of the ship.
     *
     * @return number of board cells occupied by the ship
     */
    public int getSize() {
        return size;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Resolves a ship type from its wire name.
     *
     * @param wireName lower-case name as sent by clients (e.g. {@code "submarine"})
     * @return the matching ship type
     * @throws IllegalArgumentException if no ship type has the given name
     */
    public static ShipType fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown ship type: " + wireName));
    }
}
