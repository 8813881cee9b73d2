package ch.battleship.matchserver.domain;

import ch.battleship.matchserver.domain.enums.ShipType;
import lombok.Getter;

import java.util.List;

/**
 * Represents a ship placement claimed by a player.
 *
 * <p>Unlike a start/orientation pair, a claimed placement lists every cell explicitly, exactly as the
 * client submitted it. Whether the cells actually form a legal ship is decided by the
 * {@code PlacementValidator}; this class makes no such guarantee.
 */
@Getter
public class ShipPlacement {

    private final ShipType type;

    /**
     * Cells in submission order.
     */
    private final List<Coordinate> cells;

    public ShipPlacement(ShipType type, List<Coordinate> cells) {
        this.type = type;
        this.cells = List.copyOf(cells);
    }

    /**
     * Returns the number of cells claimed by this placement.
     *
     * @return claimed cell count (may differ from {@link ShipType#getSize()} for invalid input)
     */
    public int getSize() {
        return cells.size();
    }
}
