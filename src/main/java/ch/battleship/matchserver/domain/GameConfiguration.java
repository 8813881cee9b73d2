package ch.battleship.matchserver.domain;

import ch.battleship.matchserver.domain.enums.ShipType;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Rules a game is played with.
 *
 * <p>Defines the board dimension and the fleet every player has to place during the setup phase.
 */
@Getter
public class GameConfiguration {

    /**
     * Number of rows and columns of the (square) board.
     */
    private final int boardSize;

    /**
     * Required number of ships per type.
     */
    private final Map<ShipType, Integer> fleetInventory;

    private GameConfiguration(int boardSize, Map<ShipType, Integer> fleetInventory) {
        this.boardSize = boardSize;
        this.fleetInventory = Collections.unmodifiableMap(new EnumMap<>(fleetInventory));
    }

    /**
     * Returns the default game configuration used by the application.
     *
     * @return default configuration (10x10 board, one ship of every type)
     */
    public static GameConfiguration defaultConfig() {
        Map<ShipType, Integer> inventory = new EnumMap<>(ShipType.class);
        for (ShipType type : ShipType.values()) {
            inventory.put(type, 1);
        }
        return new GameConfiguration(10, inventory);
    }

    public int getRequiredCount(ShipType type) {
        return fleetInventory.getOrDefault(type, 0);
    }
}
