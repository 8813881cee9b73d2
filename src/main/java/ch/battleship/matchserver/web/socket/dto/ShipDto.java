package ch.battleship.matchserver.web.socket.dto;

import ch.battleship.matchserver.domain.Coordinate;
import ch.battleship.matchserver.domain.ShipPlacement;
import ch.battleship.matchserver.domain.enums.ShipType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * One ship inside a {@code setup_complete} envelope.
 *
 * @param type ship type wire name (e.g. {@code "carrier"})
 * @param positions occupied cells as {@code [row, col]} pairs
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ShipDto(
        String type,
        List<List<Integer>> positions
) {

    /**
     * Maps this DTO to a claimed {@link ShipPlacement}.
     *
     * <p>Only the shape of the input is checked here; placement rules are left to the validator.
     *
     * @return the claimed placement
     * @throws IllegalArgumentException if type or positions are missing or malformed
     */
    public ShipPlacement toPlacement() {
        if (type == null) {
            throw new IllegalArgumentException("Ship type is required");
        }
        if (positions == null || positions.isEmpty()) {
            throw new IllegalArgumentException("Ship positions are required");
        }
        return new ShipPlacement(
                ShipType.fromWireName(type),
                positions.stream().map(Coordinate::fromPair).toList()
        );
    }
}
