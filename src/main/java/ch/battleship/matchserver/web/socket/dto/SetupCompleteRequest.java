package ch.battleship.matchserver.web.socket.dto;

import ch.battleship.matchserver.domain.ShipPlacement;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * {@code setup_complete} envelope: submits the player's fleet.
 *
 * @param ships claimed ship placements
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SetupCompleteRequest(List<ShipDto> ships) {

    public List<ShipPlacement> toPlacements() {
        if (ships == null) {
            throw new IllegalArgumentException("Ships are required");
        }
        if (ships.contains(null)) {
            throw new IllegalArgumentException("Invalid message format");
        }
        return ships.stream().map(ShipDto::toPlacement).toList();
    }
}
