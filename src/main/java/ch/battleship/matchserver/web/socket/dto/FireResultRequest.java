package ch.battleship.matchserver.web.socket.dto;

import ch.battleship.matchserver.domain.Coordinate;
import ch.battleship.matchserver.domain.ShotReport;
import ch.battleship.matchserver.domain.enums.ShipType;
import ch.battleship.matchserver.domain.enums.ShotResult;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * {@code fire_result} envelope, sent by the defender after an {@code opponent_fire}.
 *
 * @param coordinates cell that was fired at
 * @param result {@code "hit"} or {@code "miss"}
 * @param shipSunk type of the ship sunk by this shot, {@code null} if none
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FireResultRequest(
        List<Integer> coordinates,
        String result,
        String shipSunk
) {

    public ShotReport toReport() {
        if (result == null) {
            throw new IllegalArgumentException("Shot result is required");
        }
        return new ShotReport(
                Coordinate.fromPair(coordinates),
                ShotResult.fromWireName(result),
                shipSunk == null || shipSunk.isBlank() ? null : ShipType.fromWireName(shipSunk)
        );
    }
}
