package ch.battleship.matchserver.domain;

import ch.battleship.matchserver.domain.enums.ShipType;
import ch.battleship.matchserver.domain.enums.ShotResult;

/**
 * The defender's verdict on a shot fired at its board.
 *
 * @param coordinate cell the shot targeted
 * @param result hit or miss, as determined by the defender
 * @param shipSunk ship type sunk by this shot, or {@code null} if none
 */
public record ShotReport(
        Coordinate coordinate,
        ShotResult result,
        ShipType shipSunk
) { }
