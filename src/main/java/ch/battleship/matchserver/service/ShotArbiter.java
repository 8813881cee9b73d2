package ch.battleship.matchserver.service;

import ch.battleship.matchserver.domain.Coordinate;
import ch.battleship.matchserver.domain.Game;
import ch.battleship.matchserver.domain.GameConfiguration;
import ch.battleship.matchserver.domain.Player;
import ch.battleship.matchserver.domain.ShotReport;
import ch.battleship.matchserver.domain.enums.GameEndReason;
import ch.battleship.matchserver.domain.enums.GameStatus;
import ch.battleship.matchserver.domain.enums.ShipType;
import ch.battleship.matchserver.domain.enums.ShotResult;
import ch.battleship.matchserver.web.socket.dto.OutboundMessage;
import ch.battleship.matchserver.web.socket.dto.ServerMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Arbitrates shots between the two players of a game.
 *
 * <p>The server does not know where the defender's ships are hit: the defender's client is
 * authoritative and reports {@code hit}/{@code miss} plus an optional sunk ship. The arbiter relays
 * the shot, checks that the report answers the pending shot, forwards the verdict, and decides
 * whether the turn passes or the game is over.
 *
 * <p>Every check runs before the first mutation, so a rejected action leaves the game untouched.
 */
@Component
@Slf4j
public class ShotArbiter {

    private final GameConfiguration config;

    public ShotArbiter(GameConfiguration config) {
        this.config = config;
    }

    /**
     * Accepts a shot and relays it to the defender as {@code opponent_fire}.
     *
     * @param game game the shot belongs to
     * @param shooterIndex index of the firing player
     * @param target targeted cell
     * @return the notification for the defender
     * @throws IllegalStateException if the game is not in progress, it is not the shooter's turn,
     *                               a shot is still pending or the cell was already targeted
     * @throws IllegalArgumentException if the cell is off the board
     */
    public List<OutboundMessage> fire(Game game, int shooterIndex, Coordinate target) {
        if (game.getStatus() != GameStatus.IN_PROGRESS) {
            throw new IllegalStateException("Game not in progress");
        }
        if (shooterIndex != game.getCurrentTurn()) {
            throw new IllegalStateException("Not your turn");
        }
        if (game.getPendingShot() != null) {
            throw new IllegalStateException("Waiting for the previous shot result");
        }
        if (!target.isWithin(config.getBoardSize())) {
            throw new IllegalArgumentException("Shot coordinate out of board bounds");
        }
        if (game.hasTargeted(shooterIndex, target)) {
            throw new IllegalStateException("Cell " + target + " was already targeted");
        }

        game.registerShot(shooterIndex, target);

        Player shooter = game.getPlayer(shooterIndex);
        Player defender = game.getPlayer(Game.opponentOf(shooterIndex));
        log.info("{} fired at {} in game {}", shooter.getUsername(), target, game.getGameId());

        return List.of(new OutboundMessage(defender.getConnectionId(), ServerMessage.opponentFire(target)));
    }

    /**
     * Applies the defender's verdict on the pending shot.
     *
     * <p>The shooter receives {@code shot_result}. If the reported sinking leaves the defender
     * without ships, both players receive {@code game_end} and the game is finished; otherwise the
     * turn passes and both players receive {@code turn_change}.
     *
     * @param game game the report belongs to
     * @param reporterIndex index of the player sending the report
     * @param report the defender's verdict
     * @return messages for shooter and defender
     * @throws IllegalStateException if no shot is pending, the reporter is not the defender, the
     *                               coordinates do not match or the sunk ship is not afloat
     * @throws IllegalArgumentException if a sunk ship is reported for a miss
     */
    public List<OutboundMessage> resolve(Game game, int reporterIndex, ShotReport report) {
        if (game.getStatus() != GameStatus.IN_PROGRESS) {
            throw new IllegalStateException("Game not in progress");
        }
        Coordinate pending = game.getPendingShot();
        if (pending == null) {
            throw new IllegalStateException("No shot is awaiting a result");
        }
        if (reporterIndex == game.getCurrentTurn()) {
            throw new IllegalStateException("Only the defending player can report a shot result");
        }
        if (!pending.equals(report.coordinate())) {
            throw new IllegalStateException("Reported coordinates " + report.coordinate()
                    + " do not match the pending shot " + pending);
        }

        ShipType sunk = report.shipSunk();
        if (sunk != null) {
            if (report.result() != ShotResult.HIT) {
                throw new IllegalArgumentException("A sunk ship can only be reported for a hit");
            }
            if (!game.getPlayer(reporterIndex).getFleet().contains(sunk)) {
                throw new IllegalStateException("Ship " + sunk.getWireName() + " is not part of your fleet");
            }
            if (game.hasSunk(reporterIndex, sunk)) {
                throw new IllegalStateException("Ship " + sunk.getWireName() + " was already sunk");
            }
        }

        int shooterIndex = game.getCurrentTurn();
        Player shooter = game.getPlayer(shooterIndex);
        Player defender = game.getPlayer(reporterIndex);

        game.clearPendingShot();
        if (sunk != null) {
            game.recordSunkShip(reporterIndex, sunk);
        }

        List<OutboundMessage> messages = new ArrayList<>();
        messages.add(new OutboundMessage(shooter.getConnectionId(),
                ServerMessage.shotResult(report.coordinate(), report.result(), sunk)));

        // WIN CHECK
        if (report.result() == ShotResult.HIT && game.isFleetDestroyed(reporterIndex)) {
            game.finish(shooterIndex, GameEndReason.ALL_SHIPS_SUNK);
            log.info("Game {} ended. Winner: {}", game.getGameId(), shooter.getUsername());

            ServerMessage gameEnd = ServerMessage.gameWon(shooter.getUsername());
            messages.add(new OutboundMessage(shooter.getConnectionId(), gameEnd));
            messages.add(new OutboundMessage(defender.getConnectionId(), gameEnd));
            return messages;
        }

        // TURN LOGIC: the turn passes after every processed shot
        game.switchTurn();
        for (Player p : game.getPlayers()) {
            boolean yourTurn = game.indexOf(p) == game.getCurrentTurn();
            messages.add(new OutboundMessage(p.getConnectionId(), ServerMessage.turnChange(yourTurn)));
        }
        log.debug("Turn in game {} passed to {}", game.getGameId(),
                game.getPlayer(game.getCurrentTurn()).getUsername());

        return messages;
    }
}
