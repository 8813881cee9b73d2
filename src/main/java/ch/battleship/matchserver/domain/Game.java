package ch.battleship.matchserver.domain;

import ch.battleship.matchserver.domain.enums.GameEndReason;
import ch.battleship.matchserver.domain.enums.GameStatus;
import ch.battleship.matchserver.domain.enums.ShipType;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Represents a running match between exactly two players.
 *
 * <p>The game aggregates the runtime state (status, current turn, winner) together with the shot
 * bookkeeping needed to arbitrate the defender-reported results. Players are addressed by their
 * index: index 0 is the player who waited in the queue and always fires first.
 *
 * <p>Rule enforcement (who may act when) is handled by the services; the methods here only apply
 * state transitions that were already validated.
 */
@Getter
public class Game {

    private final String gameId;

    /**
     * The two participants, ordered by turn index.
     */
    private final List<Player> players;

    private GameStatus status;

    /**
     * Index of the player whose turn it currently is.
     */
    private int currentTurn;

    /**
     * Index of the winner, set when the game is finished.
     */
    private Integer winnerIndex;

    private GameEndReason endReason;

    /**
     * Target of the shot relayed to the defender that still awaits a {@code fire_result}.
     */
    private Coordinate pendingShot;

    @Getter(AccessLevel.NONE)
    private final List<Set<Coordinate>> targetedCells = List.of(new HashSet<>(), new HashSet<>());

    /**
     * Ship types each player (as defender) has reported sunk.
     */
    @Getter(AccessLevel.NONE)
    private final List<Set<ShipType>> sunkShips =
            List.of(EnumSet.noneOf(ShipType.class), EnumSet.noneOf(ShipType.class));

    /**
     * Creates a new game in {@link GameStatus#SETUP}.
     *
     * @param gameId public game identifier
     * @param first player moving first (index 0)
     * @param second player moving second (index 1)
     */
    public Game(String gameId, Player first, Player second) {
        this.gameId = gameId;
        this.players = List.of(first, second);
        this.status = GameStatus.SETUP;
        this.currentTurn = 0;
    }

    public Player getPlayer(int index) {
        return players.get(index);
    }

    /**
     * Returns the turn index of the given player.
     *
     * @param player a participant of this game
     * @return 0 or 1
     * @throws IllegalStateException if the player does not belong to this game
     */
    public int indexOf(Player player) {
        int index = players.indexOf(player);
        if (index < 0) {
            throw new IllegalStateException("Player does not belong to this game");
        }
        return index;
    }

    public static int opponentOf(int index) {
        return 1 - index;
    }

    public Player getOpponent(Player player) {
        return getPlayer(opponentOf(indexOf(player)));
    }

    public boolean isEveryoneReady() {
        return players.stream().allMatch(Player::isSetupComplete);
    }

    /**
     * Moves the game from setup into battle. Turn order is kept as fixed at creation.
     */
    public void startBattle() {
        this.status = GameStatus.IN_PROGRESS;
    }

    public void switchTurn() {
        this.currentTurn = opponentOf(currentTurn);
    }

    public boolean hasTargeted(int shooterIndex, Coordinate coordinate) {
        return targetedCells.get(shooterIndex).contains(coordinate);
    }

    /**
     * Records a shot that was relayed to the defender.
     *
     * @param shooterIndex index of the firing player
     * @param coordinate target cell
     */
    public void registerShot(int shooterIndex, Coordinate coordinate) {
        targetedCells.get(shooterIndex).add(coordinate);
        this.pendingShot = coordinate;
    }

    public void clearPendingShot() {
        this.pendingShot = null;
    }

    public boolean hasSunk(int defenderIndex, ShipType type) {
        return sunkShips.get(defenderIndex).contains(type);
    }

    public void recordSunkShip(int defenderIndex, ShipType type) {
        sunkShips.get(defenderIndex).add(type);
    }

    /**
     * Checks whether the defender reported every ship of its fleet as sunk.
     *
     * @param defenderIndex index of the defending player
     * @return {@code true} if no ship of the defender is left afloat
     */
    public boolean isFleetDestroyed(int defenderIndex) {
        Fleet fleet = getPlayer(defenderIndex).getFleet();
        return fleet != null && sunkShips.get(defenderIndex).containsAll(fleet.getShipTypes());
    }

    /**
     * Ends the game.
     *
     * @param winnerIndex index of the winning player
     * @param reason why the game ended
     */
    public void finish(int winnerIndex, GameEndReason reason) {
        this.status = GameStatus.FINISHED;
        this.winnerIndex = winnerIndex;
        this.endReason = reason;
        this.pendingShot = null;
    }

    public Player getWinner() {
        return winnerIndex == null ? null : getPlayer(winnerIndex);
    }
}
