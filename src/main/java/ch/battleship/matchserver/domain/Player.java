package ch.battleship.matchserver.domain;

import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

/**
 * Represents a player connected to the match server.
 *
 * <p>A player is created when its connection sends {@code join_game} and lives until that connection
 * closes. The connection id is fixed for the player's lifetime; the game reference and fleet change
 * as the player moves from the queue into a game.
 */
@Getter
@Setter
public class Player {

    private final UUID id;

    /**
     * Display name chosen by the player.
     */
    private final String username;

    /**
     * Transport connection owning this player (exclusive, 1:1).
     */
    private final String connectionId;

    /**
     * Id of the game this player belongs to, {@code null} while queued or after the game ended.
     */
    private String gameId;

    /**
     * Validated fleet, {@code null} until setup is complete.
     */
    private Fleet fleet;

    private boolean setupComplete;

    public Player(String username, String connectionId) {
        this.id = UUID.randomUUID();
        this.username = username;
        this.connectionId = connectionId;
    }

    public boolean isInGame() {
        return gameId != null;
    }

    /**
     * Stores a validated fleet and marks the player's setup as complete.
     *
     * @param fleet fleet that already passed placement validation
     */
    public void acceptFleet(Fleet fleet) {
        this.fleet = fleet;
        this.setupComplete = true;
    }

    /**
     * Detaches the player from its game.
     */
    public void leaveGame() {
        this.gameId = null;
        this.fleet = null;
        this.setupComplete = false;
    }
}
