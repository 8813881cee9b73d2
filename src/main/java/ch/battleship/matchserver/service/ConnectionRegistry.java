package ch.battleship.matchserver.service;

import ch.battleship.matchserver.domain.Player;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps live connections to the players they own.
 *
 * <p>A player is registered when its connection sends {@code join_game}, not when the connection
 * opens. One connection owns at most one player for its whole lifetime.
 *
 * <p>Not thread-safe: instances are owned by {@link GameService}, which serializes all access.
 */
public class ConnectionRegistry {

    private final Map<String, Player> playersByConnection = new LinkedHashMap<>();

    /**
     * Registers a freshly created player under its connection.
     *
     * @param player player to register
     * @throws IllegalStateException if the connection already owns a player
     */
    public void register(Player player) {
        if (playersByConnection.containsKey(player.getConnectionId())) {
            throw new IllegalStateException("Already joined");
        }
        playersByConnection.put(player.getConnectionId(), player);
    }

    public boolean isRegistered(String connectionId) {
        return playersByConnection.containsKey(connectionId);
    }

    public Optional<Player> find(String connectionId) {
        return Optional.ofNullable(playersByConnection.get(connectionId));
    }

    /**
     * Removes the player owned by a connection.
     *
     * @param connectionId closed connection
     * @return the removed player, or empty if the connection never joined (or was already removed)
     */
    public Optional<Player> remove(String connectionId) {
        return Optional.ofNullable(playersByConnection.remove(connectionId));
    }

    public int size() {
        return playersByConnection.size();
    }
}
