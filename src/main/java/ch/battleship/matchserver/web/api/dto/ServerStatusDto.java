package ch.battleship.matchserver.web.api.dto;

/**
 * Snapshot of the match server's in-memory state.
 *
 * @param connectedPlayers players that joined and are still connected
 * @param waitingPlayers players queued for an opponent
 * @param activeGames games not yet finished
 * @param gamesInSetup active games in which fleets are still being placed
 * @param gamesInProgress active games in the shooting phase
 */
public record ServerStatusDto(
        int connectedPlayers,
        int waitingPlayers,
        int activeGames,
        long gamesInSetup,
        long gamesInProgress
) {
}
