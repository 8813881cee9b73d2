package ch.battleship.matchserver.service;

import ch.battleship.matchserver.domain.Coordinate;
import ch.battleship.matchserver.domain.Fleet;
import ch.battleship.matchserver.domain.Game;
import ch.battleship.matchserver.domain.PlacementValidationResult;
import ch.battleship.matchserver.domain.Player;
import ch.battleship.matchserver.domain.ShipPlacement;
import ch.battleship.matchserver.domain.ShotReport;
import ch.battleship.matchserver.domain.enums.GameEndReason;
import ch.battleship.matchserver.domain.enums.GameStatus;
import ch.battleship.matchserver.web.api.dto.ServerStatusDto;
import ch.battleship.matchserver.web.socket.dto.OutboundMessage;
import ch.battleship.matchserver.web.socket.dto.ServerMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Coordinates players, matchmaking and running games.
 *
 * <p>This service owns all mutable server state: the {@link ConnectionRegistry}, the
 * {@link Matchmaker} queue and the map of active games. Every public operation is
 * {@code synchronized}, handles one inbound event to completion and returns the messages it
 * produced. Sending them is left to the caller, outside of the lock.
 *
 * <p>Rule violations are signalled with {@link IllegalStateException}, malformed input with
 * {@link IllegalArgumentException}. Both are thrown before any state is changed.
 */
@Service
@Slf4j
public class GameService {

    private final PlacementValidator placementValidator;
    private final ShotArbiter shotArbiter;

    private final ConnectionRegistry connectionRegistry = new ConnectionRegistry();
    private final Matchmaker matchmaker = new Matchmaker();
    private final Map<String, Game> activeGames = new LinkedHashMap<>();

    public GameService(PlacementValidator placementValidator, ShotArbiter shotArbiter) {
        this.placementValidator = placementValidator;
        this.shotArbiter = shotArbiter;
    }

    /**
     * Creates a player for the connection and either queues it or pairs it with the oldest waiter.
     *
     * @param connectionId connection sending {@code join_game}
     * @param playerName display name
     * @return {@code game_start} for both players if a game was created, otherwise nothing
     * @throws IllegalStateException if the connection already joined
     */
    public synchronized List<OutboundMessage> joinGame(String connectionId, String playerName) {
        Player player = new Player(playerName, connectionId);
        connectionRegistry.register(player);
        log.debug("Connection {} registered player {} ({})", connectionId, playerName, player.getId());

        Optional<Game> created = matchmaker.join(player);
        if (created.isEmpty()) {
            return List.of();
        }

        Game game = created.get();
        activeGames.put(game.getGameId(), game);

        Player first = game.getPlayer(0);
        Player second = game.getPlayer(1);
        log.info("Game created: {} vs {} ({})", first.getUsername(), second.getUsername(), game.getGameId());

        return List.of(
                new OutboundMessage(first.getConnectionId(),
                        ServerMessage.gameStart(game.getGameId(), second.getUsername(), true)),
                new OutboundMessage(second.getConnectionId(),
                        ServerMessage.gameStart(game.getGameId(), first.getUsername(), false))
        );
    }

    /**
     * Validates and stores the player's fleet. When both fleets are in, the battle starts.
     *
     * @param connectionId connection sending {@code setup_complete}
     * @param ships claimed placements
     * @return {@code turn_change} for both players if the battle started, otherwise nothing
     * @throws IllegalStateException if the player is not in a game in SETUP, already completed
     *                               setup, or the placement is invalid
     */
    public synchronized List<OutboundMessage> submitFleet(String connectionId, List<ShipPlacement> ships) {
        Player player = requirePlayer(connectionId);
        Game game = requireGame(player);

        if (game.getStatus() != GameStatus.SETUP) {
            throw new IllegalStateException("Game is not in setup phase");
        }
        if (player.isSetupComplete()) {
            throw new IllegalStateException("Setup already complete");
        }

        PlacementValidationResult result = placementValidator.validate(ships);
        if (!result.isValid()) {
            throw new IllegalStateException("Invalid ship placement: " + String.join("; ", result.violations()));
        }

        player.acceptFleet(new Fleet(ships));
        log.info("Player {} completed setup in game {}", player.getUsername(), game.getGameId());

        if (!game.isEveryoneReady()) {
            return List.of();
        }

        game.startBattle();
        log.info("Game {} started", game.getGameId());

        List<OutboundMessage> messages = new ArrayList<>();
        for (Player p : game.getPlayers()) {
            boolean yourTurn = game.indexOf(p) == game.getCurrentTurn();
            messages.add(new OutboundMessage(p.getConnectionId(), ServerMessage.turnChange(yourTurn)));
        }
        return messages;
    }

    /**
     * Fires at the opponent's board.
     *
     * @param connectionId connection sending {@code fire}
     * @param target targeted cell
     * @return {@code opponent_fire} for the defender
     */
    public synchronized List<OutboundMessage> fire(String connectionId, Coordinate target) {
        Player shooter = requirePlayer(connectionId);
        Game game = requireGame(shooter);
        return shotArbiter.fire(game, game.indexOf(shooter), target);
    }

    /**
     * Applies the defender's verdict. A game won by this shot is removed from the active games.
     *
     * @param connectionId connection sending {@code fire_result}
     * @param report the defender's verdict
     * @return {@code shot_result} for the shooter plus {@code turn_change} or {@code game_end}
     */
    public synchronized List<OutboundMessage> reportShotResult(String connectionId, ShotReport report) {
        Player defender = requirePlayer(connectionId);
        Game game = requireGame(defender);

        List<OutboundMessage> messages = shotArbiter.resolve(game, game.indexOf(defender), report);

        if (game.getStatus() == GameStatus.FINISHED) {
            closeGame(game);
        }
        return messages;
    }

    /**
     * Tears down the player owned by a closed connection.
     *
     * <p>A queued player is removed silently. If the player was in an active game, the opponent
     * wins by forfeit and receives exactly one {@code game_end}. Calling this again for the same
     * connection (or after the game already ended) produces nothing.
     *
     * @param connectionId closed connection
     * @return the forfeit notification for the remaining player, if any
     */
    public synchronized List<OutboundMessage> disconnect(String connectionId) {
        Optional<Player> removed = connectionRegistry.remove(connectionId);
        if (removed.isEmpty()) {
            return List.of();
        }

        Player player = removed.get();
        if (matchmaker.remove(player)) {
            log.info("Player {} left the queue", player.getUsername());
        }

        List<OutboundMessage> messages = new ArrayList<>();
        Game game = player.getGameId() == null ? null : activeGames.get(player.getGameId());
        if (game != null) {
            Player opponent = game.getOpponent(player);
            game.finish(game.indexOf(opponent), GameEndReason.OPPONENT_DISCONNECTED);
            closeGame(game);

            log.info("Game {} ended by disconnect of {}. Winner: {}",
                    game.getGameId(), player.getUsername(), opponent.getUsername());
            messages.add(new OutboundMessage(opponent.getConnectionId(),
                    ServerMessage.gameForfeited(opponent.getUsername())));
        }

        player.leaveGame();
        log.info("Player {} disconnected", player.getUsername());
        return messages;
    }

    public synchronized ServerStatusDto getStatus() {
        long inSetup = activeGames.values().stream()
                .filter(g -> g.getStatus() == GameStatus.SETUP)
                .count();
        long inProgress = activeGames.values().stream()
                .filter(g -> g.getStatus() == GameStatus.IN_PROGRESS)
                .count();

        return new ServerStatusDto(
                connectionRegistry.size(),
                matchmaker.getWaitingCount(),
                activeGames.size(),
                inSetup,
                inProgress
        );
    }

    public synchronized Optional<Game> findGame(String gameId) {
        return Optional.ofNullable(activeGames.get(gameId));
    }

    public synchronized Optional<Player> findPlayer(String connectionId) {
        return connectionRegistry.find(connectionId);
    }

    // ----------------- helpers -----------------

    private Player requirePlayer(String connectionId) {
        return connectionRegistry.find(connectionId)
                .orElseThrow(() -> new IllegalStateException("Player not in a game"));
    }

    private Game requireGame(Player player) {
        if (!player.isInGame()) {
            throw new IllegalStateException("Player not in a game");
        }
        Game game = activeGames.get(player.getGameId());
        if (game == null) {
            throw new IllegalStateException("Game not found");
        }
        return game;
    }

    private void closeGame(Game game) {
        activeGames.remove(game.getGameId());
        game.getPlayers().forEach(Player::leaveGame);
    }
}
