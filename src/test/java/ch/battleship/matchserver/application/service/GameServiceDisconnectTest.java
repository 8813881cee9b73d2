package ch.battleship.matchserver.application.service;

import ch.battleship.matchserver.domain.Coordinate;
import ch.battleship.matchserver.domain.Game;
import ch.battleship.matchserver.domain.GameConfiguration;
import ch.battleship.matchserver.domain.ShotReport;
import ch.battleship.matchserver.domain.enums.GameEndReason;
import ch.battleship.matchserver.domain.enums.GameStatus;
import ch.battleship.matchserver.domain.enums.ServerMessageType;
import ch.battleship.matchserver.domain.enums.ShipType;
import ch.battleship.matchserver.domain.enums.ShotResult;
import ch.battleship.matchserver.service.GameService;
import ch.battleship.matchserver.service.PlacementValidator;
import ch.battleship.matchserver.service.ShotArbiter;
import ch.battleship.matchserver.web.socket.dto.OutboundMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static ch.battleship.matchserver.testutil.FleetTestUtils.standardFleet;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the teardown path of {@link GameService#disconnect(String)}.
 */
class GameServiceDisconnectTest {

    private static final String CONN_A = "conn-a";
    private static final String CONN_B = "conn-b";

    private GameService gameService;

    @BeforeEach
    void setUp() {
        GameConfiguration config = GameConfiguration.defaultConfig();
        gameService = new GameService(new PlacementValidator(config), new ShotArbiter(config));
    }

    private Game pairAliceAndBob() {
        gameService.joinGame(CONN_A, "Alice");
        gameService.joinGame(CONN_B, "Bob");
        return gameService.findGame(gameService.findPlayer(CONN_A).orElseThrow().getGameId()).orElseThrow();
    }

    @Test
    void disconnect_unknownConnection_shouldDoNothing() {
        assertThat(gameService.disconnect("never-joined")).isEmpty();
    }

    @Test
    void disconnect_queuedPlayer_shouldLeaveQueueSilently() {
        // Arrange
        gameService.joinGame(CONN_A, "Alice");

        // Act
        List<OutboundMessage> messages = gameService.disconnect(CONN_A);

        // Assert
        assertThat(messages).isEmpty();
        assertThat(gameService.getStatus().waitingPlayers()).isZero();
        assertThat(gameService.getStatus().connectedPlayers()).isZero();

        // the next player is not paired with the ghost
        assertThat(gameService.joinGame(CONN_B, "Bob")).isEmpty();
    }

    @Test
    void disconnect_duringSetup_shouldForfeitToOpponent() {
        // Arrange
        Game game = pairAliceAndBob();

        // Act
        List<OutboundMessage> messages = gameService.disconnect(CONN_B);

        // Assert
        assertThat(messages).singleElement().satisfies(m -> {
            assertThat(m.connectionId()).isEqualTo(CONN_A);
            assertThat(m.message().type()).isEqualTo(ServerMessageType.GAME_END);
            assertThat(m.message().payload())
                    .containsEntry("winner", "Alice")
                    .containsEntry("reason", "opponent_disconnected");
        });
        assertThat(game.getStatus()).isEqualTo(GameStatus.FINISHED);
        assertThat(game.getEndReason()).isEqualTo(GameEndReason.OPPONENT_DISCONNECTED);
        assertThat(gameService.findGame(game.getGameId())).isEmpty();
        assertThat(gameService.findPlayer(CONN_B)).isEmpty();
    }

    @Test
    void disconnect_whileShotPending_shouldForfeitOnce() {
        // Arrange
        Game game = pairAliceAndBob();
        gameService.submitFleet(CONN_A, standardFleet());
        gameService.submitFleet(CONN_B, standardFleet());
        gameService.fire(CONN_A, new Coordinate(0, 0));

        // Act: the defender leaves instead of answering
        List<OutboundMessage> first = gameService.disconnect(CONN_B);
        List<OutboundMessage> second = gameService.disconnect(CONN_B);

        // Assert
        assertThat(first).hasSize(1);
        assertThat(second).isEmpty();
        assertThat(game.getPendingShot()).isNull();
        assertThat(game.getWinner().getUsername()).isEqualTo("Alice");
    }

    @Test
    void disconnect_bothPlayers_shouldProduceSingleGameEnd() {
        pairAliceAndBob();

        List<OutboundMessage> first = gameService.disconnect(CONN_A);
        List<OutboundMessage> second = gameService.disconnect(CONN_B);

        assertThat(first).hasSize(1);
        assertThat(second).isEmpty();
        assertThat(gameService.getStatus().activeGames()).isZero();
        assertThat(gameService.getStatus().connectedPlayers()).isZero();
    }

    @Test
    void disconnect_afterGameFinished_shouldNotNotifyAnyone() {
        // Arrange: play a one-ship-left game to the end
        Game game = pairAliceAndBob();
        gameService.submitFleet(CONN_A, standardFleet());
        gameService.submitFleet(CONN_B, standardFleet());
        for (ShipType type : List.of(ShipType.CARRIER, ShipType.BATTLESHIP, ShipType.CRUISER, ShipType.SUBMARINE)) {
            game.recordSunkShip(1, type);
        }
        gameService.fire(CONN_A, new Coordinate(8, 0));
        gameService.reportShotResult(CONN_B,
                new ShotReport(new Coordinate(8, 0), ShotResult.HIT, ShipType.DESTROYER));

        // Act
        List<OutboundMessage> messages = gameService.disconnect(CONN_B);

        // Assert
        assertThat(messages).isEmpty();
        assertThat(game.getEndReason()).isEqualTo(GameEndReason.ALL_SHIPS_SUNK);
        assertThat(gameService.findPlayer(CONN_A)).isPresent();
    }

    @Test
    void disconnectedPlayersOpponent_canJoinAgainOnNewConnection() {
        pairAliceAndBob();
        gameService.disconnect(CONN_B);

        gameService.joinGame("conn-c", "Carol");
        List<OutboundMessage> messages = gameService.joinGame("conn-d", "Dave");

        assertThat(messages).hasSize(2);
    }
}
