package ch.battleship.matchserver.web.socket.dto;

import ch.battleship.matchserver.domain.Coordinate;
import ch.battleship.matchserver.domain.enums.GameEndReason;
import ch.battleship.matchserver.domain.enums.ServerMessageType;
import ch.battleship.matchserver.domain.enums.ShipType;
import ch.battleship.matchserver.domain.enums.ShotResult;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Envelope sent from the server to a client.
 *
 * <p>On the wire the envelope is a flat JSON object: the {@code type} discriminant followed by the
 * payload fields, e.g. {@code {"type":"turn_change","isYourTurn":true}}.
 *
 * @param type message discriminant
 * @param payload message fields
 */
public record ServerMessage(
        ServerMessageType type,
        Map<String, Object> payload
) {
    public static ServerMessage gameStart(String gameId, String opponentName, boolean movesFirst) {
        return new ServerMessage(
                ServerMessageType.GAME_START,
                Map.of(
                        "gameId", gameId,
                        "opponentName", opponentName,
                        "turnOrder", movesFirst ? "first" : "second"
                )
        );
    }

    public static ServerMessage opponentFire(Coordinate coordinate) {
        return new ServerMessage(
                ServerMessageType.OPPONENT_FIRE,
                Map.of("coordinates", coordinate.toPair())
        );
    }

    public static ServerMessage shotResult(Coordinate coordinate, ShotResult result, ShipType shipSunk) {
        // shipSunk is null for most shots; Map.of does not accept null values
        Map<String, Object> payload = new HashMap<>();
        payload.put("coordinates", coordinate.toPair());
        payload.put("result", result.getWireName());
        payload.put("shipSunk", shipSunk == null ? null : shipSunk.getWireName());

        return new ServerMessage(ServerMessageType.SHOT_RESULT, payload);
    }

    public static ServerMessage turnChange(boolean isYourTurn) {
        return new ServerMessage(
                ServerMessageType.TURN_CHANGE,
                Map.of("isYourTurn", isYourTurn)
        );
    }

    public static ServerMessage gameWon(String winnerName) {
        return new ServerMessage(
                ServerMessageType.GAME_END,
                Map.of("winner", winnerName)
        );
    }

    public static ServerMessage gameForfeited(String winnerName) {
        return new ServerMessage(
                ServerMessageType.GAME_END,
                Map.of(
                        "winner", winnerName,
                        "reason", GameEndReason.OPPONENT_DISCONNECTED.getWireName()
                )
        );
    }

    public static ServerMessage error(String message) {
        return new ServerMessage(
                ServerMessageType.ERROR,
                Map.of("message", message)
        );
    }

    /**
     * Flattens the envelope into its JSON shape.
     *
     * @return ordered map with {@code type} first, followed by the payload fields
     */
    @JsonValue
    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", type.getWireName());
        wire.putAll(payload);
        return wire;
    }
}
