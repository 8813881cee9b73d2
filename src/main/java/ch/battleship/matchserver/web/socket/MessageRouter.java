package ch.battleship.matchserver.web.socket;

import ch.battleship.matchserver.domain.Coordinate;
import ch.battleship.matchserver.domain.enums.ClientMessageType;
import ch.battleship.matchserver.service.GameService;
import ch.battleship.matchserver.web.socket.dto.FireRequest;
import ch.battleship.matchserver.web.socket.dto.FireResultRequest;
import ch.battleship.matchserver.web.socket.dto.JoinGameRequest;
import ch.battleship.matchserver.web.socket.dto.OutboundMessage;
import ch.battleship.matchserver.web.socket.dto.ServerMessage;
import ch.battleship.matchserver.web.socket.dto.SetupCompleteRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Decodes inbound envelopes and dispatches them to the {@link GameService}.
 *
 * <p>Every envelope is a JSON object carrying a {@code type} discriminant. Exactly one handler runs
 * per envelope. Protocol errors (unparsable JSON, unknown type, malformed fields) and rule
 * violations reported by the service are turned into an {@code error} message for the sender; they
 * never change server state and never reach the other player.
 */
@Component
@Slf4j
public class MessageRouter {

    private final GameService gameService;
    private final ObjectMapper objectMapper;
    private final int maxPlayerNameLength;

    public MessageRouter(GameService gameService,
                         ObjectMapper objectMapper,
                         @Value("${battleship.player-name.max-length:50}") int maxPlayerNameLength) {
        this.gameService = gameService;
        // [1.9, 2.7] must not silently become the cell [1, 2]
        this.objectMapper = objectMapper.copy()
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        this.maxPlayerNameLength = maxPlayerNameLength;
    }

    /**
     * Handles one text frame received on a connection.
     *
     * @param connectionId sending connection
     * @param payload raw JSON text
     * @return messages to deliver, including any error for the sender
     */
    public List<OutboundMessage> route(String connectionId, String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("Unparsable message from connection {}: {}", connectionId, e.getOriginalMessage());
            return replyError(connectionId, "Invalid message format");
        }
        if (root == null || !root.isObject()) {
            return replyError(connectionId, "Invalid message format");
        }

        String type = root.path("type").asText("");
        log.debug("Received message {} from connection {}", type, connectionId);

        Optional<ClientMessageType> messageType = ClientMessageType.fromWireName(type);
        if (messageType.isEmpty()) {
            log.debug("Unknown message type {} from connection {}", type, connectionId);
            return replyError(connectionId, "Unknown message type");
        }

        try {
            return switch (messageType.get()) {
                case JOIN_GAME -> handleJoinGame(connectionId, decode(root, JoinGameRequest.class));
                case SETUP_COMPLETE -> gameService.submitFleet(connectionId,
                        decode(root, SetupCompleteRequest.class).toPlacements());
                case FIRE -> gameService.fire(connectionId,
                        Coordinate.fromPair(decode(root, FireRequest.class).coordinates()));
                case FIRE_RESULT -> gameService.reportShotResult(connectionId,
                        decode(root, FireResultRequest.class).toReport());
            };
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.warn("Rejected {} from connection {}: {}", type, connectionId, e.getMessage());
            return replyError(connectionId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to handle {} from connection {}", type, connectionId, e);
            return replyError(connectionId, "Internal server error");
        }
    }

    /**
     * Handles a closed connection.
     *
     * @param connectionId connection that was closed by the transport
     * @return notifications for the remaining player, if any
     */
    public List<OutboundMessage> connectionClosed(String connectionId) {
        return gameService.disconnect(connectionId);
    }

    private List<OutboundMessage> handleJoinGame(String connectionId, JoinGameRequest request) {
        String name = request.playerName() == null ? "" : request.playerName().trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Player name is required");
        }
        if (name.length() > maxPlayerNameLength) {
            throw new IllegalArgumentException("Player name must not exceed " + maxPlayerNameLength + " characters");
        }
        return gameService.joinGame(connectionId, name);
    }

    private <T> T decode(JsonNode root, Class<T> type) {
        try {
            return objectMapper.treeToValue(root, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid message format", e);
        }
    }

    private static List<OutboundMessage> replyError(String connectionId, String message) {
        return List.of(new OutboundMessage(connectionId, ServerMessage.error(message)));
    }
}
