package ch.battleship.matchserver.web.socket.dto;

/**
 * A server message addressed to one connection.
 *
 * @param connectionId id of the receiving WebSocket session
 * @param message envelope to deliver
 */
public record OutboundMessage(
        String connectionId,
        ServerMessage message
) { }
