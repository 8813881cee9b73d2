package ch.battleship.matchserver.web.socket;

import ch.battleship.matchserver.web.socket.dto.OutboundMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transport edge of the match server.
 *
 * <p>Tracks open WebSocket sessions, hands every text frame to the {@link MessageRouter} and
 * delivers the resulting messages. Spring delivers the frames of one session sequentially, so each
 * inbound message is processed to completion before the next one of that connection.
 *
 * <p>Routing an event and delivering its messages happen under one dispatch lock, so every client
 * sees messages in the order the game state changed (a {@code game_end} is never overtaken by a
 * {@code turn_change} produced just before it).
 *
 * <p>Sends are fire-and-forget: a message addressed to a session that is gone is dropped, and a
 * failed send is logged without affecting the sender of the original message.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GameWebSocketHandler extends TextWebSocketHandler {

    private static final int SEND_TIME_LIMIT_MS = 5000;
    private static final int SEND_BUFFER_SIZE_LIMIT = 64 * 1024;

    private final MessageRouter messageRouter;
    private final ObjectMapper objectMapper;

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    private final Object dispatchLock = new Object();

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        // the decorator serializes concurrent sends to the same session
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_SIZE_LIMIT));
        log.info("New client connected: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        synchronized (dispatchLock) {
            dispatch(messageRouter.route(session.getId(), message.getPayload()));
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.warn("WebSocket error on connection {}: {}", session.getId(), exception.getMessage());
        if (session.isOpen()) {
            try {
                // afterConnectionClosed takes care of the teardown
                session.close(CloseStatus.SERVER_ERROR);
            } catch (IOException e) {
                log.debug("Could not close connection {}: {}", session.getId(), e.getMessage());
            }
        }
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        sessions.remove(session.getId());
        log.info("Client disconnected: {} ({})", session.getId(), status);
        synchronized (dispatchLock) {
            dispatch(messageRouter.connectionClosed(session.getId()));
        }
    }

    private void dispatch(List<OutboundMessage> messages) {
        for (OutboundMessage outbound : messages) {
            send(outbound);
        }
    }

    private void send(OutboundMessage outbound) {
        WebSocketSession target = sessions.get(outbound.connectionId());
        if (target == null || !target.isOpen()) {
            log.debug("Dropping {} for closed connection {}",
                    outbound.message().type(), outbound.connectionId());
            return;
        }

        try {
            String json = objectMapper.writeValueAsString(outbound.message());
            target.sendMessage(new TextMessage(json));
        } catch (IOException | SessionLimitExceededException e) {
            log.warn("Failed to send {} to connection {}: {}",
                    outbound.message().type(), outbound.connectionId(), e.getMessage());
        }
    }
}
