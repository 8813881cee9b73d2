package ch.battleship.matchserver.config;

import ch.battleship.matchserver.web.socket.GameWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the game endpoint.
 *
 * <p>Clients exchange plain JSON envelopes ({@code {"type": ..., ...}}) over a raw WebSocket, so no
 * STOMP broker is involved.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final GameWebSocketHandler gameWebSocketHandler;
    private final String path;
    private final String[] allowedOrigins;

    public WebSocketConfig(GameWebSocketHandler gameWebSocketHandler,
                           @Value("${battleship.websocket.path:/}") String path,
                           @Value("${battleship.websocket.allowed-origins:*}") String[] allowedOrigins) {
        this.gameWebSocketHandler = gameWebSocketHandler;
        this.path = path;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // WebSocket Endpoint (Upgrade-URL)
        registry.addHandler(gameWebSocketHandler, path)
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
