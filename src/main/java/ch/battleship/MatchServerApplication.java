package ch.battleship;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Battleship match server.
 *
 * <p>Starts the embedded web server hosting the game WebSocket endpoint and the small REST API
 * used for health checks and status inspection.
 */
@SpringBootApplication
public class MatchServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MatchServerApplication.class, args);
    }

}
