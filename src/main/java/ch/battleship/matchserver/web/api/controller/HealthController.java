package ch.battleship.matchserver.web.api.controller;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness probe for the match server.
 *
 * <p>Only confirms that the application context is up; it says nothing about connected players.
 * Use {@link ServerStatusController} for that.
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    @Operation(summary = "Check that the match server is running")
    @GetMapping("/health")
    public String health() {
        return "OK";
    }
}
