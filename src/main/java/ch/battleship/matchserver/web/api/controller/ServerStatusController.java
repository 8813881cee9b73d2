package ch.battleship.matchserver.web.api.controller;

import ch.battleship.matchserver.service.GameService;
import ch.battleship.matchserver.web.api.dto.ServerStatusDto;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view on the match server state for operators.
 *
 * <p>Example response:
 * <pre>
 * {
 *   "connectedPlayers": 5,
 *   "waitingPlayers": 1,
 *   "activeGames": 2,
 *   "gamesInSetup": 1,
 *   "gamesInProgress": 1
 * }
 * </pre>
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ServerStatusController {

    private final GameService gameService;

    @Operation(summary = "Gets counts of connected players, queued players and active games")
    @GetMapping("/status")
    public ResponseEntity<ServerStatusDto> getStatus() {
        return ResponseEntity.ok(gameService.getStatus());
    }
}
