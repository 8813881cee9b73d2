package ch.battleship.matchserver.web.socket.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@code join_game} envelope: enters matchmaking.
 *
 * @param playerName display name shown to the opponent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JoinGameRequest(String playerName) { }
