package ch.battleship.matchserver.web.socket.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * {@code fire} envelope.
 *
 * @param coordinates target cell as {@code [row, col]}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FireRequest(List<Integer> coordinates) { }
