package ch.battleship.matchserver.domain.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Discriminants of the envelopes a client may send.
 */
public enum ClientMessageType {
    JOIN_GAME("join_game"),
    SETUP_COMPLETE("setup_complete"),
    FIRE("fire"),
    /**
     * Sent by the defender in response to an {@code opponent_fire} notification.
     */
    FIRE_RESULT("fire_result");

    private final String wireName;

    ClientMessageType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<ClientMessageType> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(wireName))
                .findFirst();
    }
}
