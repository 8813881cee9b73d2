package ch.battleship.matchserver.domain.enums;

/**
 * Why a game reached {@link GameStatus#FINISHED}.
 */
public enum GameEndReason {

    /**
     * The defender reported the sinking of its last remaining ship.
     */
    ALL_SHIPS_SUNK("all_ships_sunk"),

    /**
     * One player left the match; the remaining player wins by forfeit.
     */
    OPPONENT_DISCONNECTED("opponent_disconnected");

    private final String wireName;

    GameEndReason(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
