package ch.battleship.matchserver.domain.enums;

public enum ServerMessageType
{
    GAME_START("game_start"),
    OPPONENT_FIRE("opponent_fire"),
    SHOT_RESULT("shot_result"),
    TURN_CHANGE("turn_change"),
    GAME_END("game_end"),
    ERROR("error");

    private final String wireName;

    ServerMessageType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
