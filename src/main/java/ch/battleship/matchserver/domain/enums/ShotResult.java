package ch.battleship.matchserver.domain.enums;

import java.util.Arrays;

/**
 * Represents the outcome of a shot as reported by the defending player.
 */
public enum ShotResult {
    /**
     * A ship was hit.
     */
    HIT("hit"),

    /**
     * No ship was hit.
     */
    MISS("miss");

    private final String wireName;

    ShotResult(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Resolves a shot result from its wire name.
     *
     * @param wireName {@code "hit"} or {@code "miss"}
     * @return the matching result
     * @throws IllegalArgumentException for any other value
     */
    public static ShotResult fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(r -> r.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown shot result: " + wireName));
    }
}
