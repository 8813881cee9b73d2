package ch.battleship.matchserver.domain;

import ch.battleship.matchserver.domain.enums.ShipType;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A validated fleet: the ships a player placed before battle begins.
 *
 * <p>Instances are only created after the placement passed validation, so every ship type appears
 * exactly as often as the game configuration requires.
 */
public class Fleet {

    private final List<ShipPlacement> placements;

    public Fleet(List<ShipPlacement> placements) {
        this.placements = List.copyOf(placements);
    }

    public Set<ShipType> getShipTypes() {
        Set<ShipType> types = EnumSet.noneOf(ShipType.class);
        placements.forEach(p -> types.add(p.getType()));
        return types;
    }

    public boolean contains(ShipType type) {
        return placements.stream().anyMatch(p -> p.getType() == type);
    }
}
