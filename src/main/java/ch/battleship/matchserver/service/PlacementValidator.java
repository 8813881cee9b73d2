package ch.battleship.matchserver.service;

import ch.battleship.matchserver.domain.Coordinate;
import ch.battleship.matchserver.domain.GameConfiguration;
import ch.battleship.matchserver.domain.PlacementValidationResult;
import ch.battleship.matchserver.domain.ShipPlacement;
import ch.battleship.matchserver.domain.enums.Orientation;
import ch.battleship.matchserver.domain.enums.ShipType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a claimed fleet is a legal placement.
 *
 * <p>Validation rules:
 * <ul>
 *   <li>The fleet contains every ship type exactly as often as the configuration requires.</li>
 *   <li>Each ship occupies exactly as many cells as its type defines.</li>
 *   <li>All cells lie within the board boundaries.</li>
 *   <li>No cell is claimed by more than one ship.</li>
 *   <li>Each ship is a straight, gap-free horizontal or vertical line.</li>
 * </ul>
 *
 * <p>The result is purely a function of the submitted placements; the opponent's fleet is never
 * consulted. All violations are collected so that a client can show every problem at once.
 */
@Component
public class PlacementValidator {

    private final GameConfiguration config;

    public PlacementValidator(GameConfiguration config) {
        this.config = config;
    }

    public PlacementValidationResult validate(List<ShipPlacement> ships) {
        List<String> violations = new ArrayList<>();

        // 1) Validate inventory
        Map<ShipType, Integer> counts = new EnumMap<>(ShipType.class);
        for (ShipPlacement ship : ships) {
            counts.merge(ship.getType(), 1, Integer::sum);
        }
        for (ShipType type : ShipType.values()) {
            int required = config.getRequiredCount(type);
            int actual = counts.getOrDefault(type, 0);
            if (actual > required) {
                violations.add("Too many ships of type " + type.getWireName()
                        + ": expected " + required + " but found " + actual);
            } else if (actual < required) {
                violations.add("Missing ship of type " + type.getWireName()
                        + ": expected " + required + " but found " + actual);
            }
        }

        // 2) Validate length and board boundaries per ship
        for (ShipPlacement ship : ships) {
            if (ship.getSize() != ship.getType().getSize()) {
                violations.add("Ship " + ship.getType().getWireName() + " must occupy "
                        + ship.getType().getSize() + " cells but occupies " + ship.getSize());
            }
            for (Coordinate cell : ship.getCells()) {
                if (!cell.isWithin(config.getBoardSize())) {
                    violations.add("Ship " + ship.getType().getWireName()
                            + " has cell " + cell + " outside the board");
                }
            }
        }

        // 3) Validate overlap across the whole fleet
        Set<Coordinate> occupied = new HashSet<>();
        Set<Coordinate> overlapping = new LinkedHashSet<>();
        for (ShipPlacement ship : ships) {
            for (Coordinate cell : ship.getCells()) {
                if (!occupied.add(cell)) {
                    overlapping.add(cell);
                }
            }
        }
        for (Coordinate cell : overlapping) {
            violations.add("Cell " + cell + " is occupied by more than one ship");
        }

        // 4) Validate ship bodies are straight and contiguous
        for (ShipPlacement ship : ships) {
            if (ship.getSize() > 1 && resolveOrientation(ship.getCells()).isEmpty()) {
                violations.add("Ship " + ship.getType().getWireName()
                        + " must be a contiguous horizontal or vertical line");
            }
        }

        return new PlacementValidationResult(violations);
    }

    /**
     * Determines the orientation of a ship body.
     *
     * @param cells claimed cells, in any order
     * @return the orientation if the cells form a gap-free straight line, otherwise empty
     */
    public Optional<Orientation> resolveOrientation(List<Coordinate> cells) {
        List<Coordinate> sorted = new ArrayList<>(cells);
        sorted.sort(Coordinate.ROW_MAJOR);
        Coordinate first = sorted.get(0);

        boolean horizontal = true;
        boolean vertical = true;
        for (int i = 0; i < sorted.size(); i++) {
            Coordinate c = sorted.get(i);
            horizontal &= c.getRow() == first.getRow() && c.getCol() == first.getCol() + i;
            vertical &= c.getCol() == first.getCol() && c.getRow() == first.getRow() + i;
        }

        if (horizontal) return Optional.of(Orientation.HORIZONTAL);
        if (vertical) return Optional.of(Orientation.VERTICAL);
        return Optional.empty();
    }
}
