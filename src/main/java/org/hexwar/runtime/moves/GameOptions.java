package org.hexwar.runtime.moves;

import it.unimi.dsi.fastutil.ints.IntList;
import org.hexwar.runtime.model.AxialCoord;
import org.hexwar.runtime.model.Unit;
import org.hexwar.runtime.movement.Path;
import org.hexwar.runtime.progression.ActionKind;

import java.util.List;

/**
 * What the current player can do at one coordinate.
 *
 * @param coord          the queried coordinate.
 * @param unit           the unit there as it would look after a refresh, or {@code null}.
 * @param allowedActions actions open at the unit's progression step.
 * @param moves          reachable destinations with their cheapest paths.
 * @param attackTargets  coordinates of units the unit can attack.
 * @param canCapture     whether a capture can be started.
 * @param canHeal        whether the unit can heal.
 * @param buildableUnits unit types the tile can build now.
 */
public record GameOptions(AxialCoord coord,
                          Unit unit,
                          List<ActionKind> allowedActions,
                          List<Path> moves,
                          List<AxialCoord> attackTargets,
                          boolean canCapture,
                          boolean canHeal,
                          IntList buildableUnits) {

    public GameOptions {
        allowedActions = List.copyOf(allowedActions);
        moves = List.copyOf(moves);
        attackTargets = List.copyOf(attackTargets);
    }

    public static GameOptions none(AxialCoord coord) {
        return new GameOptions(coord, null, List.of(), List.of(), List.of(), false, false, IntList.of());
    }

    public boolean isEmpty() {
        return moves.isEmpty() && attackTargets.isEmpty() && !canCapture && !canHeal && buildableUnits.isEmpty();
    }
}
