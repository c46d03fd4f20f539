package org.hexwar.runtime.model;

import java.util.ArrayList;
import java.util.List;

/**
 * An immutable unit snapshot. Every state change produces a new instance through one of the
 * {@code with...} methods, so a unit read from a parent {@link World} layer can never be
 * modified by work happening in a child layer.
 *
 * @param q                  column of the unit.
 * @param r                  row of the unit.
 * @param player             owning player (1-based).
 * @param unitType           id of the unit definition.
 * @param label              per-player label such as {@code A3}, assigned by the world if {@code null}.
 * @param health             remaining health.
 * @param distanceLeft       remaining movement budget of the current activation, never negative.
 * @param progressionStep    index into the unit type's action order.
 * @param chosenAlternative  alternative picked in a multi-choice slot, empty when none.
 * @param lastToppedUpTurn   turn of the last lazy refresh.
 * @param lastActedTurn      turn of the last action.
 * @param captureStartedTurn turn a capture was started on, 0 when not capturing.
 * @param attackHistory      attacks received since the last refresh, oldest first.
 */
public record Unit(int q,
                   int r,
                   int player,
                   int unitType,
                   String label,
                   int health,
                   double distanceLeft,
                   int progressionStep,
                   String chosenAlternative,
                   int lastToppedUpTurn,
                   int lastActedTurn,
                   int captureStartedTurn,
                   List<AttackRecord> attackHistory) {

    public Unit {
        if (distanceLeft < 0) {
            throw new IllegalArgumentException("Movement budget must not be negative: " + distanceLeft);
        }
        chosenAlternative = chosenAlternative == null ? "" : chosenAlternative;
        attackHistory = attackHistory == null ? List.of() : List.copyOf(attackHistory);
    }

    /**
     * Creates a fresh unit that has never been refreshed. Its health and movement are filled in
     * by the first refresh.
     */
    public static Unit of(int q, int r, int player, int unitType, int health) {
        return new Unit(q, r, player, unitType, null, health, 0, 0, "", 0, 0, 0, List.of());
    }

    public AxialCoord coord() {
        return new AxialCoord(q, r);
    }

    public Unit withCoord(AxialCoord coord) {
        return new Unit(coord.q(), coord.r(), player, unitType, label, health, distanceLeft, progressionStep,
                chosenAlternative, lastToppedUpTurn, lastActedTurn, captureStartedTurn, attackHistory);
    }

    public Unit withLabel(String newLabel) {
        return new Unit(q, r, player, unitType, newLabel, health, distanceLeft, progressionStep,
                chosenAlternative, lastToppedUpTurn, lastActedTurn, captureStartedTurn, attackHistory);
    }

    public Unit withHealth(int newHealth) {
        return new Unit(q, r, player, unitType, label, Math.max(0, newHealth), distanceLeft, progressionStep,
                chosenAlternative, lastToppedUpTurn, lastActedTurn, captureStartedTurn, attackHistory);
    }

    /**
     * Sets the movement budget, clamping negative values to zero.
     */
    public Unit withDistanceLeft(double newDistanceLeft) {
        return new Unit(q, r, player, unitType, label, health, Math.max(0, newDistanceLeft), progressionStep,
                chosenAlternative, lastToppedUpTurn, lastActedTurn, captureStartedTurn, attackHistory);
    }

    public Unit withProgression(int step, String alternative) {
        return new Unit(q, r, player, unitType, label, health, distanceLeft, step,
                alternative, lastToppedUpTurn, lastActedTurn, captureStartedTurn, attackHistory);
    }

    public Unit withLastToppedUpTurn(int turn) {
        return new Unit(q, r, player, unitType, label, health, distanceLeft, progressionStep,
                chosenAlternative, turn, lastActedTurn, captureStartedTurn, attackHistory);
    }

    public Unit withLastActedTurn(int turn) {
        return new Unit(q, r, player, unitType, label, health, distanceLeft, progressionStep,
                chosenAlternative, lastToppedUpTurn, turn, captureStartedTurn, attackHistory);
    }

    public Unit withCaptureStartedTurn(int turn) {
        return new Unit(q, r, player, unitType, label, health, distanceLeft, progressionStep,
                chosenAlternative, lastToppedUpTurn, lastActedTurn, turn, attackHistory);
    }

    public Unit withAttackHistory(List<AttackRecord> history) {
        return new Unit(q, r, player, unitType, label, health, distanceLeft, progressionStep,
                chosenAlternative, lastToppedUpTurn, lastActedTurn, captureStartedTurn, history);
    }

    /**
     * @return a copy with {@code record} appended to the attack history.
     */
    public Unit withAttackRecorded(AttackRecord record) {
        List<AttackRecord> history = new ArrayList<>(attackHistory);
        history.add(record);
        return withAttackHistory(history);
    }
}
