package org.hexwar.runtime.progression;

import org.hexwar.runtime.model.Tile;
import org.hexwar.runtime.model.Unit;
import org.hexwar.runtime.model.World;
import org.hexwar.runtime.rules.RulesTable;
import org.hexwar.runtime.rules.UnitDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Per-unit action sequencing.
 * <p>
 * A unit type's action order is a list of slots. The unit's progression step points at the
 * current slot; completing the slot's action advances it. Movement slots stay open while
 * budget remains, one-shot actions close their slot immediately. When a slot offers
 * alternatives, the first one used becomes the unit's chosen alternative and the others close.
 * <p>
 * Refresh is lazy: a unit is reset the first time it is accessed in a turn of its owner, not
 * when the turn begins. A unit with no budget left is therefore only exhausted once its
 * last-topped-up turn equals the current turn.
 */
public final class TurnProgression {

    private static final Logger LOG = LoggerFactory.getLogger(TurnProgression.class);

    private final RulesTable rules;
    private final HealingPolicy healing;

    public TurnProgression(RulesTable rules) {
        this(rules, new HealingPolicy(rules));
    }

    public TurnProgression(RulesTable rules, HealingPolicy healing) {
        this.rules = rules;
        this.healing = healing;
    }

    public HealingPolicy healing() {
        return healing;
    }

    /**
     * @return the parsed action order of a unit type.
     */
    public ActionOrder orderOf(int unitType) {
        return ActionOrder.parse(rules.unit(unitType).actionOrder());
    }

    public ActionOrder orderOf(Unit unit) {
        return orderOf(unit.unitType());
    }

    /**
     * The actions legal at the unit's current step, honoring its chosen alternative and the
     * remaining movement budget. Empty once the step is past the last slot.
     */
    public List<ActionKind> allowedActions(Unit unit) {
        return allowedAt(orderOf(unit), unit, unit.progressionStep(), unit.chosenAlternative());
    }

    private static List<ActionKind> allowedAt(ActionOrder order, Unit unit, int step, String chosen) {
        List<ActionKind> allowed = new ArrayList<>();
        for (ActionKind kind : order.slot(step)) {
            if (!chosen.isEmpty() && !chosen.equals(kind.token())) {
                continue;
            }
            if (kind.movement() && unit.distanceLeft() <= 0) {
                continue;
            }
            allowed.add(kind);
        }
        return allowed;
    }

    /**
     * Finds the slot in which {@code kind} can be performed now. An action that is not open at
     * the current step is still reachable when the current step is a movement slot, in which
     * case the movement is forfeited and the following slot is used.
     *
     * @return the slot index, or empty if the action is not available.
     */
    public OptionalInt slotFor(Unit unit, ActionKind kind) {
        ActionOrder order = orderOf(unit);
        int step = unit.progressionStep();
        if (allowedAt(order, unit, step, unit.chosenAlternative()).contains(kind)) {
            return OptionalInt.of(step);
        }
        if (!kind.movement() && order.movementSlot(step)
                && allowedAt(order, unit, step + 1, "").contains(kind)) {
            return OptionalInt.of(step + 1);
        }
        return OptionalInt.empty();
    }

    public boolean needsRefresh(Unit unit, int turn) {
        return unit.lastToppedUpTurn() < turn;
    }

    /**
     * A unit is exhausted only if it was refreshed this turn and has no budget left.
     */
    public boolean isExhausted(Unit unit, int turn) {
        return !needsRefresh(unit, turn) && unit.distanceLeft() <= 0;
    }

    /**
     * Refreshes the unit if it has not been topped up this turn and stores the result in the
     * world's top layer.
     * <p>
     * A refresh restores the movement budget, resets progression, clears the attack history,
     * heals resting units and completes a capture that was started in an earlier turn.
     *
     * @param world the world holding the unit.
     * @param unit  the unit as currently stored.
     * @param turn  the current turn.
     * @return the outcome, carrying the stored unit.
     */
    public RefreshOutcome refreshIfNeeded(World world, Unit unit, int turn) {
        if (!needsRefresh(unit, turn)) {
            return RefreshOutcome.unchanged(unit);
        }
        UnitDefinition definition = rules.unit(unit.unitType());
        int health = unit.health();
        if (health == 0) {
            health = definition.health();
        } else if (health < definition.health()) {
            int heal = healing.restingHealAmount(world, unit, turn);
            health = Math.min(definition.health(), health + heal);
        }
        Unit refreshed = unit.withHealth(health)
                .withDistanceLeft(definition.movementPoints())
                .withProgression(0, "")
                .withAttackHistory(List.of());

        CaptureCompletion completion = null;
        if (unit.captureStartedTurn() > 0 && unit.captureStartedTurn() < turn) {
            refreshed = refreshed.withCaptureStartedTurn(0);
            Tile tile = world.tileAt(unit.coord());
            if (tile != null && tile.player() != unit.player()) {
                Tile captured = tile.withPlayer(unit.player());
                world.putTile(captured);
                completion = new CaptureCompletion(refreshed.withLastToppedUpTurn(turn), tile, captured);
                LOG.info("Player {} captured tile {} with unit {}", unit.player(), tile.coord(), unit.label());
            }
        }
        refreshed = refreshed.withLastToppedUpTurn(turn);
        world.updateUnit(refreshed);
        LOG.debug("Refreshed unit {} at {} for turn {}", refreshed.label(), refreshed.coord(), turn);
        return new RefreshOutcome(refreshed, true, Optional.ofNullable(completion));
    }

    /**
     * Spends movement. The step advances once the budget is used up; otherwise a movement
     * action taken from an alternative slot becomes the chosen alternative.
     */
    public Unit afterMove(Unit unit, ActionKind kind, double cost) {
        Unit moved = unit.withDistanceLeft(unit.distanceLeft() - cost);
        if (moved.distanceLeft() <= 0) {
            return moved.withProgression(unit.progressionStep() + 1, "");
        }
        if (orderOf(unit).hasAlternatives(unit.progressionStep())) {
            return moved.withProgression(unit.progressionStep(), kind.token());
        }
        return moved;
    }

    /**
     * Closes the slot an attack was made from. If the following slot is a retreat, the
     * movement budget becomes the type's retreat points.
     *
     * @param slot the slot returned by {@link #slotFor(Unit, ActionKind)}.
     */
    public Unit afterAttack(Unit unit, int slot) {
        ActionOrder order = orderOf(unit);
        Unit advanced = unit.withProgression(slot + 1, "");
        if (order.slot(slot + 1).contains(ActionKind.RETREAT)) {
            return advanced.withDistanceLeft(rules.unit(unit.unitType()).retreatPoints());
        }
        return order.movementSlot(slot + 1) ? advanced : advanced.withDistanceLeft(0);
    }

    /**
     * Closes the slot of a one-shot action such as capture or heal.
     */
    public Unit afterOneShot(Unit unit, int slot) {
        Unit advanced = unit.withProgression(slot + 1, "");
        return orderOf(unit).movementSlot(slot + 1) ? advanced : advanced.withDistanceLeft(0);
    }
}
