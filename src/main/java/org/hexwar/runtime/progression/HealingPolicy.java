package org.hexwar.runtime.progression;

import org.hexwar.runtime.model.Tile;
import org.hexwar.runtime.model.Unit;
import org.hexwar.runtime.model.World;
import org.hexwar.runtime.rules.RulesTable;
import org.hexwar.runtime.rules.TerrainDefinition;
import org.hexwar.runtime.rules.UnitDefinition;

/**
 * Terrain-based healing rules. A unit heals by the terrain's healing bonus when it stands on a
 * tile that is neutral or its own; air units heal only on {@value TerrainDefinition#AIRPORT_BASE}.
 */
public final class HealingPolicy {

    private final RulesTable rules;

    public HealingPolicy(RulesTable rules) {
        this.rules = rules;
    }

    /**
     * @return the terrain healing available to the unit where it stands, 0 if none.
     */
    public int terrainHealAmount(World world, Unit unit) {
        Tile tile = world.tileAt(unit.coord());
        if (tile == null) {
            return 0;
        }
        if (tile.player() != 0 && tile.player() != unit.player()) {
            return 0;
        }
        UnitDefinition definition = rules.unit(unit.unitType());
        if (definition.airborne()
                && !TerrainDefinition.AIRPORT_BASE.equals(rules.terrain(tile.terrainType()).name())) {
            return 0;
        }
        return Math.max(0, rules.terrainUnit(tile.terrainType(), unit.unitType()).healingBonus());
    }

    /**
     * Healing granted by a refresh. Only units that did not act in the previous turn rest.
     *
     * @param turn the turn the refresh happens in.
     * @return the amount to heal, 0 if none.
     */
    public int restingHealAmount(World world, Unit unit, int turn) {
        int previousTurn = Math.max(1, turn - 1);
        if (unit.lastActedTurn() >= previousTurn) {
            return 0;
        }
        return terrainHealAmount(world, unit);
    }
}
