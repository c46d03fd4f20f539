package org.hexwar.runtime.rules;

/**
 * Per terrain/unit-type modifiers.
 *
 * @param movementCost cost to enter the terrain; 0 means "use the default of 1", negative means impassable.
 * @param attackBonus  attack bonus of a unit standing on the terrain.
 * @param defenseBonus defense bonus of a unit standing on the terrain.
 * @param healingBonus health restored per heal on the terrain.
 * @param canCapture   whether the unit type may capture a tile of this terrain.
 */
public record TerrainUnitProperties(double movementCost,
                                    int attackBonus,
                                    int defenseBonus,
                                    int healingBonus,
                                    boolean canCapture) {

    /** Used when the rules table has no entry for a terrain/unit pair. */
    public static final TerrainUnitProperties NONE = new TerrainUnitProperties(0, 0, 0, 0, false);

    public static final double DEFAULT_MOVEMENT_COST = 1.0;

    /**
     * @return the effective entry cost.
     */
    public double effectiveMovementCost() {
        return movementCost > 0 ? movementCost : DEFAULT_MOVEMENT_COST;
    }

    public boolean impassable() {
        return movementCost < 0;
    }
}
