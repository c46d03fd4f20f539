package org.hexwar.runtime.rules;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * Static description of a terrain type.
 *
 * @param id               unique terrain id.
 * @param name             display name; {@value #AIRPORT_BASE} is the only terrain air units heal on.
 * @param buildableUnitIds unit types a player-owned tile of this terrain can produce.
 */
public record TerrainDefinition(int id, String name, IntList buildableUnitIds) {

    public static final String AIRPORT_BASE = "Airport Base";

    public TerrainDefinition {
        buildableUnitIds = buildableUnitIds == null
                ? IntLists.emptyList()
                : IntLists.unmodifiable(new IntArrayList(buildableUnitIds));
    }

    public boolean canBuild(int unitType) {
        return buildableUnitIds.contains(unitType);
    }
}
