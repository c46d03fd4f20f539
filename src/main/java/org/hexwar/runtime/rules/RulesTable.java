package org.hexwar.runtime.rules;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only rules of a game: unit and terrain definitions plus the terrain/unit modifier
 * table. Instances are immutable and may be shared by any number of concurrently running
 * games.
 */
public final class RulesTable {

    private final Int2ObjectMap<UnitDefinition> units;
    private final Int2ObjectMap<TerrainDefinition> terrains;
    private final Map<String, TerrainUnitProperties> terrainUnitProperties;

    private RulesTable(Builder builder) {
        this.units = new Int2ObjectOpenHashMap<>(builder.units);
        this.terrains = new Int2ObjectOpenHashMap<>(builder.terrains);
        this.terrainUnitProperties = Map.copyOf(builder.terrainUnitProperties);
    }

    /**
     * @param unitType a unit type id.
     * @return the definition.
     * @throws RulesDefinitionException if the type is unknown.
     */
    public UnitDefinition unit(int unitType) {
        UnitDefinition definition = units.get(unitType);
        if (definition == null) {
            throw new RulesDefinitionException("Unknown unit type " + unitType);
        }
        return definition;
    }

    public Optional<UnitDefinition> findUnit(int unitType) {
        return Optional.ofNullable(units.get(unitType));
    }

    /**
     * @param terrainType a terrain id.
     * @return the definition.
     * @throws RulesDefinitionException if the terrain is unknown.
     */
    public TerrainDefinition terrain(int terrainType) {
        TerrainDefinition definition = terrains.get(terrainType);
        if (definition == null) {
            throw new RulesDefinitionException("Unknown terrain type " + terrainType);
        }
        return definition;
    }

    /**
     * @return the modifiers of a unit type on a terrain, {@link TerrainUnitProperties#NONE} if unset.
     */
    public TerrainUnitProperties terrainUnit(int terrainType, int unitType) {
        return terrainUnitProperties.getOrDefault(key(terrainType, unitType), TerrainUnitProperties.NONE);
    }

    public int unitCount() {
        return units.size();
    }

    public int terrainCount() {
        return terrains.size();
    }

    private static String key(int terrainType, int unitType) {
        return terrainType + ":" + unitType;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects definitions before freezing them into a {@link RulesTable}.
     */
    public static final class Builder {
        private final Int2ObjectMap<UnitDefinition> units = new Int2ObjectOpenHashMap<>();
        private final Int2ObjectMap<TerrainDefinition> terrains = new Int2ObjectOpenHashMap<>();
        private final Map<String, TerrainUnitProperties> terrainUnitProperties = new HashMap<>();

        private Builder() {
        }

        public Builder unit(UnitDefinition definition) {
            Objects.requireNonNull(definition, "definition");
            if (units.put(definition.id(), definition) != null) {
                throw new RulesDefinitionException("Duplicate unit type " + definition.id());
            }
            return this;
        }

        public Builder terrain(TerrainDefinition definition) {
            Objects.requireNonNull(definition, "definition");
            if (terrains.put(definition.id(), definition) != null) {
                throw new RulesDefinitionException("Duplicate terrain type " + definition.id());
            }
            return this;
        }

        public Builder terrainUnit(int terrainType, int unitType, TerrainUnitProperties properties) {
            terrainUnitProperties.put(key(terrainType, unitType), Objects.requireNonNull(properties, "properties"));
            return this;
        }

        /**
         * @return the frozen table.
         * @throws RulesDefinitionException if a terrain lists a buildable unit type that is not defined.
         */
        public RulesTable build() {
            for (TerrainDefinition terrain : terrains.values()) {
                for (int unitType : terrain.buildableUnitIds()) {
                    if (!units.containsKey(unitType)) {
                        throw new RulesDefinitionException("Terrain " + terrain.id()
                                + " builds undefined unit type " + unitType);
                    }
                }
            }
            return new RulesTable(this);
        }
    }
}
