package org.hexwar.runtime.progression;

import org.hexwar.junit.extensions.logging.LogWatchExtension;
import org.hexwar.runtime.model.Tile;
import org.hexwar.runtime.model.Unit;
import org.hexwar.runtime.model.World;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.hexwar.runtime.HexwarFixtures.AIRPORT;
import static org.hexwar.runtime.HexwarFixtures.HELICOPTER;
import static org.hexwar.runtime.HexwarFixtures.LAND_BASE;
import static org.hexwar.runtime.HexwarFixtures.TANK;
import static org.hexwar.runtime.HexwarFixtures.rules;
import static org.hexwar.runtime.HexwarFixtures.unit;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class HealingPolicyTest {

    private HealingPolicy healing;

    @BeforeEach
    void setUp() {
        healing = new HealingPolicy(rules());
    }

    private static World on(Tile tile, Unit unit) {
        return new World(List.of(tile), List.of(unit));
    }

    @Test
    @DisplayName("Heals on neutral or own base")
    void healsOnNeutralOrOwnBase() {
        Unit tank = unit(0, 0, 1, TANK);
        assertEquals(2, healing.terrainHealAmount(on(Tile.of(0, 0, LAND_BASE, 0), tank), tank));
        assertEquals(2, healing.terrainHealAmount(on(Tile.of(0, 0, LAND_BASE, 1), tank), tank));
    }

    @Test
    @DisplayName("No healing on enemy tile")
    void noHealingOnEnemyTile() {
        Unit tank = unit(0, 0, 1, TANK);
        assertEquals(0, healing.terrainHealAmount(on(Tile.of(0, 0, LAND_BASE, 2), tank), tank));
    }

    @Test
    @DisplayName("No healing without bonus or tile")
    void noHealingWithoutBonusOrTile() {
        Unit tank = unit(0, 0, 1, TANK);
        assertEquals(0, healing.terrainHealAmount(on(Tile.of(0, 0, 5, 0), tank), tank));
        assertEquals(0, healing.terrainHealAmount(new World(List.of(), List.of(tank)), tank));
    }

    @Test
    @DisplayName("Air units heal on airport")
    void airUnitsHealOnAirport() {
        Unit helicopter = unit(0, 0, 1, HELICOPTER);
        assertEquals(3, healing.terrainHealAmount(on(Tile.of(0, 0, AIRPORT, 1), helicopter), helicopter));
    }

    @Test
    @DisplayName("Resting needs a quiet previous turn")
    void restingNeedsAQuietPreviousTurn() {
        Unit tank = unit(0, 0, 1, TANK);
        World world = on(Tile.of(0, 0, LAND_BASE, 1), tank);

        assertEquals(2, healing.restingHealAmount(world, tank.withLastActedTurn(3), 5));
        assertEquals(0, healing.restingHealAmount(world, tank.withLastActedTurn(4), 5));
        assertEquals(0, healing.restingHealAmount(world, tank.withLastActedTurn(1), 1));
        assertEquals(2, healing.restingHealAmount(world, tank, 1));
    }
}
