package org.hexwar.runtime.moves;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.hexwar.runtime.history.GameState;
import org.hexwar.runtime.model.AxialCoord;
import org.hexwar.runtime.model.Tile;
import org.hexwar.runtime.model.Unit;
import org.hexwar.runtime.model.World;
import org.hexwar.runtime.movement.AllPaths;
import org.hexwar.runtime.movement.Path;
import org.hexwar.runtime.progression.ActionKind;
import org.hexwar.runtime.progression.TurnProgression;
import org.hexwar.runtime.rules.RulesTable;
import org.hexwar.runtime.rules.TerrainDefinition;
import org.hexwar.runtime.rules.UnitDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists the legal moves at a coordinate for the current player. A unit that would be refreshed
 * on access is refreshed inside a temporary world layer, so the query never changes the game.
 */
public final class OptionsService {

    private final MoveProcessor processor;

    public OptionsService(MoveProcessor processor) {
        this.processor = processor;
    }

    /**
     * @param state the game state.
     * @param coord the coordinate to inspect.
     * @return the options, empty when the current player can do nothing there.
     */
    public GameOptions optionsAt(GameState state, AxialCoord coord) {
        if (state.finished()) {
            return GameOptions.none(coord);
        }
        World world = state.world();
        world.push();
        try {
            Unit unit = world.unitAt(coord);
            if (unit == null) {
                return buildOptions(state, coord);
            }
            if (unit.player() != state.currentPlayer()) {
                return GameOptions.none(coord);
            }
            return unitOptions(state, processor.progression()
                    .refreshIfNeeded(world, unit, state.turnCounter()).unit());
        } finally {
            world.pop();
        }
    }

    private GameOptions unitOptions(GameState state, Unit unit) {
        World world = state.world();
        TurnProgression progression = processor.progression();
        RulesTable rules = processor.rules();
        int turn = state.turnCounter();
        List<ActionKind> allowed = progression.allowedActions(unit);

        List<Path> moves = new ArrayList<>();
        if (allowed.contains(ActionKind.MOVE) || allowed.contains(ActionKind.RETREAT)) {
            AllPaths paths = processor.planner().reachable(world, unit, unit.distanceLeft(), false);
            for (AxialCoord destination : paths.destinations()) {
                paths.pathTo(destination).ifPresent(moves::add);
            }
        }

        List<AxialCoord> targets = progression.slotFor(unit, ActionKind.ATTACK).isPresent()
                ? processor.combat().attackTargets(world, unit)
                : List.of();

        Tile tile = world.tileAt(unit.coord());
        boolean canCapture = tile != null
                && tile.player() != unit.player()
                && unit.captureStartedTurn() == 0
                && rules.terrainUnit(tile.terrainType(), unit.unitType()).canCapture()
                && progression.slotFor(unit, ActionKind.CAPTURE).isPresent();

        UnitDefinition definition = rules.unit(unit.unitType());
        boolean canHeal = unit.health() < definition.health()
                && unit.lastActedTurn() < turn
                && progression.healing().terrainHealAmount(world, unit) > 0;

        return new GameOptions(unit.coord(), unit, allowed, moves, targets, canCapture, canHeal, IntList.of());
    }

    private GameOptions buildOptions(GameState state, AxialCoord coord) {
        Tile tile = state.world().tileAt(coord);
        if (tile == null || tile.player() != state.currentPlayer() || tile.lastActedTurn() >= state.turnCounter()) {
            return GameOptions.none(coord);
        }
        RulesTable rules = processor.rules();
        TerrainDefinition terrain = rules.terrain(tile.terrainType());
        int coins = state.coinsOf(state.currentPlayer());
        IntList buildable = new IntArrayList();
        for (int unitType : terrain.buildableUnitIds()) {
            boolean affordable = rules.findUnit(unitType).map(UnitDefinition::coins).filter(cost -> cost <= coins).isPresent();
            if (affordable && processor.settings().allows(unitType)) {
                buildable.add(unitType);
            }
        }
        return new GameOptions(coord, null, List.of(), List.of(), List.of(), false, false, buildable);
    }
}
