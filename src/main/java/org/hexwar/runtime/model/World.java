package org.hexwar.runtime.model;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Spatial store of tiles and units keyed by hex coordinate, organized as a stack of
 * copy-on-write overlay layers.
 * <p>
 * Layers live in an arena: each slot holds its own coordinate maps, a set of tombstones for
 * entries deleted locally, and the index of its parent slot. Reads walk the parent chain and
 * stop at a tombstone. Writes always go to the topmost layer, so the layers below it are
 * never touched until {@link #commit()} folds the top layer into its parent. {@link #pop()}
 * drops the top slot and restores the exact prior state.
 * <p>
 * Units and tiles are immutable records, so sharing them between layers is safe.
 * <p>
 * This class is not thread-safe. A world belongs to exactly one game and is mutated from a
 * single thread.
 */
public final class World {

    private static final Logger LOG = LoggerFactory.getLogger(World.class);
    private static final int NO_PARENT = -1;

    private final List<Layer> arena = new ArrayList<>();
    private int top;

    private static final class Layer {
        final int parent;
        final Map<AxialCoord, Tile> tiles = new HashMap<>();
        final Set<AxialCoord> deletedTiles = new HashSet<>();
        final Map<AxialCoord, Unit> units = new HashMap<>();
        final Set<AxialCoord> deletedUnits = new HashSet<>();
        final Int2IntOpenHashMap labelCounters;

        Layer(int parent, Int2IntOpenHashMap labelCounters) {
            this.parent = parent;
            this.labelCounters = labelCounters;
        }
    }

    /**
     * Creates an empty world with only the base layer.
     */
    public World() {
        arena.add(new Layer(NO_PARENT, new Int2IntOpenHashMap()));
        top = 0;
    }

    /**
     * Creates a world from stored tiles and units. Units without a label receive one.
     *
     * @param tiles the tiles of the map.
     * @param units the units on the map, at most one per coordinate.
     * @throws WorldStateException if two units share a coordinate.
     */
    public World(Collection<Tile> tiles, Collection<Unit> units) {
        this();
        tiles.forEach(this::putTile);
        for (Unit unit : units) {
            if (unit.label() != null && !unit.label().isEmpty()) {
                reserveLabel(unit.label());
            }
        }
        for (Unit unit : units) {
            if (unitAt(unit.coord()) != null) {
                throw new WorldStateException("Duplicate unit at " + unit.coord());
            }
            addUnit(unit);
        }
    }

    // ---------------------------------------------------------------------
    // Layer management
    // ---------------------------------------------------------------------

    /**
     * Pushes a new overlay layer. All subsequent writes go to it.
     */
    public void push() {
        Layer current = arena.get(top);
        arena.add(new Layer(top, new Int2IntOpenHashMap(current.labelCounters)));
        top = arena.size() - 1;
        LOG.debug("Pushed world layer {}", top);
    }

    /**
     * Discards the topmost layer and every change made in it.
     *
     * @throws WorldStateException if only the base layer remains.
     */
    public void pop() {
        if (top == 0) {
            throw new WorldStateException("Cannot pop the base world layer");
        }
        int parent = arena.get(top).parent;
        arena.remove(top);
        top = parent;
        LOG.debug("Popped world layer, now at {}", top);
    }

    /**
     * Folds the topmost layer into its parent and removes it. Afterwards the parent holds the
     * same merged view the top layer had.
     *
     * @throws WorldStateException if only the base layer remains.
     */
    public void commit() {
        if (top == 0) {
            throw new WorldStateException("Cannot commit the base world layer");
        }
        Layer child = arena.get(top);
        Layer parent = arena.get(child.parent);
        boolean parentIsBase = parent.parent == NO_PARENT;

        for (AxialCoord coord : child.deletedUnits) {
            parent.units.remove(coord);
            if (!parentIsBase) {
                parent.deletedUnits.add(coord);
            }
        }
        parent.units.putAll(child.units);

        for (AxialCoord coord : child.deletedTiles) {
            parent.tiles.remove(coord);
            if (!parentIsBase) {
                parent.deletedTiles.add(coord);
            }
        }
        parent.tiles.putAll(child.tiles);

        parent.labelCounters.clear();
        parent.labelCounters.putAll(child.labelCounters);

        arena.remove(top);
        top = child.parent;
        LOG.debug("Committed world layer into {}", top);
    }

    /**
     * @return the number of overlay layers above the base layer.
     */
    public int depth() {
        int depth = 0;
        for (int i = top; arena.get(i).parent != NO_PARENT; i = arena.get(i).parent) {
            depth++;
        }
        return depth;
    }

    // ---------------------------------------------------------------------
    // Tiles
    // ---------------------------------------------------------------------

    /**
     * @param coord the coordinate to look up.
     * @return the visible tile, or {@code null} if there is none.
     */
    public Tile tileAt(AxialCoord coord) {
        for (int i = top; i != NO_PARENT; i = arena.get(i).parent) {
            Layer layer = arena.get(i);
            Tile tile = layer.tiles.get(coord);
            if (tile != null) {
                return tile;
            }
            if (layer.deletedTiles.contains(coord)) {
                return null;
            }
        }
        return null;
    }

    /**
     * Writes a tile into the topmost layer.
     *
     * @param tile the tile.
     * @return the tile previously visible at the coordinate, or {@code null}.
     */
    public Tile putTile(Tile tile) {
        Tile previous = tileAt(tile.coord());
        arena.get(top).tiles.put(tile.coord(), tile);
        return previous;
    }

    /**
     * Removes the tile visible at a coordinate.
     *
     * @param coord the coordinate.
     * @return the removed tile, or {@code null} if there was none.
     */
    public Tile removeTile(AxialCoord coord) {
        Tile previous = tileAt(coord);
        Layer layer = arena.get(top);
        layer.tiles.remove(coord);
        if (layer.parent != NO_PARENT) {
            layer.deletedTiles.add(coord);
        }
        return previous;
    }

    /**
     * @return all visible tiles, ordered by coordinate.
     */
    public Collection<Tile> tiles() {
        return Collections.unmodifiableCollection(merged(l -> l.tiles, l -> l.deletedTiles).values());
    }

    /**
     * @param coord the center.
     * @return the existing neighboring tiles in {@link HexDirection} order.
     */
    public List<Tile> neighbors(AxialCoord coord) {
        List<Tile> result = new ArrayList<>(6);
        for (AxialCoord neighbor : coord.neighbors()) {
            Tile tile = tileAt(neighbor);
            if (tile != null) {
                result.add(tile);
            }
        }
        return result;
    }

    // ---------------------------------------------------------------------
    // Units
    // ---------------------------------------------------------------------

    /**
     * @param coord the coordinate to look up.
     * @return the visible unit, or {@code null} if there is none.
     */
    public Unit unitAt(AxialCoord coord) {
        for (int i = top; i != NO_PARENT; i = arena.get(i).parent) {
            Layer layer = arena.get(i);
            Unit unit = layer.units.get(coord);
            if (unit != null) {
                return unit;
            }
            if (layer.deletedUnits.contains(coord)) {
                return null;
            }
        }
        return null;
    }

    /**
     * Adds a unit to the topmost layer. A unit already visible at the coordinate is replaced.
     * Units of a real player that carry no label are given the next free one; a given label is
     * reserved so it is never handed out again.
     *
     * @param unit the unit.
     * @return the replaced occupant, or {@code null} if the coordinate was free.
     */
    public Unit addUnit(Unit unit) {
        Unit previous = unitAt(unit.coord());
        Unit stored = unit;
        if ((unit.label() == null || unit.label().isEmpty()) && unit.player() > 0) {
            stored = unit.withLabel(nextUnitLabel(unit.player()));
        } else if (unit.label() != null && !unit.label().isEmpty()) {
            reserveLabel(unit.label());
        }
        arena.get(top).units.put(stored.coord(), stored);
        return previous;
    }

    /**
     * Replaces the state of an existing unit in place.
     *
     * @param unit the updated unit, located at the coordinate of the unit it replaces.
     * @return the stored unit.
     * @throws WorldStateException if no unit is visible at that coordinate.
     */
    public Unit updateUnit(Unit unit) {
        if (unitAt(unit.coord()) == null) {
            throw new WorldStateException("No unit to update at " + unit.coord());
        }
        addUnit(unit);
        return unitAt(unit.coord());
    }

    /**
     * Removes the unit visible at a coordinate. In an overlay layer the removal is recorded as
     * a tombstone so the parent's entry stays hidden.
     *
     * @param coord the coordinate.
     * @return the removed unit, or {@code null} if there was none.
     */
    public Unit removeUnit(AxialCoord coord) {
        Unit previous = unitAt(coord);
        Layer layer = arena.get(top);
        layer.units.remove(coord);
        if (layer.parent != NO_PARENT) {
            layer.deletedUnits.add(coord);
        }
        return previous;
    }

    /**
     * Moves a unit as one remove-then-add in the topmost layer. The given unit supplies the
     * state to store; only its coordinate is changed.
     *
     * @param unit the unit to move, taken from its current coordinate.
     * @param to   the destination.
     * @return the stored unit at the destination.
     * @throws WorldStateException if the unit is not present or the destination is occupied.
     */
    public Unit moveUnit(Unit unit, AxialCoord to) {
        AxialCoord from = unit.coord();
        if (unitAt(from) == null) {
            throw new WorldStateException("No unit to move at " + from);
        }
        if (!from.equals(to) && unitAt(to) != null) {
            throw new WorldStateException("Cannot move unit from " + from + " to occupied " + to);
        }
        removeUnit(from);
        Unit moved = unit.withCoord(to);
        addUnit(moved);
        return unitAt(to);
    }

    /**
     * @return all visible units, ordered by coordinate.
     */
    public Collection<Unit> units() {
        return Collections.unmodifiableCollection(merged(l -> l.units, l -> l.deletedUnits).values());
    }

    /**
     * @return the number of visible units, which equals the number of occupied coordinates.
     */
    public int unitCount() {
        return merged(l -> l.units, l -> l.deletedUnits).size();
    }

    /**
     * @param player the owning player.
     * @return the player's visible units, ordered by coordinate.
     */
    public List<Unit> unitsOf(int player) {
        List<Unit> result = new ArrayList<>();
        for (Unit unit : units()) {
            if (unit.player() == player) {
                result.add(unit);
            }
        }
        return result;
    }

    /**
     * @param label a unit label such as {@code B2}.
     * @return the visible unit with that label, or {@code null}.
     */
    public Unit unitByLabel(String label) {
        for (Unit unit : units()) {
            if (label.equals(unit.label())) {
                return unit;
            }
        }
        return null;
    }

    // ---------------------------------------------------------------------
    // Labels
    // ---------------------------------------------------------------------

    /**
     * Allocates the next label for a player: {@code A1, A2, ...} for player 1, {@code B1, ...}
     * for player 2. Players outside 1..26 get no label.
     *
     * @param player the owning player.
     * @return the label, or an empty string.
     */
    public String nextUnitLabel(int player) {
        if (player <= 0 || player > 26) {
            return "";
        }
        Int2IntOpenHashMap counters = arena.get(top).labelCounters;
        int next = counters.get(player) + 1;
        counters.put(player, next);
        return String.valueOf((char) ('A' + player - 1)) + next;
    }

    /**
     * @return the highest label number handed out so far per player, including numbers of units
     *         that no longer exist.
     */
    public SortedMap<Integer, Integer> labelCounters() {
        SortedMap<Integer, Integer> result = new TreeMap<>();
        for (Int2IntMap.Entry entry : arena.get(top).labelCounters.int2IntEntrySet()) {
            result.put(entry.getIntKey(), entry.getIntValue());
        }
        return result;
    }

    /**
     * Raises the label counters so no number up to the given ones is handed out again.
     *
     * @param counters highest used label number by player.
     */
    public void reserveLabels(Map<Integer, Integer> counters) {
        Int2IntOpenHashMap current = arena.get(top).labelCounters;
        counters.forEach((player, number) -> {
            if (number > current.get((int) player)) {
                current.put((int) player, (int) number);
            }
        });
    }

    private void reserveLabel(String label) {
        char letter = label.charAt(0);
        if (letter < 'A' || letter > 'Z' || label.length() < 2) {
            return;
        }
        try {
            int number = Integer.parseInt(label.substring(1));
            int player = letter - 'A' + 1;
            Int2IntOpenHashMap counters = arena.get(top).labelCounters;
            if (number > counters.get(player)) {
                counters.put(player, number);
            }
        } catch (NumberFormatException e) {
            LOG.debug("Ignoring non-standard unit label '{}'", label);
        }
    }

    private <V> SortedMap<AxialCoord, V> merged(Function<Layer, Map<AxialCoord, V>> entries,
                                                Function<Layer, Set<AxialCoord>> tombstones) {
        SortedMap<AxialCoord, V> result = new TreeMap<>();
        Set<AxialCoord> hidden = new HashSet<>();
        for (int i = top; i != NO_PARENT; i = arena.get(i).parent) {
            Layer layer = arena.get(i);
            for (Map.Entry<AxialCoord, V> entry : entries.apply(layer).entrySet()) {
                if (!hidden.contains(entry.getKey())) {
                    result.putIfAbsent(entry.getKey(), entry.getValue());
                }
            }
            hidden.addAll(tombstones.apply(layer));
        }
        return result;
    }
}
