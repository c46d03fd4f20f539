package org.hexwar.runtime.movement;

import org.hexwar.runtime.model.AxialCoord;
import org.hexwar.runtime.model.Tile;
import org.hexwar.runtime.model.Unit;
import org.hexwar.runtime.model.World;
import org.hexwar.runtime.rules.RulesTable;
import org.hexwar.runtime.rules.TerrainUnitProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.PriorityQueue;

/**
 * Minimum-cost movement search over a {@link World}.
 * <p>
 * Runs a Dijkstra expansion from the unit's coordinate. Entering a tile costs the
 * {@link TerrainUnitProperties#effectiveMovementCost()} of the unit type on that terrain;
 * impassable terrain and coordinates without a tile are never entered. Expansion stops when
 * the accumulated cost would exceed the budget.
 * <p>
 * Occupancy has two policies. With pass-through allowed, occupied tiles are costed and expanded
 * like any other but are flagged so they never count as destinations. With pass-through
 * forbidden, occupied tiles block expansion entirely.
 */
public final class MovementPlanner {

    private static final Logger LOG = LoggerFactory.getLogger(MovementPlanner.class);

    private final RulesTable rules;

    public MovementPlanner(RulesTable rules) {
        this.rules = rules;
    }

    private record Frontier(AxialCoord coord, double cost, long sequence) {
    }

    private static final Comparator<Frontier> BY_COST =
            Comparator.comparingDouble(Frontier::cost).thenComparingLong(Frontier::sequence);

    /**
     * Computes the cheapest path to every coordinate reachable within {@code budget}.
     *
     * @param world              the world to search.
     * @param unit               the moving unit.
     * @param budget             available movement points.
     * @param preventPassThrough whether occupied tiles block expansion.
     * @return the reachability map.
     */
    public AllPaths reachable(World world, Unit unit, double budget, boolean preventPassThrough) {
        AxialCoord start = unit.coord();
        Map<String, PathEdge> edges = new LinkedHashMap<>();
        Map<AxialCoord, Double> best = new HashMap<>();
        PriorityQueue<Frontier> queue = new PriorityQueue<>(BY_COST);
        long sequence = 0;

        best.put(start, 0.0);
        queue.add(new Frontier(start, 0.0, sequence++));

        while (!queue.isEmpty()) {
            Frontier current = queue.poll();
            if (current.cost() > best.getOrDefault(current.coord(), Double.MAX_VALUE)) {
                continue; // stale entry
            }
            for (Tile tile : world.neighbors(current.coord())) {
                AxialCoord next = tile.coord();
                if (next.equals(start)) {
                    continue;
                }
                boolean occupied = world.unitAt(next) != null;
                if (occupied && preventPassThrough) {
                    continue;
                }
                TerrainUnitProperties props = rules.terrainUnit(tile.terrainType(), unit.unitType());
                if (props.impassable()) {
                    continue;
                }
                double stepCost = props.effectiveMovementCost();
                double total = current.cost() + stepCost;
                if (total > budget) {
                    continue;
                }
                Double known = best.get(next);
                if (known == null || total < known) {
                    best.put(next, total);
                    queue.add(new Frontier(next, total, sequence++));
                    edges.put(next.key(), new PathEdge(current.coord(), next, stepCost, total, occupied));
                }
            }
        }
        LOG.debug("Unit {} at {} reaches {} coordinates with budget {}", unit.label(), start, edges.size(), budget);
        return new AllPaths(start, edges);
    }

    /**
     * Finds the cheapest legal route to a destination within the unit's remaining budget.
     *
     * @param world              the world to search.
     * @param unit               the moving unit.
     * @param destination        the target coordinate.
     * @param preventPassThrough whether occupied tiles block expansion.
     * @return the route, or empty if the destination is unreachable or occupied.
     */
    public Optional<Path> findPathTo(World world, Unit unit, AxialCoord destination, boolean preventPassThrough) {
        AllPaths paths = reachable(world, unit, unit.distanceLeft(), preventPassThrough);
        if (!paths.canEndAt(destination)) {
            return Optional.empty();
        }
        return paths.pathTo(destination);
    }

    /**
     * @return the cost for a unit type to enter the tile at {@code coord}, empty if it cannot.
     */
    public OptionalDouble entryCost(World world, int unitType, AxialCoord coord) {
        Tile tile = world.tileAt(coord);
        if (tile == null) {
            return OptionalDouble.empty();
        }
        TerrainUnitProperties props = rules.terrainUnit(tile.terrainType(), unitType);
        return props.impassable() ? OptionalDouble.empty() : OptionalDouble.of(props.effectiveMovementCost());
    }
}
