package org.hexwar.runtime.movement;

import org.hexwar.runtime.model.AxialCoord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of a reachability search: the cheapest edge into every coordinate the unit can
 * reach within its budget, keyed by {@link AxialCoord#key()}.
 */
public final class AllPaths {

    private final AxialCoord source;
    private final Map<String, PathEdge> edges;

    AllPaths(AxialCoord source, Map<String, PathEdge> edges) {
        this.source = source;
        this.edges = Collections.unmodifiableMap(edges);
    }

    public AxialCoord source() {
        return source;
    }

    /**
     * @return every reached coordinate including occupied pass-through ones, in discovery order.
     */
    public Map<String, PathEdge> edges() {
        return edges;
    }

    public Optional<PathEdge> edgeTo(AxialCoord coord) {
        return Optional.ofNullable(edges.get(coord.key()));
    }

    /**
     * @return whether the coordinate is a legal terminal destination.
     */
    public boolean canEndAt(AxialCoord coord) {
        PathEdge edge = edges.get(coord.key());
        return edge != null && !edge.occupied();
    }

    /**
     * @return the legal terminal destinations, in discovery order.
     */
    public List<AxialCoord> destinations() {
        List<AxialCoord> result = new ArrayList<>();
        for (PathEdge edge : edges.values()) {
            if (!edge.occupied()) {
                result.add(edge.to());
            }
        }
        return result;
    }

    /**
     * Walks predecessor edges back to the source.
     *
     * @param destination a reached coordinate.
     * @return the route, or empty if the coordinate was not reached.
     */
    public Optional<Path> pathTo(AxialCoord destination) {
        PathEdge last = edges.get(destination.key());
        if (last == null) {
            return Optional.empty();
        }
        List<AxialCoord> steps = new ArrayList<>();
        AxialCoord current = destination;
        while (!current.equals(source)) {
            steps.add(current);
            PathEdge edge = edges.get(current.key());
            if (edge == null || steps.size() > edges.size()) {
                throw new IllegalStateException("Broken predecessor chain at " + current);
            }
            current = edge.from();
        }
        steps.add(source);
        Collections.reverse(steps);
        return Optional.of(new Path(steps, last.totalCost()));
    }
}
