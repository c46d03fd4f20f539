package org.hexwar.runtime.movement;

import org.hexwar.runtime.model.AxialCoord;

import java.util.List;

/**
 * A reconstructed route.
 *
 * @param steps     coordinates from the source (inclusive) to the destination (inclusive).
 * @param totalCost accumulated movement cost.
 */
public record Path(List<AxialCoord> steps, double totalCost) {

    public Path {
        steps = List.copyOf(steps);
    }

    public AxialCoord destination() {
        return steps.get(steps.size() - 1);
    }
}
