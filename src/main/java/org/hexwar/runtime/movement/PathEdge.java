package org.hexwar.runtime.movement;

import org.hexwar.runtime.model.AxialCoord;

/**
 * The cheapest known step into a coordinate.
 *
 * @param from      predecessor coordinate.
 * @param to        the reached coordinate.
 * @param moveCost  cost of this single step.
 * @param totalCost accumulated cost from the source.
 * @param occupied  whether a unit stands on {@code to}; such coordinates can be passed through
 *                  but are never valid destinations.
 */
public record PathEdge(AxialCoord from, AxialCoord to, double moveCost, double totalCost, boolean occupied) {
}
