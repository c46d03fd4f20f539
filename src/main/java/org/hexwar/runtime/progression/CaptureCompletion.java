package org.hexwar.runtime.progression;

import org.hexwar.runtime.model.Tile;
import org.hexwar.runtime.model.Unit;

/**
 * A capture that finished during a refresh.
 *
 * @param unit     the capturing unit after its refresh.
 * @param previous the tile before the ownership flip.
 * @param updated  the tile after the ownership flip.
 */
public record CaptureCompletion(Unit unit, Tile previous, Tile updated) {
}
