package org.hexwar.runtime.combat;

import org.hexwar.runtime.model.Unit;

/**
 * A unit adjacent to a combat target and the splash damage it takes.
 */
public record SplashDamageTarget(Unit unit, int damage) {
}
