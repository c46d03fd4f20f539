package org.hexwar.runtime.combat;

import org.hexwar.runtime.model.Tile;
import org.hexwar.runtime.model.Unit;

/**
 * Inputs of one damage roll.
 *
 * @param attacker       the unit dealing damage.
 * @param attackerTile   the tile the attacker stands on.
 * @param attackerHealth health the attacker rolls with.
 * @param defender       the unit receiving damage.
 * @param defenderTile   the tile the defender stands on.
 * @param woundBonus     additive bonus from the defender's attack history.
 */
public record CombatContext(Unit attacker,
                            Tile attackerTile,
                            int attackerHealth,
                            Unit defender,
                            Tile defenderTile,
                            int woundBonus) {
}
