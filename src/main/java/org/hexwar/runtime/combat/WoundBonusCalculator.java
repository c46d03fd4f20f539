package org.hexwar.runtime.combat;

import org.hexwar.runtime.model.AttackRecord;
import org.hexwar.runtime.model.AxialCoord;
import org.hexwar.runtime.model.Unit;

/**
 * Computes the wound bonus a new attack gets from the defender's attack history.
 * <p>
 * No history gives 0. A ranged attack (distance two or more) adds 1 for every earlier attack.
 * An adjacent attack adds, per earlier attack: 1 if that attack was ranged, 1 if it came from
 * a hex next to the current attacker, 3 if it came from the hex directly opposite, 2 otherwise.
 */
public final class WoundBonusCalculator {

    private WoundBonusCalculator() {
    }

    /**
     * @param defender      the defending unit with its attack history.
     * @param attackerCoord where the current attack comes from.
     * @return the wound bonus.
     */
    public static int woundBonus(Unit defender, AxialCoord attackerCoord) {
        if (defender.attackHistory().isEmpty()) {
            return 0;
        }
        AxialCoord defenderCoord = defender.coord();
        boolean currentRanged = attackerCoord.distanceTo(defenderCoord) >= 2;

        int bonus = 0;
        for (AttackRecord previous : defender.attackHistory()) {
            if (currentRanged || previous.ranged()) {
                bonus += 1;
            } else if (previous.coord().distanceTo(attackerCoord) == 1) {
                bonus += 1;
            } else if (opposite(defenderCoord, previous.coord(), attackerCoord)) {
                bonus += 3;
            } else {
                bonus += 2;
            }
        }
        return bonus;
    }

    private static boolean opposite(AxialCoord center, AxialCoord a, AxialCoord b) {
        return a.q() - center.q() == -(b.q() - center.q())
                && a.r() - center.r() == -(b.r() - center.r());
    }
}
