package org.hexwar.runtime.model;

/**
 * One attack a unit received during the current activation cycle.
 *
 * @param q      column the attack came from.
 * @param r      row the attack came from.
 * @param ranged whether the attacker stood two or more hexes away.
 * @param turn   turn on which the attack happened.
 */
public record AttackRecord(int q, int r, boolean ranged, int turn) {

    public AxialCoord coord() {
        return new AxialCoord(q, r);
    }
}
