package org.hexwar.runtime.model;

/**
 * The six hex directions. Declaration order is the neighbor order used throughout the engine
 * (splash damage, planner expansion, neighbor queries).
 */
public enum HexDirection {
    LEFT(-1, 0),
    TOP_LEFT(0, -1),
    TOP_RIGHT(1, -1),
    RIGHT(1, 0),
    BOTTOM_RIGHT(0, 1),
    BOTTOM_LEFT(-1, 1);

    private final int dq;
    private final int dr;

    HexDirection(int dq, int dr) {
        this.dq = dq;
        this.dr = dr;
    }

    public int dq() {
        return dq;
    }

    public int dr() {
        return dr;
    }

    /**
     * @return the direction pointing the other way.
     */
    public HexDirection opposite() {
        return values()[(ordinal() + 3) % 6];
    }
}
