package org.hexwar.runtime.model;

/**
 * An immutable map tile.
 *
 * @param q             column of the tile.
 * @param r             row of the tile.
 * @param terrainType   id of the terrain definition.
 * @param player        owning player, 0 for neutral.
 * @param label         optional short label, may be {@code null}.
 * @param lastActedTurn last turn on which the tile produced a unit, 0 if never.
 */
public record Tile(int q, int r, int terrainType, int player, String label, int lastActedTurn) {

    /**
     * Creates a tile with no label that has never acted.
     */
    public static Tile of(int q, int r, int terrainType, int player) {
        return new Tile(q, r, terrainType, player, null, 0);
    }

    public AxialCoord coord() {
        return new AxialCoord(q, r);
    }

    public Tile withPlayer(int newPlayer) {
        return new Tile(q, r, terrainType, newPlayer, label, lastActedTurn);
    }

    public Tile withLastActedTurn(int turn) {
        return new Tile(q, r, terrainType, player, label, turn);
    }

    public Tile withLabel(String newLabel) {
        return new Tile(q, r, terrainType, player, newLabel, lastActedTurn);
    }
}
