package org.hexwar.runtime.codec;

import org.hexwar.runtime.history.GameState;
import org.hexwar.runtime.model.Tile;
import org.hexwar.runtime.model.Unit;
import org.hexwar.runtime.model.World;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntRBTreeMap;

import java.util.Arrays;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Persisted shape of a game: the scalar state, tiles and units keyed by {@code "q,r"}, coin
 * balances and the position of the combat random sequence.
 *
 * @param currentPlayer the active player.
 * @param turnCounter   the current turn.
 * @param version       the state version.
 * @param winner        the winner, 0 while the game runs.
 * @param tiles         tiles by coordinate key.
 * @param units         units by coordinate key.
 * @param coins         coin balance by player.
 * @param labelCounters highest unit label number handed out per player.
 * @param rngState      serialized random sequence, or {@code null} when not captured.
 */
public record GameStateSnapshot(int currentPlayer,
                                int turnCounter,
                                long version,
                                int winner,
                                SortedMap<String, Tile> tiles,
                                SortedMap<String, Unit> units,
                                SortedMap<Integer, Integer> coins,
                                SortedMap<Integer, Integer> labelCounters,
                                byte[] rngState) {

    public GameStateSnapshot {
        tiles = Collections.unmodifiableSortedMap(new TreeMap<>(tiles));
        units = Collections.unmodifiableSortedMap(new TreeMap<>(units));
        coins = Collections.unmodifiableSortedMap(new TreeMap<>(coins));
        labelCounters = labelCounters == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(labelCounters));
        rngState = rngState == null ? null : rngState.clone();
    }

    /**
     * Captures the current merged view of a game state.
     *
     * @param state    the state.
     * @param rngState the serialized random sequence, may be {@code null}.
     */
    public static GameStateSnapshot of(GameState state, byte[] rngState) {
        World world = state.world();
        SortedMap<String, Tile> tiles = new TreeMap<>();
        for (Tile tile : world.tiles()) {
            tiles.put(tile.coord().key(), tile);
        }
        SortedMap<String, Unit> units = new TreeMap<>();
        for (Unit unit : world.units()) {
            units.put(unit.coord().key(), unit);
        }
        SortedMap<Integer, Integer> coins = new TreeMap<>();
        for (Int2IntMap.Entry entry : state.coins().int2IntEntrySet()) {
            coins.put(entry.getIntKey(), entry.getIntValue());
        }
        return new GameStateSnapshot(state.currentPlayer(), state.turnCounter(), state.version(), state.winner(),
                tiles, units, coins, world.labelCounters(), rngState);
    }

    /**
     * Builds a fresh game state with a new world from this snapshot.
     */
    public GameState toGameState() {
        World world = new World(tiles.values(), units.values());
        world.reserveLabels(labelCounters);
        Int2IntMap balances = new Int2IntRBTreeMap();
        coins.forEach(balances::put);
        return new GameState(world, currentPlayer, turnCounter, version, balances, winner);
    }

    /**
     * @return this snapshot without the random sequence, for comparing world state only.
     */
    public GameStateSnapshot withoutRngState() {
        return new GameStateSnapshot(currentPlayer, turnCounter, version, winner, tiles, units, coins, labelCounters,
                null);
    }

    @Override
    public byte[] rngState() {
        return rngState == null ? null : rngState.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GameStateSnapshot other)) {
            return false;
        }
        return currentPlayer == other.currentPlayer
                && turnCounter == other.turnCounter
                && version == other.version
                && winner == other.winner
                && tiles.equals(other.tiles)
                && units.equals(other.units)
                && coins.equals(other.coins)
                && labelCounters.equals(other.labelCounters)
                && Arrays.equals(rngState, other.rngState);
    }

    @Override
    public int hashCode() {
        return Objects.hash(currentPlayer, turnCounter, version, winner, tiles, units, coins, labelCounters)
                * 31 + Arrays.hashCode(rngState);
    }

    @Override
    public String toString() {
        return "GameStateSnapshot{player=" + currentPlayer + ", turn=" + turnCounter + ", version=" + version
                + ", winner=" + winner + ", tiles=" + tiles.size() + ", units=" + units.size() + ", coins=" + coins + "}";
    }
}
