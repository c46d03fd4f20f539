package org.hexwar.runtime.history;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2IntSortedMap;
import it.unimi.dsi.fastutil.ints.Int2IntSortedMaps;
import org.hexwar.runtime.model.World;
import org.hexwar.runtime.rules.GameSettings;

/**
 * Mutable state of one game: the world, the active player, the turn counter, coin balances,
 * the winner and a version that grows by one with every applied move.
 * <p>
 * Not thread-safe. A game is mutated by one caller at a time; concurrent proposers are
 * separated by the version check of a {@link GameStateRepository}.
 */
public final class GameState {

    private final World world;
    private final Int2IntSortedMap coins;
    private int currentPlayer;
    private int turnCounter;
    private long version;
    private int winner;

    /**
     * @param world         the world of the game.
     * @param currentPlayer the active player (1-based).
     * @param turnCounter   the current turn, starting at 1.
     * @param version       the version of this state.
     * @param coins         coin balance per player.
     * @param winner        the winning player, 0 while the game runs.
     */
    public GameState(World world, int currentPlayer, int turnCounter, long version, Int2IntMap coins, int winner) {
        this.world = world;
        this.currentPlayer = currentPlayer;
        this.turnCounter = turnCounter;
        this.version = version;
        this.coins = new Int2IntRBTreeMap(coins);
        this.winner = winner;
    }

    /**
     * Creates the state of a new game: player 1 to move on turn 1, version 0 and every player
     * holding the starting coins.
     */
    public static GameState initial(World world, GameSettings settings) {
        Int2IntMap coins = new Int2IntRBTreeMap();
        for (int player = 1; player <= settings.playerCount(); player++) {
            coins.put(player, settings.startingCoins());
        }
        return new GameState(world, 1, 1, 0L, coins, 0);
    }

    public World world() {
        return world;
    }

    public int currentPlayer() {
        return currentPlayer;
    }

    public int turnCounter() {
        return turnCounter;
    }

    public long version() {
        return version;
    }

    public int winner() {
        return winner;
    }

    public boolean finished() {
        return winner != 0;
    }

    public int coinsOf(int player) {
        return coins.get(player);
    }

    /**
     * @return a read-only view of the coin balances ordered by player.
     */
    public Int2IntSortedMap coins() {
        return Int2IntSortedMaps.unmodifiable(coins);
    }

    public void setCurrentPlayer(int currentPlayer) {
        this.currentPlayer = currentPlayer;
    }

    public void setTurnCounter(int turnCounter) {
        this.turnCounter = turnCounter;
    }

    public void setCoins(int player, int amount) {
        coins.put(player, amount);
    }

    public void setWinner(int winner) {
        this.winner = winner;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    /**
     * Advances the version by exactly one.
     *
     * @return the new version.
     */
    public long incrementVersion() {
        return ++version;
    }

    /**
     * Copies the scalar state into a working instance that shares the world. Used together with
     * a pushed world layer so that a failed move leaves this instance untouched.
     */
    public GameState fork() {
        return new GameState(world, currentPlayer, turnCounter, version, coins, winner);
    }

    /**
     * Takes over the scalar state of a fork. The version is left alone.
     */
    public void adopt(GameState fork) {
        this.currentPlayer = fork.currentPlayer;
        this.turnCounter = fork.turnCounter;
        this.winner = fork.winner;
        this.coins.clear();
        this.coins.putAll(fork.coins);
    }

    @Override
    public String toString() {
        return "GameState{player=" + currentPlayer + ", turn=" + turnCounter + ", version=" + version
                + ", coins=" + coins + ", winner=" + winner + ", units=" + world.unitCount() + "}";
    }
}
