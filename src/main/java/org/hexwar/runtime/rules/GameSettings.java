package org.hexwar.runtime.rules;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;

/**
 * Per-game settings chosen at game creation.
 *
 * @param playerCount   number of players taking turns (1-based ids).
 * @param startingCoins coins each player starts with.
 * @param seed          seed of the game's combat random sequence.
 * @param allowedUnits  unit types that may be built, or {@code null} for no restriction.
 * @param income        income configuration.
 */
public record GameSettings(int playerCount, int startingCoins, long seed, IntSet allowedUnits, IncomeTable income) {

    public static final int DEFAULT_STARTING_COINS = 300;

    public GameSettings {
        if (playerCount < 1) {
            throw new IllegalArgumentException("A game needs at least one player, got " + playerCount);
        }
        allowedUnits = allowedUnits == null ? null : IntSets.unmodifiable(new IntOpenHashSet(allowedUnits));
        income = income == null ? IncomeTable.DEFAULTS : income;
    }

    /**
     * Settings with default coins, no unit restriction and default income.
     */
    public static GameSettings of(int playerCount, long seed) {
        return new GameSettings(playerCount, DEFAULT_STARTING_COINS, seed, null, IncomeTable.DEFAULTS);
    }

    /**
     * @param unitType a unit type.
     * @return whether this game permits building it.
     */
    public boolean allows(int unitType) {
        return allowedUnits == null || allowedUnits.contains(unitType);
    }

    public GameSettings withIncome(IncomeTable table) {
        return new GameSettings(playerCount, startingCoins, seed, allowedUnits, table);
    }

    public GameSettings withAllowedUnits(IntSet units) {
        return new GameSettings(playerCount, startingCoins, seed, units, income);
    }

    public GameSettings withSeed(long newSeed) {
        return new GameSettings(playerCount, startingCoins, newSeed, allowedUnits, income);
    }
}
