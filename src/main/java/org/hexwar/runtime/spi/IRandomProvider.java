package org.hexwar.runtime.spi;

/**
 * Deterministic random sequence owned by one game. Combat resolution draws from it strictly in
 * call order, so two games seeded identically and fed the same moves produce the same results.
 * <p>
 * Implements {@link ISerializable} so the sequence position can be persisted with the game and
 * restored after a dry run.
 */
public interface IRandomProvider extends ISerializable {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be > 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Creates an independent provider deterministically derived from this provider's seed and
     * the given scope/key. The parent sequence is not advanced.
     *
     * @param scope a stable, descriptive scope name (e.g. "game")
     * @param key   a stable numeric key (e.g. a hash of the game id)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
