package org.hexwar.runtime.combat;

import java.util.List;

/**
 * Monte Carlo summary of a damage roll, for previews and diagnostics only.
 *
 * @param expected mean damage over all trials.
 * @param min      smallest damage observed.
 * @param max      largest damage observed.
 * @param ranges   probability of every observed damage value, ascending by damage.
 * @param trials   number of trials run.
 */
public record DamageDistribution(double expected, int min, int max, List<DamageRange> ranges, int trials) {

    public DamageDistribution {
        ranges = List.copyOf(ranges);
    }

    /**
     * @return probability of exactly {@code damage}, 0 if never observed.
     */
    public double probabilityOf(int damage) {
        for (DamageRange range : ranges) {
            if (range.damage() == damage) {
                return range.probability();
            }
        }
        return 0.0;
    }
}
