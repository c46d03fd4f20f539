package org.hexwar.runtime.combat;

import com.typesafe.config.Config;
import org.apache.commons.math3.stat.Frequency;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.hexwar.runtime.internal.services.SeededRandomProvider;
import org.hexwar.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Estimates the damage distribution of an attack by running many independent rolls.
 * <p>
 * Every estimate uses a fresh provider seeded with the configured diagnostic seed, so results
 * are reproducible and a game's own random sequence is never consumed.
 */
public final class DamageDistributionEstimator {

    public static final int DEFAULT_TRIALS = 10_000;
    public static final long DEFAULT_SEED = 12345L;

    private final CombatResolver resolver;
    private final int trials;
    private final long seed;

    public DamageDistributionEstimator(CombatResolver resolver) {
        this(resolver, DEFAULT_TRIALS, DEFAULT_SEED);
    }

    /**
     * @param resolver the resolver whose formula is sampled.
     * @param trials   number of rolls per estimate, must be positive.
     * @param seed     seed of the private diagnostic sequence.
     */
    public DamageDistributionEstimator(CombatResolver resolver, int trials, long seed) {
        if (trials <= 0) {
            throw new IllegalArgumentException("Trials must be positive: " + trials);
        }
        this.resolver = resolver;
        this.trials = trials;
        this.seed = seed;
    }

    /**
     * Creates an estimator from {@code hexwar.combat.distribution-trials} and
     * {@code hexwar.combat.distribution-seed}.
     */
    public static DamageDistributionEstimator fromConfig(CombatResolver resolver, Config config) {
        return new DamageDistributionEstimator(resolver,
                config.getInt("hexwar.combat.distribution-trials"),
                config.getLong("hexwar.combat.distribution-seed"));
    }

    /**
     * @param context the attack to sample.
     * @return the observed distribution.
     * @throws IllegalArgumentException if the attacker cannot attack the defender.
     */
    public DamageDistribution estimate(CombatContext context) {
        double p = resolver.hitProbability(context);
        IRandomProvider rng = new SeededRandomProvider(seed);
        Frequency frequency = new Frequency();
        SummaryStatistics stats = new SummaryStatistics();

        for (int i = 0; i < trials; i++) {
            int damage = CombatResolver.rollDamage(p, context.attackerHealth(), rng);
            frequency.addValue(damage);
            stats.addValue(damage);
        }

        List<DamageRange> ranges = new ArrayList<>();
        Iterator<Map.Entry<Comparable<?>, Long>> entries = frequency.entrySetIterator();
        while (entries.hasNext()) {
            Map.Entry<Comparable<?>, Long> entry = entries.next();
            int damage = ((Long) entry.getKey()).intValue();
            ranges.add(new DamageRange(damage, (double) entry.getValue() / trials));
        }
        return new DamageDistribution(stats.getMean(), (int) stats.getMin(), (int) stats.getMax(), ranges, trials);
    }
}
