package org.hexwar.runtime.combat;

import com.typesafe.config.ConfigFactory;
import org.hexwar.junit.extensions.logging.LogWatchExtension;
import org.hexwar.runtime.model.Tile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.hexwar.runtime.HexwarFixtures.GRASS;
import static org.hexwar.runtime.HexwarFixtures.HELICOPTER;
import static org.hexwar.runtime.HexwarFixtures.SOLDIER;
import static org.hexwar.runtime.HexwarFixtures.TANK;
import static org.hexwar.runtime.HexwarFixtures.rules;
import static org.hexwar.runtime.HexwarFixtures.unit;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class DamageDistributionEstimatorTest {

    private CombatResolver resolver;
    private CombatContext evenMatch;

    @BeforeEach
    void setUp() {
        resolver = new CombatResolver(rules());
        evenMatch = new CombatContext(unit(0, 0, 1, SOLDIER), Tile.of(0, 0, GRASS, 0), 10,
                unit(1, 0, 2, SOLDIER), Tile.of(1, 0, GRASS, 0), 0);
    }

    @Test
    @DisplayName("Distribution is normalized")
    void distributionIsNormalized() {
        DamageDistribution distribution = new DamageDistributionEstimator(resolver, 2000, 7L).estimate(evenMatch);

        assertThat(distribution.trials()).isEqualTo(2000);
        assertThat(distribution.ranges().stream().mapToDouble(DamageRange::probability).sum())
                .isCloseTo(1.0, within(1e-9));
        assertThat(distribution.min()).isGreaterThanOrEqualTo(0);
        assertThat(distribution.max()).isLessThanOrEqualTo(10);
        assertThat(distribution.expected()).isBetween(3.5, 5.5);
    }

    @Test
    @DisplayName("Same seed gives same estimate")
    void sameSeedGivesSameEstimate() {
        DamageDistributionEstimator estimator = new DamageDistributionEstimator(resolver, 500, 99L);

        assertThat(estimator.estimate(evenMatch)).isEqualTo(estimator.estimate(evenMatch));
    }

    @Test
    @DisplayName("Stronger attacker expects more damage")
    void strongerAttackerExpectsMoreDamage() {
        DamageDistributionEstimator estimator = new DamageDistributionEstimator(resolver, 1000, 1L);
        CombatContext tankAttack = new CombatContext(unit(0, 0, 1, TANK), Tile.of(0, 0, GRASS, 0), 10,
                unit(1, 0, 2, SOLDIER), Tile.of(1, 0, GRASS, 0), 0);

        assertThat(estimator.estimate(tankAttack).expected()).isGreaterThan(estimator.estimate(evenMatch).expected());
    }

    @Test
    @DisplayName("Configured trials are used")
    void configuredTrialsAreUsed() {
        DamageDistributionEstimator estimator = DamageDistributionEstimator.fromConfig(resolver,
                ConfigFactory.parseString("hexwar.combat { distribution-trials = 123, distribution-seed = 5 }"));

        assertThat(estimator.estimate(evenMatch).trials()).isEqualTo(123);
    }

    @Test
    @DisplayName("Invalid inputs are rejected")
    void invalidInputsAreRejected() {
        assertThatThrownBy(() -> new DamageDistributionEstimator(resolver, 0, 1L))
                .isInstanceOf(IllegalArgumentException.class);
        CombatContext impossible = new CombatContext(unit(0, 0, 1, SOLDIER), null, 10,
                unit(1, 0, 2, HELICOPTER), null, 0);
        assertThatThrownBy(() -> new DamageDistributionEstimator(resolver).estimate(impossible))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
