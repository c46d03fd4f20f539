package org.hexwar.runtime.combat;

import org.hexwar.runtime.model.AxialCoord;
import org.hexwar.runtime.model.Tile;
import org.hexwar.runtime.model.Unit;
import org.hexwar.runtime.model.World;
import org.hexwar.runtime.rules.RulesTable;
import org.hexwar.runtime.rules.TerrainDefinition;
import org.hexwar.runtime.rules.UnitDefinition;
import org.hexwar.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Hit-probability formula and seeded damage rolls.
 * <p>
 * The hit probability is {@code p = 0.05 * ((A + Ta) - (D + Td) + B) + 0.5}, clamped to [0, 1],
 * where A is the attacker's base attack against the defender's class and terrain, Ta and Td
 * are the terrain bonuses of attacker and defender, D is the defender's base defense and B the
 * wound bonus.
 * <p>
 * A damage roll draws six doubles per attacker health point from the supplied
 * {@link IRandomProvider}; every draw below {@code p} is a hit and the damage is
 * {@code floor(hits / 6)}, never more than the attacker's health. The number and order of draws
 * depend only on the inputs, which keeps replays deterministic.
 */
public final class CombatResolver {

    private static final Logger LOG = LoggerFactory.getLogger(CombatResolver.class);

    /** Draws per attacker health point. */
    public static final int DICE_PER_HEALTH = 6;
    /** Splash damage is only applied when the summed amount exceeds this value. */
    public static final int SPLASH_THRESHOLD = 4;

    private final RulesTable rules;

    public CombatResolver(RulesTable rules) {
        this.rules = rules;
    }

    public RulesTable rules() {
        return rules;
    }

    /**
     * The clamped hit-probability formula.
     *
     * @param attack       base attack value A.
     * @param attackBonus  attacker terrain bonus Ta.
     * @param defense      base defense value D.
     * @param defenseBonus defender terrain bonus Td.
     * @param woundBonus   wound bonus B.
     * @return the probability in [0, 1].
     */
    public static double hitProbability(int attack, int attackBonus, int defense, int defenseBonus, int woundBonus) {
        double p = 0.05 * (((attack + attackBonus) - (defense + defenseBonus)) + woundBonus) + 0.5;
        return Math.max(0.0, Math.min(1.0, p));
    }

    /**
     * @param context the combat inputs.
     * @return the hit probability of the attacker against the defender.
     * @throws IllegalArgumentException if the attacker cannot attack the defender's class at all.
     * @throws org.hexwar.runtime.rules.RulesDefinitionException if a unit or terrain is undefined.
     */
    public double hitProbability(CombatContext context) {
        UnitDefinition attackerDef = rules.unit(context.attacker().unitType());
        UnitDefinition defenderDef = rules.unit(context.defender().unitType());
        OptionalInt attack = attackerDef.attackAgainst(defenderDef);
        if (attack.isEmpty()) {
            throw new IllegalArgumentException(attackerDef.name() + " cannot attack "
                    + defenderDef.unitClass() + ":" + defenderDef.unitTerrain());
        }
        int ta = 0;
        if (context.attackerTile() != null) {
            TerrainDefinition terrain = rules.terrain(context.attackerTile().terrainType());
            ta = rules.terrainUnit(terrain.id(), attackerDef.id()).attackBonus();
        }
        int td = 0;
        if (context.defenderTile() != null) {
            TerrainDefinition terrain = rules.terrain(context.defenderTile().terrainType());
            td = rules.terrainUnit(terrain.id(), defenderDef.id()).defenseBonus();
        }
        return hitProbability(attack.getAsInt(), ta, defenderDef.defense(), td, context.woundBonus());
    }

    /**
     * Rolls damage once, advancing {@code rng} by exactly {@code 6 * attackerHealth} draws.
     *
     * @param context the combat inputs.
     * @param rng     the random sequence to draw from.
     * @return the damage dealt.
     */
    public int rollDamage(CombatContext context, IRandomProvider rng) {
        return rollDamage(hitProbability(context), context.attackerHealth(), rng);
    }

    static int rollDamage(double p, int attackerHealth, IRandomProvider rng) {
        int hits = 0;
        for (int h = 0; h < attackerHealth; h++) {
            for (int d = 0; d < DICE_PER_HEALTH; d++) {
                if (rng.nextDouble() < p) {
                    hits++;
                }
            }
        }
        return Math.min(hits / DICE_PER_HEALTH, attackerHealth);
    }

    /**
     * Whether {@code attacker} may attack {@code target} from where both stand: they belong to
     * different players, the attacker has an attack value against the target's class and the
     * distance lies within the attacker's range.
     */
    public boolean canAttack(Unit attacker, Unit target) {
        if (attacker.player() == target.player()) {
            return false;
        }
        UnitDefinition attackerDef = rules.unit(attacker.unitType());
        UnitDefinition targetDef = rules.unit(target.unitType());
        if (attackerDef.attackAgainst(targetDef).isEmpty()) {
            return false;
        }
        int distance = attacker.coord().distanceTo(target.coord());
        return distance >= Math.max(1, attackerDef.minAttackRange()) && distance <= attackerDef.attackRange();
    }

    /**
     * @return coordinates of every unit the given unit can attack from its position.
     */
    public List<AxialCoord> attackTargets(World world, Unit unit) {
        UnitDefinition definition = rules.unit(unit.unitType());
        List<AxialCoord> targets = new ArrayList<>();
        for (AxialCoord coord : unit.coord().range(definition.attackRange())) {
            Unit target = world.unitAt(coord);
            if (target != null && !coord.equals(unit.coord()) && canAttack(unit, target)) {
                targets.add(coord);
            }
        }
        return targets;
    }

    /**
     * Rolls splash damage for the units adjacent to a combat target, in neighbor order.
     * Airborne units are immune, the attacker itself is skipped and friendly units are not
     * exempt. Each target takes {@code splashDamage} rolls without wound bonus; the sum is kept
     * only when it exceeds {@link #SPLASH_THRESHOLD}.
     *
     * @param world         the world after primary damage was applied.
     * @param attacker      the surviving attacker.
     * @param defenderCoord where the primary target stood.
     * @param rng           the game's random sequence.
     * @return the targets that take damage.
     */
    public List<SplashDamageTarget> rollSplash(World world, Unit attacker, AxialCoord defenderCoord, IRandomProvider rng) {
        UnitDefinition attackerDef = rules.unit(attacker.unitType());
        if (attackerDef.splashDamage() <= 0) {
            return List.of();
        }
        Tile attackerTile = world.tileAt(attacker.coord());
        List<SplashDamageTarget> targets = new ArrayList<>();
        for (AxialCoord coord : defenderCoord.neighbors()) {
            Unit target = world.unitAt(coord);
            if (target == null || coord.equals(attacker.coord())) {
                continue;
            }
            UnitDefinition targetDef = rules.unit(target.unitType());
            if (targetDef.airborne() || attackerDef.attackAgainst(targetDef).isEmpty()) {
                continue;
            }
            Tile targetTile = world.tileAt(coord);
            if (targetTile == null) {
                continue;
            }
            CombatContext context = new CombatContext(attacker, attackerTile, attacker.health(), target, targetTile, 0);
            int total = 0;
            for (int i = 0; i < attackerDef.splashDamage(); i++) {
                total += rollDamage(context, rng);
            }
            if (total > SPLASH_THRESHOLD) {
                targets.add(new SplashDamageTarget(target, total));
            } else {
                LOG.debug("Splash on {} at {} rolled {}, below threshold", target.label(), coord, total);
            }
        }
        return targets;
    }
}
