package org.hexwar.runtime.combat;

/**
 * Observed probability of one damage value.
 */
public record DamageRange(int damage, double probability) {
}
