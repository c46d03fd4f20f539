package org.hexwar.runtime.rules;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Static description of a unit type.
 *
 * @param id             unique unit type id.
 * @param name           display name.
 * @param health         maximum health.
 * @param coins          build cost.
 * @param movementPoints movement budget restored on every refresh.
 * @param retreatPoints  movement budget granted when the step after an attack is a retreat.
 * @param attackRange    maximum attack distance.
 * @param minAttackRange minimum attack distance.
 * @param defense        base defense value.
 * @param unitClass      combat class, e.g. {@code Light} or {@code Heavy}.
 * @param unitTerrain    movement domain: {@code Land}, {@code Water} or {@code Air}.
 * @param splashDamage   number of splash samples per adjacent unit, 0 for none.
 * @param actionOrder    ordered action slots; alternatives within a slot are separated by {@code |}.
 * @param attackVsClass  base attack values keyed by {@code "<class>:<terrain>"} of the target.
 */
public record UnitDefinition(int id,
                             String name,
                             int health,
                             int coins,
                             double movementPoints,
                             double retreatPoints,
                             int attackRange,
                             int minAttackRange,
                             int defense,
                             String unitClass,
                             String unitTerrain,
                             int splashDamage,
                             List<String> actionOrder,
                             Map<String, Integer> attackVsClass) {

    public static final String AIR = "Air";
    public static final List<String> DEFAULT_ACTION_ORDER = List.of("move", "attack|capture");

    public UnitDefinition {
        actionOrder = actionOrder == null || actionOrder.isEmpty() ? DEFAULT_ACTION_ORDER : List.copyOf(actionOrder);
        attackVsClass = attackVsClass == null ? Map.of() : Map.copyOf(attackVsClass);
    }

    /**
     * @param target the defending unit type.
     * @return the base attack value against the target, empty if this unit cannot attack it.
     */
    public OptionalInt attackAgainst(UnitDefinition target) {
        Integer value = attackVsClass.get(target.unitClass() + ":" + target.unitTerrain());
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    /**
     * @return whether the unit flies, which makes it immune to splash damage.
     */
    public boolean airborne() {
        return AIR.equalsIgnoreCase(unitTerrain);
    }
}
