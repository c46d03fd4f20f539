package org.hexwar.runtime.rules;

/**
 * Per-turn income configuration. A zero value for a base type falls back to the built-in
 * default for that type; {@code gameIncome} is a flat amount every player receives and has
 * no default.
 *
 * @param gameIncome  flat per-turn income.
 * @param landbase    income per owned land base.
 * @param navalbase   income per owned naval base.
 * @param airport     income per owned airport base.
 * @param missilesilo income per owned missile silo.
 * @param mines       income per owned mine.
 */
public record IncomeTable(int gameIncome, int landbase, int navalbase, int airport, int missilesilo, int mines) {

    public static final int LAND_BASE = 1;
    public static final int NAVAL_BASE = 2;
    public static final int AIRPORT_BASE = 3;
    public static final int MISSILE_SILO = 16;
    public static final int MINES = 20;

    public static final int DEFAULT_LANDBASE_INCOME = 100;
    public static final int DEFAULT_NAVALBASE_INCOME = 150;
    public static final int DEFAULT_AIRPORT_INCOME = 200;
    public static final int DEFAULT_MISSILESILO_INCOME = 300;
    public static final int DEFAULT_MINES_INCOME = 500;

    /** An income table with every value unset, so all defaults apply. */
    public static final IncomeTable DEFAULTS = new IncomeTable(0, 0, 0, 0, 0, 0);

    /**
     * @param terrainType the terrain id of an owned tile.
     * @return the per-turn income of that tile, 0 for terrain that generates none.
     */
    public int incomeFor(int terrainType) {
        return switch (terrainType) {
            case LAND_BASE -> orDefault(landbase, DEFAULT_LANDBASE_INCOME);
            case NAVAL_BASE -> orDefault(navalbase, DEFAULT_NAVALBASE_INCOME);
            case AIRPORT_BASE -> orDefault(airport, DEFAULT_AIRPORT_INCOME);
            case MISSILE_SILO -> orDefault(missilesilo, DEFAULT_MISSILESILO_INCOME);
            case MINES -> orDefault(mines, DEFAULT_MINES_INCOME);
            default -> 0;
        };
    }

    private static int orDefault(int configured, int fallback) {
        return configured > 0 ? configured : fallback;
    }
}
