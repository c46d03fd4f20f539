package org.hexwar.runtime.rules;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds rules tables and game settings from HOCON configuration.
 * <p>
 * Expected structure of a rules source:
 * <pre>
 * units = [
 *   { id = 1, name = "Soldier", health = 10, coins = 75, movement-points = 3,
 *     attack-range = 1, defense = 6, unit-class = "Light", unit-terrain = "Land",
 *     attack-vs-class { "Light:Land" = 6 } }
 * ]
 * terrains = [ { id = 1, name = "Land Base", buildable-unit-ids = [1] } ]
 * terrain-unit-properties = [ { terrain = 5, unit = 1, movement-cost = 1, defense-bonus = 0 } ]
 * </pre>
 */
public final class RulesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RulesLoader.class);

    public static final String RULES_RESOURCE_PATH = "hexwar.rules-resource";
    public static final String SETTINGS_PATH = "hexwar.settings";
    public static final String INCOME_PATH = "hexwar.income";

    private RulesLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the rules resource named by {@value #RULES_RESOURCE_PATH} from the classpath.
     *
     * @param config the application configuration.
     * @return the rules table.
     * @throws RulesDefinitionException if the resource is missing or malformed.
     */
    public static RulesTable loadRules(Config config) {
        String resource = config.getString(RULES_RESOURCE_PATH);
        Config rulesConfig = ConfigFactory.parseResources(resource);
        if (rulesConfig.isEmpty()) {
            throw new RulesDefinitionException("Rules resource '" + resource + "' not found or empty");
        }
        LOG.info("Loading rules from classpath resource '{}'", resource);
        return parseRules(rulesConfig.resolve());
    }

    /**
     * @param rulesConfig a config object in the rules format.
     * @return the rules table.
     * @throws RulesDefinitionException if the config is malformed.
     */
    public static RulesTable parseRules(Config rulesConfig) {
        try {
            RulesTable.Builder builder = RulesTable.builder();
            for (Config unit : rulesConfig.getConfigList("units")) {
                builder.unit(parseUnit(unit));
            }
            for (Config terrain : rulesConfig.getConfigList("terrains")) {
                builder.terrain(new TerrainDefinition(
                        terrain.getInt("id"),
                        terrain.getString("name"),
                        terrain.hasPath("buildable-unit-ids")
                                ? new IntArrayList(terrain.getIntList("buildable-unit-ids"))
                                : null));
            }
            if (rulesConfig.hasPath("terrain-unit-properties")) {
                for (Config entry : rulesConfig.getConfigList("terrain-unit-properties")) {
                    builder.terrainUnit(entry.getInt("terrain"), entry.getInt("unit"), new TerrainUnitProperties(
                            optDouble(entry, "movement-cost", 0),
                            optInt(entry, "attack-bonus", 0),
                            optInt(entry, "defense-bonus", 0),
                            optInt(entry, "healing-bonus", 0),
                            entry.hasPath("can-capture") && entry.getBoolean("can-capture")));
                }
            }
            RulesTable table = builder.build();
            LOG.debug("Parsed {} unit and {} terrain definitions", table.unitCount(), table.terrainCount());
            return table;
        } catch (ConfigException e) {
            throw new RulesDefinitionException("Malformed rules configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Reads game settings from {@value #SETTINGS_PATH} and the income table from
     * {@value #INCOME_PATH}.
     *
     * @param config the application configuration.
     * @return the default settings for new games.
     */
    public static GameSettings loadSettings(Config config) {
        Config settings = config.getConfig(SETTINGS_PATH);
        IntSet allowed = null;
        if (settings.hasPath("allowed-units")) {
            allowed = new IntOpenHashSet(settings.getIntList("allowed-units"));
        }
        return new GameSettings(
                settings.getInt("player-count"),
                settings.getInt("starting-coins"),
                settings.getLong("seed"),
                allowed,
                loadIncome(config));
    }

    /**
     * @param config the application configuration.
     * @return the income table, with unset entries left at zero so defaults apply.
     */
    public static IncomeTable loadIncome(Config config) {
        if (!config.hasPath(INCOME_PATH)) {
            return IncomeTable.DEFAULTS;
        }
        Config income = config.getConfig(INCOME_PATH);
        return new IncomeTable(
                optInt(income, "game-income", 0),
                optInt(income, "landbase", 0),
                optInt(income, "navalbase", 0),
                optInt(income, "airport", 0),
                optInt(income, "missilesilo", 0),
                optInt(income, "mines", 0));
    }

    private static UnitDefinition parseUnit(Config unit) {
        Map<String, Integer> attackVsClass = new LinkedHashMap<>();
        if (unit.hasPath("attack-vs-class")) {
            for (Map.Entry<String, ConfigValue> entry : unit.getObject("attack-vs-class").entrySet()) {
                attackVsClass.put(entry.getKey(), ((Number) entry.getValue().unwrapped()).intValue());
            }
        }
        List<String> actionOrder = unit.hasPath("action-order") ? unit.getStringList("action-order") : null;
        return new UnitDefinition(
                unit.getInt("id"),
                unit.getString("name"),
                unit.getInt("health"),
                unit.getInt("coins"),
                unit.getDouble("movement-points"),
                optDouble(unit, "retreat-points", 0),
                unit.getInt("attack-range"),
                optInt(unit, "min-attack-range", 1),
                unit.getInt("defense"),
                unit.getString("unit-class"),
                unit.getString("unit-terrain"),
                optInt(unit, "splash-damage", 0),
                actionOrder,
                attackVsClass);
    }

    private static int optInt(Config config, String path, int fallback) {
        return config.hasPath(path) ? config.getInt(path) : fallback;
    }

    private static double optDouble(Config config, String path, double fallback) {
        return config.hasPath(path) ? config.getDouble(path) : fallback;
    }
}
