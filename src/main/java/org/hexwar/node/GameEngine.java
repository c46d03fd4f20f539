package org.hexwar.node;

import com.typesafe.config.Config;
import org.hexwar.node.config.ConfigLoader;
import org.hexwar.node.config.LoggingConfigurator;
import org.hexwar.runtime.Game;
import org.hexwar.runtime.codec.GameStateSnapshot;
import org.hexwar.runtime.combat.CombatResolver;
import org.hexwar.runtime.combat.DamageDistributionEstimator;
import org.hexwar.runtime.history.GameStateRepository;
import org.hexwar.runtime.internal.services.SeededRandomProvider;
import org.hexwar.runtime.model.Tile;
import org.hexwar.runtime.model.Unit;
import org.hexwar.runtime.model.World;
import org.hexwar.runtime.rules.GameSettings;
import org.hexwar.runtime.rules.RulesLoader;
import org.hexwar.runtime.rules.RulesTable;
import org.hexwar.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Optional;

/**
 * Creates and restores games from configuration. One engine holds one rules table and one set
 * of default settings; any number of games can run side by side since they share nothing
 * mutable.
 */
public final class GameEngine {

    private static final Logger LOG = LoggerFactory.getLogger(GameEngine.class);
    private static final String GAME_SCOPE = "game";

    private final RulesTable rules;
    private final GameSettings defaultSettings;
    private final Config config;

    public GameEngine(Config config) {
        this(config, RulesLoader.loadRules(config), RulesLoader.loadSettings(config));
    }

    public GameEngine(Config config, RulesTable rules, GameSettings defaultSettings) {
        this.config = config;
        this.rules = rules;
        this.defaultSettings = defaultSettings;
    }

    /**
     * Builds an engine from the layered configuration and applies its logging section.
     */
    public static GameEngine fromDefaultConfig() {
        Config config = ConfigLoader.load();
        LoggingConfigurator.configure(config);
        GameEngine engine = new GameEngine(config);
        LOG.info("Game engine ready with {} unit and {} terrain definitions", engine.rules.unitCount(),
                engine.rules.terrainCount());
        return engine;
    }

    public RulesTable rules() {
        return rules;
    }

    public GameSettings defaultSettings() {
        return defaultSettings;
    }

    /**
     * Starts a game with the default settings.
     */
    public Game newGame(String gameId, Collection<Tile> tiles, Collection<Unit> units) {
        return newGame(gameId, defaultSettings, tiles, units);
    }

    /**
     * Starts a game. Its random sequence is derived from the settings' seed and the game id, so
     * games with different ids draw different sequences while each stays reproducible.
     */
    public Game newGame(String gameId, GameSettings settings, Collection<Tile> tiles, Collection<Unit> units) {
        IRandomProvider rng = new SeededRandomProvider(settings.seed()).deriveFor(GAME_SCOPE, gameId.hashCode());
        return Game.create(gameId, rules, settings, new World(tiles, units), rng, estimator());
    }

    /**
     * Restores a stored game with the default settings.
     *
     * @return the game, or empty if the repository has no state for it.
     */
    public Optional<Game> load(GameStateRepository repository, String gameId) {
        return load(repository, gameId, defaultSettings);
    }

    /**
     * Restores a stored game that was started with {@code settings}. Snapshots carry no
     * settings, so a game created through {@link #newGame(String, GameSettings, Collection, Collection)}
     * must be loaded with the same settings it was created with.
     *
     * @return the game, or empty if the repository has no state for it.
     */
    public Optional<Game> load(GameStateRepository repository, String gameId, GameSettings settings) {
        Optional<GameStateSnapshot> snapshot = repository.load(gameId);
        if (snapshot.isEmpty()) {
            LOG.debug("No stored state for game '{}'", gameId);
            return Optional.empty();
        }
        return Optional.of(Game.restore(gameId, rules, settings, snapshot.get(), estimator()));
    }

    private DamageDistributionEstimator estimator() {
        return DamageDistributionEstimator.fromConfig(new CombatResolver(rules), config);
    }
}
