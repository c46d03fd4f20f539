package org.hexwar.runtime;

import org.hexwar.runtime.codec.GameStateSnapshot;
import org.hexwar.runtime.combat.CombatContext;
import org.hexwar.runtime.combat.DamageDistribution;
import org.hexwar.runtime.combat.DamageDistributionEstimator;
import org.hexwar.runtime.combat.WoundBonusCalculator;
import org.hexwar.runtime.history.GameState;
import org.hexwar.runtime.history.GameStateRepository;
import org.hexwar.runtime.history.History;
import org.hexwar.runtime.history.MoveGroup;
import org.hexwar.runtime.history.VersionConflictException;
import org.hexwar.runtime.internal.services.SeededRandomProvider;
import org.hexwar.runtime.model.AxialCoord;
import org.hexwar.runtime.model.Unit;
import org.hexwar.runtime.model.World;
import org.hexwar.runtime.moves.GameOptions;
import org.hexwar.runtime.moves.IllegalMoveException;
import org.hexwar.runtime.moves.Move;
import org.hexwar.runtime.moves.MoveProcessor;
import org.hexwar.runtime.moves.MoveResult;
import org.hexwar.runtime.moves.OptionsService;
import org.hexwar.runtime.rules.GameSettings;
import org.hexwar.runtime.rules.RulesTable;
import org.hexwar.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * One running game: its rules, state, random sequence and history.
 * <p>
 * Moves submitted together in {@link #apply(List)} form one history group and are applied all
 * or nothing. Not thread-safe; callers serialize access per game.
 */
public final class Game {

    private static final Logger LOG = LoggerFactory.getLogger(Game.class);

    private final String id;
    private final RulesTable rules;
    private final GameSettings settings;
    private final GameState state;
    private final IRandomProvider rng;
    private final MoveProcessor processor;
    private final OptionsService options;
    private final DamageDistributionEstimator estimator;
    private final History history = new History();
    private long storedVersion;

    private Game(String id, RulesTable rules, GameSettings settings, GameState state, IRandomProvider rng,
                 DamageDistributionEstimator estimator) {
        this.id = id;
        this.rules = rules;
        this.settings = settings;
        this.state = state;
        this.rng = rng;
        this.processor = new MoveProcessor(rules, settings);
        this.options = new OptionsService(processor);
        this.estimator = estimator != null ? estimator : new DamageDistributionEstimator(processor.combat());
        this.storedVersion = state.version();
    }

    /**
     * Starts a new game whose random sequence is seeded from the settings.
     */
    public static Game create(String id, RulesTable rules, GameSettings settings, World world) {
        return create(id, rules, settings, world, new SeededRandomProvider(settings.seed()), null);
    }

    /**
     * Starts a new game.
     *
     * @param id        the game id.
     * @param rules     the rules table.
     * @param settings  the game settings.
     * @param world     the initial map and units.
     * @param rng       the game's random sequence.
     * @param estimator estimator for damage previews, or {@code null} for the default.
     */
    public static Game create(String id, RulesTable rules, GameSettings settings, World world,
                              IRandomProvider rng, DamageDistributionEstimator estimator) {
        Game game = new Game(id, rules, settings, GameState.initial(world, settings), rng, estimator);
        LOG.info("Created game '{}' with {} players, {} tiles and {} units",
                id, settings.playerCount(), world.tiles().size(), world.unitCount());
        return game;
    }

    /**
     * Restores a game from a stored snapshot. The history starts empty.
     *
     * @throws IllegalArgumentException if the snapshot carries no random sequence state.
     */
    public static Game restore(String id, RulesTable rules, GameSettings settings, GameStateSnapshot snapshot,
                               DamageDistributionEstimator estimator) {
        byte[] rngState = snapshot.rngState();
        if (rngState == null) {
            throw new IllegalArgumentException("Snapshot of game '" + id + "' has no random sequence state");
        }
        IRandomProvider rng = new SeededRandomProvider(settings.seed());
        rng.loadState(rngState);
        Game game = new Game(id, rules, settings, snapshot.toGameState(), rng, estimator);
        LOG.info("Restored game '{}' at version {}", id, snapshot.version());
        return game;
    }

    public String id() {
        return id;
    }

    public RulesTable rules() {
        return rules;
    }

    public GameSettings settings() {
        return settings;
    }

    public GameState state() {
        return state;
    }

    public World world() {
        return state.world();
    }

    public History history() {
        return history;
    }

    public MoveProcessor processor() {
        return processor;
    }

    /**
     * Applies moves as one group.
     *
     * @see #apply(List)
     */
    public List<MoveResult> apply(Move... moves) throws IllegalMoveException {
        return apply(Arrays.asList(moves));
    }

    /**
     * Applies moves in order as one group. If any move is rejected, none of them take effect.
     *
     * @param moves the moves.
     * @return one result per move.
     * @throws IllegalMoveException the rejection of the first illegal move.
     */
    public List<MoveResult> apply(List<Move> moves) throws IllegalMoveException {
        World world = state.world();
        GameState before = state.fork();
        byte[] rngState = rng.saveState();
        world.push();
        List<MoveResult> results = new ArrayList<>(moves.size());
        try {
            for (Move move : moves) {
                results.add(processor.apply(state, rng, move));
            }
        } catch (IllegalMoveException | RuntimeException e) {
            world.pop();
            state.adopt(before);
            state.setVersion(before.version());
            rng.loadState(rngState);
            throw e;
        }
        world.commit();
        MoveGroup group = history.append(results, state.version());
        LOG.debug("Game '{}' applied group {} with {} moves, now version {}",
                id, group.index(), results.size(), state.version());
        return results;
    }

    /**
     * Evaluates a move without applying it.
     */
    public MoveResult dryRun(Move move) throws IllegalMoveException {
        return processor.dryRun(state, rng, move);
    }

    /**
     * @return what the current player can do at a coordinate.
     */
    public GameOptions options(AxialCoord coord) {
        return options.optionsAt(state, coord);
    }

    /**
     * Estimates the damage one unit would deal to another from where both stand. Does not use
     * the game's random sequence.
     *
     * @return the distribution, or empty if either unit is missing or the attacker has no attack
     *         value against the defender.
     */
    public Optional<DamageDistribution> estimateDamage(AxialCoord attackerCoord, AxialCoord defenderCoord) {
        World world = state.world();
        Unit attacker = world.unitAt(attackerCoord);
        Unit defender = world.unitAt(defenderCoord);
        if (attacker == null || defender == null
                || rules.unit(attacker.unitType()).attackAgainst(rules.unit(defender.unitType())).isEmpty()) {
            return Optional.empty();
        }
        CombatContext context = new CombatContext(attacker, world.tileAt(attackerCoord), attacker.health(),
                defender, world.tileAt(defenderCoord), WoundBonusCalculator.woundBonus(defender, attackerCoord));
        return Optional.of(estimator.estimate(context));
    }

    /**
     * @return the persisted shape of the current state, including the random sequence.
     */
    public GameStateSnapshot snapshot() {
        return GameStateSnapshot.of(state, rng.saveState());
    }

    /**
     * Saves the current state on top of the version this game last saved or was restored from.
     *
     * @throws VersionConflictException if another writer saved in between.
     */
    public void saveTo(GameStateRepository repository) throws VersionConflictException {
        repository.save(id, storedVersion, snapshot());
        storedVersion = state.version();
    }
}
