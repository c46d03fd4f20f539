package org.hexwar.runtime.moves;

import org.hexwar.runtime.combat.CombatContext;
import org.hexwar.runtime.combat.CombatResolver;
import org.hexwar.runtime.combat.SplashDamageTarget;
import org.hexwar.runtime.combat.WoundBonusCalculator;
import org.hexwar.runtime.history.GameState;
import org.hexwar.runtime.model.AttackRecord;
import org.hexwar.runtime.model.AxialCoord;
import org.hexwar.runtime.model.Tile;
import org.hexwar.runtime.model.Unit;
import org.hexwar.runtime.model.World;
import org.hexwar.runtime.movement.MovementPlanner;
import org.hexwar.runtime.movement.Path;
import org.hexwar.runtime.moves.IllegalMoveException.Reason;
import org.hexwar.runtime.progression.ActionKind;
import org.hexwar.runtime.progression.RefreshOutcome;
import org.hexwar.runtime.progression.TurnProgression;
import org.hexwar.runtime.rules.GameSettings;
import org.hexwar.runtime.rules.IncomeTable;
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
 * Validates and applies moves against a {@link GameState}.
 * <p>
 * Every move runs in a layer pushed onto the game's {@link World} and against a fork of the
 * game state. Validation happens before anything is written or any random number is drawn. On
 * success {@link #apply} commits the layer and adopts the fork; {@link #dryRun} always discards
 * both and rewinds the random sequence, so the caller sees the changes a move would produce
 * without affecting the game.
 */
public final class MoveProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(MoveProcessor.class);

    static final String INCOME_REASON = "income";

    private final RulesTable rules;
    private final GameSettings settings;
    private final MovementPlanner planner;
    private final CombatResolver combat;
    private final TurnProgression progression;

    public MoveProcessor(RulesTable rules, GameSettings settings) {
        this(rules, settings, new MovementPlanner(rules), new CombatResolver(rules), new TurnProgression(rules));
    }

    public MoveProcessor(RulesTable rules,
                         GameSettings settings,
                         MovementPlanner planner,
                         CombatResolver combat,
                         TurnProgression progression) {
        this.rules = rules;
        this.settings = settings;
        this.planner = planner;
        this.combat = combat;
        this.progression = progression;
    }

    public RulesTable rules() {
        return rules;
    }

    public GameSettings settings() {
        return settings;
    }

    public MovementPlanner planner() {
        return planner;
    }

    public CombatResolver combat() {
        return combat;
    }

    public TurnProgression progression() {
        return progression;
    }

    /**
     * Applies a move. On success the state's version grows by one.
     *
     * @param state the game state, mutated only on success.
     * @param rng   the game's random sequence, rewound on failure.
     * @param move  the move.
     * @return the changes the move produced.
     * @throws IllegalMoveException if the move fails validation.
     */
    public MoveResult apply(GameState state, IRandomProvider rng, Move move) throws IllegalMoveException {
        World world = state.world();
        byte[] rngState = rng.saveState();
        world.push();
        GameState working = state.fork();
        List<Change> changes;
        try {
            changes = process(working, rng, move);
        } catch (IllegalMoveException | RuntimeException e) {
            world.pop();
            rng.loadState(rngState);
            throw e;
        }
        world.commit();
        state.adopt(working);
        long version = state.incrementVersion();
        LOG.debug("Applied {} as version {} with {} changes", move, version, changes.size());
        return new MoveResult(move, version, changes);
    }

    /**
     * Runs a move without keeping any of its effects. The world, the state and the random
     * sequence are exactly as before when this method returns, whether it succeeds or not.
     *
     * @return the changes the move would produce.
     * @throws IllegalMoveException if the move fails validation.
     */
    public MoveResult dryRun(GameState state, IRandomProvider rng, Move move) throws IllegalMoveException {
        World world = state.world();
        byte[] rngState = rng.saveState();
        world.push();
        try {
            List<Change> changes = process(state.fork(), rng, move);
            return new MoveResult(move, state.version() + 1, changes);
        } finally {
            world.pop();
            rng.loadState(rngState);
        }
    }

    private List<Change> process(GameState state, IRandomProvider rng, Move move) throws IllegalMoveException {
        if (state.finished()) {
            throw new IllegalMoveException(Reason.GAME_OVER, "Game is over, player " + state.winner() + " won");
        }
        List<Change> changes = new ArrayList<>();
        switch (move.kind()) {
            case MOVE_UNIT -> moveUnit(state, (Move.MoveUnit) move, changes);
            case ATTACK_UNIT -> attackUnit(state, rng, (Move.AttackUnit) move, changes);
            case BUILD_UNIT -> buildUnit(state, (Move.BuildUnit) move, changes);
            case CAPTURE_BUILDING -> captureBuilding(state, (Move.CaptureBuilding) move, changes);
            case HEAL_UNIT -> healUnit(state, (Move.HealUnit) move, changes);
            case END_TURN -> endTurn(state, changes);
        }
        return changes;
    }

    // ---------------------------------------------------------------------
    // Movement
    // ---------------------------------------------------------------------

    private void moveUnit(GameState state, Move.MoveUnit move, List<Change> changes) throws IllegalMoveException {
        World world = state.world();
        Unit unit = activeUnit(state, move.from(), changes);
        List<ActionKind> allowed = progression.allowedActions(unit);
        ActionKind kind;
        if (allowed.contains(ActionKind.MOVE)) {
            kind = ActionKind.MOVE;
        } else if (allowed.contains(ActionKind.RETREAT)) {
            kind = ActionKind.RETREAT;
        } else {
            throw new IllegalMoveException(Reason.ACTION_NOT_ALLOWED,
                    "Unit " + unit.label() + " at " + unit.coord() + " cannot move now, allowed: " + allowed);
        }
        if (move.from().equals(move.to())) {
            throw new IllegalMoveException(Reason.NOT_REACHABLE, "Unit is already at " + move.to());
        }
        Path path = planner.findPathTo(world, unit, move.to(), false)
                .orElseThrow(() -> new IllegalMoveException(Reason.NOT_REACHABLE,
                        "Unit " + unit.label() + " cannot reach " + move.to() + " with " + unit.distanceLeft()
                                + " movement left"));

        Unit updated = progression.afterMove(unit, kind, path.totalCost()).withLastActedTurn(state.turnCounter());
        Unit stored = world.moveUnit(updated, move.to());
        changes.add(new Change.UnitMoved(unit, stored));
        LOG.debug("Unit {} moved {} -> {} for {}", unit.label(), move.from(), move.to(), path.totalCost());
    }

    // ---------------------------------------------------------------------
    // Combat
    // ---------------------------------------------------------------------

    private void attackUnit(GameState state, IRandomProvider rng, Move.AttackUnit move, List<Change> changes)
            throws IllegalMoveException {
        World world = state.world();
        int turn = state.turnCounter();
        Unit attacker = activeUnit(state, move.attacker(), changes);
        Unit defender = world.unitAt(move.defender());
        if (defender == null) {
            throw new IllegalMoveException(Reason.NO_UNIT, "No unit to attack at " + move.defender());
        }
        if (defender.player() == attacker.player()) {
            throw new IllegalMoveException(Reason.FRIENDLY_TARGET, "Cannot attack own unit at " + move.defender());
        }
        OptionalInt slot = progression.slotFor(attacker, ActionKind.ATTACK);
        if (slot.isEmpty()) {
            throw new IllegalMoveException(Reason.ACTION_NOT_ALLOWED,
                    "Unit " + attacker.label() + " cannot attack now, allowed: " + progression.allowedActions(attacker));
        }
        if (!combat.canAttack(attacker, defender)) {
            throw new IllegalMoveException(Reason.TARGET_NOT_ATTACKABLE,
                    "Unit " + attacker.label() + " cannot attack " + move.defender() + " from " + move.attacker());
        }

        Tile attackerTile = world.tileAt(attacker.coord());
        Tile defenderTile = world.tileAt(defender.coord());
        int woundBonus = WoundBonusCalculator.woundBonus(defender, attacker.coord());
        int damage = combat.rollDamage(
                new CombatContext(attacker, attackerTile, attacker.health(), defender, defenderTile, woundBonus), rng);
        int counterDamage = 0;
        if (combat.canAttack(defender, attacker)) {
            counterDamage = combat.rollDamage(
                    new CombatContext(defender, defenderTile, defender.health(), attacker, attackerTile, 0), rng);
        }

        boolean ranged = attacker.coord().distanceTo(defender.coord()) > 1;
        Unit defenderAfter = defender.withHealth(defender.health() - damage)
                .withAttackRecorded(new AttackRecord(attacker.q(), attacker.r(), ranged, turn));
        Unit attackerAfter = progression.afterAttack(attacker, slot.getAsInt())
                .withHealth(attacker.health() - counterDamage)
                .withLastActedTurn(turn);

        changes.add(new Change.UnitDamaged(defender, defenderAfter, healthLost(defender, defenderAfter)));
        if (counterDamage > 0) {
            changes.add(new Change.UnitDamaged(attacker, attackerAfter, healthLost(attacker, attackerAfter)));
        } else {
            changes.add(new Change.UnitMoved(attacker, attackerAfter));
        }
        applyDamage(world, defenderAfter, changes);
        applyDamage(world, attackerAfter, changes);
        LOG.debug("Unit {} attacked {} for {} (wound bonus {}), counter {}",
                attacker.label(), defender.label(), damage, woundBonus, counterDamage);

        if (attackerAfter.health() > 0) {
            for (SplashDamageTarget target : combat.rollSplash(world, attackerAfter, defender.coord(), rng)) {
                Unit victim = target.unit();
                Unit damaged = victim.withHealth(victim.health() - target.damage());
                changes.add(new Change.UnitDamaged(victim, damaged, healthLost(victim, damaged)));
                applyDamage(world, damaged, changes);
                LOG.debug("Splash hit {} at {} for {}", victim.label(), victim.coord(), target.damage());
            }
        }
    }

    private static int healthLost(Unit before, Unit after) {
        return before.health() - after.health();
    }

    private static void applyDamage(World world, Unit damaged, List<Change> changes) {
        if (damaged.health() <= 0) {
            world.removeUnit(damaged.coord());
            changes.add(new Change.UnitKilled(damaged));
        } else {
            world.updateUnit(damaged);
        }
    }

    // ---------------------------------------------------------------------
    // Building
    // ---------------------------------------------------------------------

    private void buildUnit(GameState state, Move.BuildUnit move, List<Change> changes) throws IllegalMoveException {
        World world = state.world();
        int player = state.currentPlayer();
        int turn = state.turnCounter();
        Tile tile = world.tileAt(move.pos());
        if (tile == null) {
            throw new IllegalMoveException(Reason.NO_TILE, "No tile at " + move.pos());
        }
        if (tile.player() != player) {
            throw new IllegalMoveException(Reason.TILE_NOT_OWNED,
                    "Tile " + move.pos() + " belongs to player " + tile.player() + ", not " + player);
        }
        if (world.unitAt(move.pos()) != null) {
            throw new IllegalMoveException(Reason.TILE_OCCUPIED, "Tile " + move.pos() + " is occupied");
        }
        if (tile.lastActedTurn() >= turn) {
            throw new IllegalMoveException(Reason.ALREADY_BUILT_THIS_TURN,
                    "Tile " + move.pos() + " already built a unit in turn " + turn);
        }
        UnitDefinition definition = rules.findUnit(move.unitType())
                .orElseThrow(() -> new IllegalMoveException(Reason.UNKNOWN_UNIT_TYPE,
                        "Unknown unit type " + move.unitType()));
        TerrainDefinition terrain = rules.terrain(tile.terrainType());
        if (!terrain.canBuild(definition.id())) {
            throw new IllegalMoveException(Reason.CANNOT_BUILD_HERE,
                    terrain.name() + " cannot build " + definition.name());
        }
        if (!settings.allows(definition.id())) {
            throw new IllegalMoveException(Reason.UNIT_NOT_ALLOWED,
                    definition.name() + " is not allowed in this game");
        }
        int coins = state.coinsOf(player);
        if (coins < definition.coins()) {
            throw new IllegalMoveException(Reason.INSUFFICIENT_COINS,
                    definition.name() + " costs " + definition.coins() + ", player " + player + " has " + coins);
        }

        int remaining = coins - definition.coins();
        state.setCoins(player, remaining);
        Tile usedTile = tile.withLastActedTurn(turn);
        world.putTile(usedTile);
        Unit built = new Unit(move.pos().q(), move.pos().r(), player, definition.id(), null, definition.health(),
                0, progression.orderOf(definition.id()).size(), "", turn, 0, 0, List.of());
        world.addUnit(built);
        Unit stored = world.unitAt(move.pos());
        changes.add(new Change.UnitBuilt(stored, usedTile, definition.coins(), remaining));
        LOG.debug("Player {} built {} {} at {}, {} coins left",
                player, definition.name(), stored.label(), move.pos(), remaining);
    }

    // ---------------------------------------------------------------------
    // Capture and heal
    // ---------------------------------------------------------------------

    private void captureBuilding(GameState state, Move.CaptureBuilding move, List<Change> changes)
            throws IllegalMoveException {
        World world = state.world();
        Unit unit = activeUnit(state, move.pos(), changes);
        Tile tile = world.tileAt(move.pos());
        if (tile == null) {
            throw new IllegalMoveException(Reason.NO_TILE, "No tile at " + move.pos());
        }
        if (tile.player() == unit.player()) {
            throw new IllegalMoveException(Reason.ALREADY_OWNED, "Tile " + move.pos() + " is already owned");
        }
        if (unit.captureStartedTurn() > 0) {
            throw new IllegalMoveException(Reason.ALREADY_CAPTURING,
                    "Unit " + unit.label() + " is already capturing since turn " + unit.captureStartedTurn());
        }
        if (!rules.terrainUnit(tile.terrainType(), unit.unitType()).canCapture()) {
            throw new IllegalMoveException(Reason.CANNOT_CAPTURE,
                    rules.unit(unit.unitType()).name() + " cannot capture " + rules.terrain(tile.terrainType()).name());
        }
        OptionalInt slot = progression.slotFor(unit, ActionKind.CAPTURE);
        if (slot.isEmpty()) {
            throw new IllegalMoveException(Reason.ACTION_NOT_ALLOWED,
                    "Unit " + unit.label() + " cannot capture now, allowed: " + progression.allowedActions(unit));
        }

        int turn = state.turnCounter();
        Unit updated = progression.afterOneShot(unit, slot.getAsInt())
                .withCaptureStartedTurn(turn)
                .withLastActedTurn(turn);
        world.updateUnit(updated);
        changes.add(new Change.CaptureStarted(unit, updated, tile));
        LOG.debug("Unit {} started capturing {} in turn {}", unit.label(), move.pos(), turn);
    }

    private void healUnit(GameState state, Move.HealUnit move, List<Change> changes) throws IllegalMoveException {
        World world = state.world();
        int turn = state.turnCounter();
        Unit unit = activeUnit(state, move.pos(), changes);
        UnitDefinition definition = rules.unit(unit.unitType());
        if (unit.health() >= definition.health()) {
            throw new IllegalMoveException(Reason.FULL_HEALTH, "Unit " + unit.label() + " is at full health");
        }
        if (unit.lastActedTurn() >= turn) {
            throw new IllegalMoveException(Reason.ALREADY_ACTED, "Unit " + unit.label() + " already acted this turn");
        }
        int amount = progression.healing().terrainHealAmount(world, unit);
        if (amount <= 0) {
            throw new IllegalMoveException(Reason.CANNOT_HEAL, "Unit " + unit.label() + " cannot heal at " + unit.coord());
        }
        int healed = Math.min(definition.health(), unit.health() + amount);
        Unit updated = progression.afterOneShot(unit, unit.progressionStep())
                .withHealth(healed)
                .withLastActedTurn(turn);
        world.updateUnit(updated);
        changes.add(new Change.UnitHealed(unit, updated, healed - unit.health()));
        LOG.debug("Unit {} healed {} to {}", unit.label(), healed - unit.health(), healed);
    }

    // ---------------------------------------------------------------------
    // End of turn
    // ---------------------------------------------------------------------

    private void endTurn(GameState state, List<Change> changes) {
        World world = state.world();
        int previousPlayer = state.currentPlayer();
        int previousTurn = state.turnCounter();

        int income = incomeOf(world, previousPlayer);
        if (income > 0) {
            int before = state.coinsOf(previousPlayer);
            state.setCoins(previousPlayer, before + income);
            changes.add(new Change.CoinsChanged(previousPlayer, before, before + income, INCOME_REASON));
        }

        int nextPlayer = previousPlayer >= settings.playerCount() ? 1 : previousPlayer + 1;
        int nextTurn = nextPlayer == 1 ? previousTurn + 1 : previousTurn;
        state.setCurrentPlayer(nextPlayer);
        state.setTurnCounter(nextTurn);

        List<Unit> resetUnits = new ArrayList<>();
        for (Unit unit : world.unitsOf(nextPlayer)) {
            resetUnits.add(refresh(state, unit, changes));
        }

        int winner = winnerOf(world);
        if (winner != 0) {
            state.setWinner(winner);
            LOG.info("Player {} won in turn {}", winner, nextTurn);
        }
        changes.add(new Change.PlayerChanged(previousPlayer, nextPlayer, previousTurn, nextTurn, resetUnits, winner));
        LOG.debug("Turn passed from player {} to player {}, turn {}", previousPlayer, nextPlayer, nextTurn);
    }

    /**
     * @return the flat per-turn income plus the income of every income tile the player owns.
     */
    int incomeOf(World world, int player) {
        IncomeTable table = settings.income();
        int income = table.gameIncome();
        for (Tile tile : world.tiles()) {
            if (tile.player() == player) {
                income += table.incomeFor(tile.terrainType());
            }
        }
        return income;
    }

    private int winnerOf(World world) {
        if (settings.playerCount() < 2) {
            return 0;
        }
        int playersWithUnits = 0;
        int last = 0;
        for (int player = 1; player <= settings.playerCount(); player++) {
            if (!world.unitsOf(player).isEmpty()) {
                playersWithUnits++;
                last = player;
            }
        }
        return playersWithUnits == 1 ? last : 0;
    }

    // ---------------------------------------------------------------------
    // Shared validation
    // ---------------------------------------------------------------------

    private Unit activeUnit(GameState state, AxialCoord coord, List<Change> changes) throws IllegalMoveException {
        Unit unit = state.world().unitAt(coord);
        if (unit == null) {
            throw new IllegalMoveException(Reason.NO_UNIT, "No unit at " + coord);
        }
        if (unit.player() != state.currentPlayer()) {
            throw new IllegalMoveException(Reason.NOT_YOUR_UNIT,
                    "Unit at " + coord + " belongs to player " + unit.player() + ", not " + state.currentPlayer());
        }
        return refresh(state, unit, changes);
    }

    private Unit refresh(GameState state, Unit unit, List<Change> changes) {
        RefreshOutcome outcome = progression.refreshIfNeeded(state.world(), unit, state.turnCounter());
        outcome.capture().ifPresent(capture -> {
            changes.add(new Change.TileOwnershipChanged(capture.previous(), capture.updated()));
            changes.add(new Change.CaptureCompleted(capture.unit(), capture.previous(), capture.updated()));
        });
        return outcome.unit();
    }
}
