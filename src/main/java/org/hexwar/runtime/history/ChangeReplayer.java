package org.hexwar.runtime.history;

import org.hexwar.runtime.codec.GameStateSnapshot;
import org.hexwar.runtime.model.Unit;
import org.hexwar.runtime.model.World;
import org.hexwar.runtime.moves.Change;
import org.hexwar.runtime.moves.MoveResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies recorded changes to a game state without running any rules. Since changes carry full
 * unit and tile records, replaying a game's change log against its initial state reproduces the
 * final state exactly.
 */
public final class ChangeReplayer {

    private static final Logger LOG = LoggerFactory.getLogger(ChangeReplayer.class);

    private ChangeReplayer() {
        // Private constructor to prevent instantiation
    }

    /**
     * Replays one move result and sets the state's version to the move's sequence number.
     */
    public static void replay(GameState state, MoveResult result) {
        replay(state, result.changes());
        state.setVersion(result.sequence());
    }

    /**
     * Replays every move of a history in order.
     */
    public static void replay(GameState state, History history) {
        for (MoveResult result : history.results()) {
            replay(state, result);
        }
    }

    /**
     * Applies changes in order. The version is left alone.
     */
    public static void replay(GameState state, List<Change> changes) {
        for (Change change : changes) {
            apply(state, change);
        }
        LOG.debug("Replayed {} changes, now player {} in turn {}", changes.size(), state.currentPlayer(), state.turnCounter());
    }

    private static void apply(GameState state, Change change) {
        World world = state.world();
        switch (change.kind()) {
            case UNIT_MOVED -> {
                Change.UnitMoved moved = (Change.UnitMoved) change;
                world.removeUnit(moved.previous().coord());
                world.addUnit(moved.updated());
            }
            case UNIT_DAMAGED -> world.addUnit(((Change.UnitDamaged) change).updated());
            case UNIT_KILLED -> world.removeUnit(((Change.UnitKilled) change).unit().coord());
            case UNIT_BUILT -> {
                Change.UnitBuilt built = (Change.UnitBuilt) change;
                world.putTile(built.tile());
                world.addUnit(built.unit());
                state.setCoins(built.unit().player(), built.playerCoins());
            }
            case UNIT_HEALED -> world.addUnit(((Change.UnitHealed) change).updated());
            case COINS_CHANGED -> {
                Change.CoinsChanged coins = (Change.CoinsChanged) change;
                state.setCoins(coins.player(), coins.newCoins());
            }
            case PLAYER_CHANGED -> {
                Change.PlayerChanged turn = (Change.PlayerChanged) change;
                state.setCurrentPlayer(turn.newPlayer());
                state.setTurnCounter(turn.newTurn());
                for (Unit unit : turn.resetUnits()) {
                    world.addUnit(unit);
                }
                state.setWinner(turn.winner());
            }
            case CAPTURE_STARTED -> world.addUnit(((Change.CaptureStarted) change).updated());
            case CAPTURE_COMPLETED -> {
                Change.CaptureCompleted capture = (Change.CaptureCompleted) change;
                world.putTile(capture.updated());
                world.addUnit(capture.unit());
            }
            case TILE_OWNERSHIP_CHANGED -> world.putTile(((Change.TileOwnershipChanged) change).updated());
        }
    }

    /**
     * Compares a replayed state with the recorded one, ignoring the random sequence.
     *
     * @param expected the recorded state.
     * @param replayed the state produced by replay.
     * @throws ReplayDivergenceException describing the first difference found.
     */
    public static void verify(GameStateSnapshot expected, GameState replayed) {
        GameStateSnapshot actual = GameStateSnapshot.of(replayed, null);
        GameStateSnapshot wanted = expected.withoutRngState();
        if (wanted.equals(actual)) {
            return;
        }
        throw new ReplayDivergenceException("Replay diverged from recorded state: "
                + describeDifference(wanted, actual));
    }

    private static String describeDifference(GameStateSnapshot expected, GameStateSnapshot actual) {
        if (expected.currentPlayer() != actual.currentPlayer()) {
            return "current player " + expected.currentPlayer() + " != " + actual.currentPlayer();
        }
        if (expected.turnCounter() != actual.turnCounter()) {
            return "turn " + expected.turnCounter() + " != " + actual.turnCounter();
        }
        if (expected.version() != actual.version()) {
            return "version " + expected.version() + " != " + actual.version();
        }
        if (expected.winner() != actual.winner()) {
            return "winner " + expected.winner() + " != " + actual.winner();
        }
        if (!expected.coins().equals(actual.coins())) {
            return "coins " + expected.coins() + " != " + actual.coins();
        }
        if (!expected.labelCounters().equals(actual.labelCounters())) {
            return "label counters " + expected.labelCounters() + " != " + actual.labelCounters();
        }
        String tiles = firstDifference("tile", expected.tiles(), actual.tiles());
        if (tiles != null) {
            return tiles;
        }
        String units = firstDifference("unit", expected.units(), actual.units());
        return units != null ? units : "unknown difference";
    }

    private static <V> String firstDifference(String what, Map<String, V> expected, Map<String, V> actual) {
        for (Map.Entry<String, V> entry : expected.entrySet()) {
            V other = actual.get(entry.getKey());
            if (!Objects.equals(entry.getValue(), other)) {
                return what + " at " + entry.getKey() + ": expected " + entry.getValue() + " but was " + other;
            }
        }
        for (String key : actual.keySet()) {
            if (!expected.containsKey(key)) {
                return "unexpected " + what + " at " + key + ": " + actual.get(key);
            }
        }
        return null;
    }
}
