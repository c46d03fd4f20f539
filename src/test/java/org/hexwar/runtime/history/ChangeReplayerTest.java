package org.hexwar.runtime.history;

import org.hexwar.junit.extensions.logging.LogWatchExtension;
import org.hexwar.runtime.Game;
import org.hexwar.runtime.codec.GameStateSnapshot;
import org.hexwar.runtime.codec.SnapshotCodec;
import org.hexwar.runtime.model.AxialCoord;
import org.hexwar.runtime.moves.MoveResult;
import org.hexwar.runtime.rules.GameSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hexwar.runtime.HexwarFixtures.playSkirmish;
import static org.hexwar.runtime.HexwarFixtures.rules;
import static org.hexwar.runtime.HexwarFixtures.skirmish;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ChangeReplayerTest {

    private GameStateSnapshot initial;
    private Game game;

    @BeforeEach
    void setUp() throws Exception {
        game = Game.create("replay", rules(), GameSettings.of(2, 99L), skirmish());
        initial = game.snapshot();
        playSkirmish(game);
    }

    @Test
    @DisplayName("Replaying the history reproduces the final state")
    void replayingTheHistoryReproducesTheFinalState() {
        GameState replayed = initial.toGameState();

        ChangeReplayer.replay(replayed, game.history());

        ChangeReplayer.verify(game.snapshot(), replayed);
        assertThat(replayed.version()).isEqualTo(game.state().version());
        assertThat(replayed.turnCounter()).isEqualTo(2);
    }

    @Test
    @DisplayName("Decoded results replay the same")
    void decodedResultsReplayTheSame() throws Exception {
        SnapshotCodec codec = new SnapshotCodec();
        List<MoveResult> decoded = codec.decodeResults(codec.encodeResults(game.history().results()));
        GameState replayed = codec.decode(codec.encode(initial)).toGameState();

        for (MoveResult result : decoded) {
            ChangeReplayer.replay(replayed, result);
        }

        ChangeReplayer.verify(game.snapshot(), replayed);
    }

    @Test
    @DisplayName("Partial replay stops at that group")
    void partialReplayStopsAtThatGroup() {
        GameState replayed = initial.toGameState();
        MoveGroup first = game.history().groups().get(0);

        for (MoveResult result : first.results()) {
            ChangeReplayer.replay(replayed, result);
        }

        assertThat(replayed.version()).isEqualTo(first.version());
        assertThat(replayed.world().unitAt(AxialCoord.of(0, 0))).isNotNull();
        assertThat(replayed.world().unitAt(AxialCoord.of(-1, 0))).isNull();
        assertThatThrownBy(() -> ChangeReplayer.verify(game.snapshot(), replayed))
                .isInstanceOf(ReplayDivergenceException.class);
    }

    @Test
    @DisplayName("Divergence names the difference")
    void divergenceNamesTheDifference() {
        GameState replayed = initial.toGameState();
        ChangeReplayer.replay(replayed, game.history());
        replayed.setCoins(1, replayed.coinsOf(1) + 1);

        assertThatThrownBy(() -> ChangeReplayer.verify(game.snapshot(), replayed))
                .isInstanceOf(ReplayDivergenceException.class)
                .hasMessageContaining("coins");
    }

    @Test
    @DisplayName("Removed unit is reported")
    void removedUnitIsReported() {
        GameState replayed = initial.toGameState();
        ChangeReplayer.replay(replayed, game.history());
        replayed.world().removeUnit(AxialCoord.of(-2, 2));

        assertThatThrownBy(() -> ChangeReplayer.verify(game.snapshot(), replayed))
                .isInstanceOf(ReplayDivergenceException.class)
                .hasMessageContaining("unit at");
    }
}
