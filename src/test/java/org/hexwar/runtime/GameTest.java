package org.hexwar.runtime;

import org.hexwar.junit.extensions.logging.LogWatchExtension;
import org.hexwar.runtime.codec.GameStateSnapshot;
import org.hexwar.runtime.codec.SnapshotCodec;
import org.hexwar.runtime.combat.DamageDistribution;
import org.hexwar.runtime.history.GameStateRepository;
import org.hexwar.runtime.history.VersionConflictException;
import org.hexwar.runtime.model.AxialCoord;
import org.hexwar.runtime.moves.IllegalMoveException;
import org.hexwar.runtime.moves.Move;
import org.hexwar.runtime.moves.MoveResult;
import org.hexwar.runtime.rules.GameSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hexwar.runtime.HexwarFixtures.SOLDIER;
import static org.hexwar.runtime.HexwarFixtures.playSkirmish;
import static org.hexwar.runtime.HexwarFixtures.rules;
import static org.hexwar.runtime.HexwarFixtures.skirmish;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class GameTest {

    private static final GameSettings SETTINGS = GameSettings.of(2, 2024L);

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        @Test
        @DisplayName("Identically seeded games produce identical bytes")
        void identicallySeededGamesProduceIdenticalBytes() throws Exception {
            SnapshotCodec codec = new SnapshotCodec();
            Game first = Game.create("g1", rules(), SETTINGS, skirmish());
            Game second = Game.create("g1", rules(), SETTINGS, skirmish());

            playSkirmish(first);
            playSkirmish(second);

            assertArrayEquals(codec.encodeResults(first.history().results()),
                    codec.encodeResults(second.history().results()));
            assertArrayEquals(codec.encode(first.snapshot()), codec.encode(second.snapshot()));
        }

        @Test
        @DisplayName("Restored game continues the same random sequence")
        void restoredGameContinuesTheSameRandomSequence() throws Exception {
            Game original = Game.create("g1", rules(), SETTINGS, skirmish());
            original.apply(Move.move(-1, 0, 0, 0));
            Game restored = Game.restore("g1", rules(), SETTINGS, original.snapshot(), null);

            List<MoveResult> expected = original.apply(Move.attack(0, 0, 1, 0));
            List<MoveResult> actual = restored.apply(Move.attack(0, 0, 1, 0));

            assertThat(actual).isEqualTo(expected);
            assertThat(restored.snapshot()).isEqualTo(original.snapshot());
        }

        @Test
        @DisplayName("Restore requires the random sequence state")
        void restoreRequiresRandomState() {
            GameStateSnapshot withoutRng = Game.create("g1", rules(), SETTINGS, skirmish()).snapshot().withoutRngState();

            assertThatThrownBy(() -> Game.restore("g1", rules(), SETTINGS, withoutRng, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Move groups")
    class Groups {

        @Test
        @DisplayName("Each move advances the version")
        void eachMoveAdvancesTheVersion() throws Exception {
            Game game = Game.create("g1", rules(), SETTINGS, skirmish());

            List<MoveResult> results = game.apply(Move.move(-1, 0, 0, 0), Move.move(-1, 1, 0, 1));

            assertThat(results).extracting(MoveResult::sequence).containsExactly(1L, 2L);
            assertThat(game.state().version()).isEqualTo(2L);
            assertThat(game.history().size()).isEqualTo(1);
            assertThat(game.history().groups().get(0).version()).isEqualTo(2L);
        }

        @Test
        @DisplayName("Failing move rolls back the whole group")
        void failingMoveRollsBackTheWholeGroup() throws Exception {
            Game game = Game.create("g1", rules(), SETTINGS, skirmish());
            GameStateSnapshot before = game.snapshot();

            assertThatThrownBy(() -> game.apply(Move.move(-1, 0, 0, 0), Move.move(1, 0, 2, 0)))
                    .isInstanceOf(IllegalMoveException.class)
                    .extracting(e -> ((IllegalMoveException) e).reason())
                    .isEqualTo(IllegalMoveException.Reason.NOT_YOUR_UNIT);

            assertThat(game.snapshot()).isEqualTo(before);
            assertThat(game.history().isEmpty()).isTrue();
            assertThat(game.world().depth()).isZero();

            game.apply(Move.move(-1, 0, 0, 0));
            assertThat(game.state().version()).isEqualTo(1L);
        }

        @Test
        @DisplayName("Dry run does not enter history")
        void dryRunDoesNotEnterHistory() throws Exception {
            Game game = Game.create("g1", rules(), SETTINGS, skirmish());
            GameStateSnapshot before = game.snapshot();

            MoveResult preview = game.dryRun(Move.move(-1, 0, 0, 0));

            assertThat(preview.sequence()).isEqualTo(1L);
            assertThat(game.snapshot()).isEqualTo(before);
            assertThat(game.history().isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("Damage estimate does not consume the game sequence")
        void damageEstimateDoesNotConsumeTheGameSequence() {
            Game game = Game.create("g1", rules(), SETTINGS, skirmish());
            GameStateSnapshot before = game.snapshot();

            DamageDistribution estimate = game.estimateDamage(AxialCoord.of(-1, 0), AxialCoord.of(1, 0)).orElseThrow();

            assertThat(estimate.trials()).isPositive();
            assertThat(game.snapshot()).isEqualTo(before);
        }

        @Test
        @DisplayName("No estimate without both units")
        void noEstimateWithoutBothUnits() {
            Game game = Game.create("g1", rules(), SETTINGS, skirmish());

            assertThat(game.estimateDamage(AxialCoord.of(-1, 0), AxialCoord.of(0, 0))).isEmpty();
        }

        @Test
        @DisplayName("Options reflect the current player")
        void optionsReflectTheCurrentPlayer() {
            Game game = Game.create("g1", rules(), SETTINGS, skirmish());

            assertThat(game.options(AxialCoord.of(-1, 0)).moves()).isNotEmpty();
            assertThat(game.options(AxialCoord.of(1, 0)).isEmpty()).isTrue();
            assertThat(game.options(AxialCoord.of(-3, 0)).buildableUnits().toIntArray()).contains(SOLDIER);
        }
    }

    @Nested
    @DisplayName("Persistence")
    @ExtendWith(MockitoExtension.class)
    class Persistence {

        @Mock
        private GameStateRepository repository;

        @Test
        @DisplayName("Saves on top of the last stored version")
        void savesOnTopOfTheLastStoredVersion() throws Exception {
            Game game = Game.create("g1", rules(), SETTINGS, skirmish());

            game.saveTo(repository);
            game.apply(Move.move(-1, 0, 0, 0), Move.endTurn());
            game.saveTo(repository);
            game.apply(Move.endTurn());
            game.saveTo(repository);

            ArgumentCaptor<GameStateSnapshot> saved = ArgumentCaptor.forClass(GameStateSnapshot.class);
            verify(repository, times(2)).save(eq("g1"), eq(0L), saved.capture());
            verify(repository).save(eq("g1"), eq(2L), any());
            assertThat(saved.getAllValues()).extracting(GameStateSnapshot::version).containsExactly(0L, 2L);
        }

        @Test
        @DisplayName("Conflict keeps the base version")
        void conflictKeepsTheBaseVersion() throws Exception {
            doThrow(new VersionConflictException("g1", 0L, 3L))
                    .when(repository).save(eq("g1"), anyLong(), any());
            Game game = Game.create("g1", rules(), SETTINGS, skirmish());
            game.apply(Move.endTurn());

            assertThatThrownBy(() -> game.saveTo(repository))
                    .isInstanceOf(VersionConflictException.class)
                    .hasMessageContaining("stored is 3");
            assertThatThrownBy(() -> game.saveTo(repository)).isInstanceOf(VersionConflictException.class);
            verify(repository, times(2)).save(eq("g1"), eq(0L), any());
        }
    }
}
