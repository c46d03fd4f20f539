package org.hexwar.runtime.history;

import org.hexwar.junit.extensions.logging.ExpectLog;
import org.hexwar.junit.extensions.logging.LogLevel;
import org.hexwar.junit.extensions.logging.LogWatchExtension;
import org.hexwar.runtime.codec.GameStateSnapshot;
import org.hexwar.runtime.rules.GameSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.hexwar.runtime.HexwarFixtures.SOLDIER;
import static org.hexwar.runtime.HexwarFixtures.grassWorld;
import static org.hexwar.runtime.HexwarFixtures.unit;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class InMemoryGameStateRepositoryTest {

    private InMemoryGameStateRepository repository;
    private GameState state;

    @BeforeEach
    void setUp() {
        repository = new InMemoryGameStateRepository();
        state = GameState.initial(grassWorld(2, unit(0, 0, 1, SOLDIER), unit(1, 0, 2, SOLDIER)),
                GameSettings.of(2, 5L));
    }

    private GameStateSnapshot at(long version) {
        state.setVersion(version);
        return GameStateSnapshot.of(state, new byte[]{1, 2, 3});
    }

    @Test
    @DisplayName("Unknown game is version zero")
    void unknownGameIsVersionZero() {
        assertThat(repository.load("missing")).isEmpty();
        assertThat(repository.versionOf("missing")).isZero();
    }

    @Test
    @DisplayName("Saved snapshot is loaded back")
    void savedSnapshotIsLoadedBack() throws Exception {
        GameStateSnapshot snapshot = at(3);

        repository.save("g1", 0, snapshot);

        assertThat(repository.load("g1")).contains(snapshot);
        assertThat(repository.versionOf("g1")).isEqualTo(3);
        assertThat(repository.load("g2")).isEmpty();
    }

    @Test
    @DisplayName("Successive saves chain on versions")
    void successiveSavesChainOnVersions() throws Exception {
        repository.save("g1", 0, at(3));
        repository.save("g1", 3, at(7));

        assertThat(repository.versionOf("g1")).isEqualTo(7);
        assertThat(repository.load("g1").orElseThrow().version()).isEqualTo(7);
    }

    @Test
    @DisplayName("Stale save is rejected")
    @ExpectLog(level = LogLevel.WARN,
            loggerPattern = ".*InMemoryGameStateRepository",
            messagePattern = "Rejected save of game 'g1' at version 9: based on 0, stored is 3")
    void staleSaveIsRejected() throws Exception {
        GameStateSnapshot first = at(3);
        repository.save("g1", 0, first);

        VersionConflictException conflict = catchThrowableOfType(() -> repository.save("g1", 0, at(9)),
                VersionConflictException.class);

        assertThat(conflict.getGameId()).isEqualTo("g1");
        assertThat(conflict.getExpectedVersion()).isZero();
        assertThat(conflict.getActualVersion()).isEqualTo(3);
        assertThat(repository.load("g1")).contains(first);
    }
}
