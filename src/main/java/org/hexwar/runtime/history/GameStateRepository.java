package org.hexwar.runtime.history;

import org.hexwar.runtime.codec.GameStateSnapshot;

import java.util.Optional;

/**
 * Storage of game states with optimistic concurrency. A save succeeds only when the caller
 * presents the version it last read; a game that was never stored counts as version 0.
 */
public interface GameStateRepository {

    /**
     * @param gameId the game.
     * @return the stored state, or empty if the game was never saved.
     */
    Optional<GameStateSnapshot> load(String gameId);

    /**
     * Stores a new state for a game.
     *
     * @param gameId          the game.
     * @param expectedVersion the stored version the new state is based on.
     * @param snapshot        the new state.
     * @throws VersionConflictException if the stored version is not {@code expectedVersion}.
     */
    void save(String gameId, long expectedVersion, GameStateSnapshot snapshot) throws VersionConflictException;

    /**
     * @return the stored version, 0 if the game was never saved.
     */
    default long versionOf(String gameId) {
        return load(gameId).map(GameStateSnapshot::version).orElse(0L);
    }
}
