package org.hexwar.runtime.history;

import org.hexwar.runtime.codec.GameStateSnapshot;
import org.hexwar.runtime.codec.SnapshotCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Repository keeping encoded snapshots in memory. Saves are serialized per instance so the
 * version check and the write happen atomically.
 */
public final class InMemoryGameStateRepository implements GameStateRepository {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryGameStateRepository.class);

    private final SnapshotCodec codec;
    private final Map<String, byte[]> store = new HashMap<>();
    private final Map<String, Long> versions = new HashMap<>();

    public InMemoryGameStateRepository() {
        this(new SnapshotCodec());
    }

    public InMemoryGameStateRepository(SnapshotCodec codec) {
        this.codec = codec;
    }

    @Override
    public synchronized Optional<GameStateSnapshot> load(String gameId) {
        byte[] bytes = store.get(gameId);
        if (bytes == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(bytes));
        } catch (IOException e) {
            throw new UncheckedIOException("Stored snapshot of game '" + gameId + "' is unreadable", e);
        }
    }

    @Override
    public synchronized void save(String gameId, long expectedVersion, GameStateSnapshot snapshot)
            throws VersionConflictException {
        long stored = versions.getOrDefault(gameId, 0L);
        if (stored != expectedVersion) {
            LOG.warn("Rejected save of game '{}' at version {}: based on {}, stored is {}",
                    gameId, snapshot.version(), expectedVersion, stored);
            throw new VersionConflictException(gameId, expectedVersion, stored);
        }
        store.put(gameId, codec.encode(snapshot));
        versions.put(gameId, snapshot.version());
        LOG.debug("Saved game '{}' at version {}", gameId, snapshot.version());
    }

    @Override
    public synchronized long versionOf(String gameId) {
        return versions.getOrDefault(gameId, 0L);
    }
}
