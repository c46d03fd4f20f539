package org.hexwar.runtime.history;

/**
 * Thrown when a game state is saved on top of a version other than the stored one. The caller
 * can reload the stored state and retry.
 */
public class VersionConflictException extends Exception {

    private final String gameId;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String gameId, long expectedVersion, long actualVersion) {
        super("Version conflict for game '" + gameId + "': expected " + expectedVersion + " but stored is " + actualVersion);
        this.gameId = gameId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getGameId() {
        return gameId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
