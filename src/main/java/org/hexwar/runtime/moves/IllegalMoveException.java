package org.hexwar.runtime.moves;

/**
 * Thrown when a move fails validation. The game is left exactly as it was; the caller may
 * correct the move and submit it again.
 */
public class IllegalMoveException extends Exception {

    /**
     * Why a move was rejected.
     */
    public enum Reason {
        GAME_OVER,
        NO_UNIT,
        NO_TILE,
        NOT_YOUR_UNIT,
        ACTION_NOT_ALLOWED,
        NOT_REACHABLE,
        FRIENDLY_TARGET,
        TARGET_NOT_ATTACKABLE,
        TILE_NOT_OWNED,
        TILE_OCCUPIED,
        UNKNOWN_UNIT_TYPE,
        CANNOT_BUILD_HERE,
        UNIT_NOT_ALLOWED,
        ALREADY_BUILT_THIS_TURN,
        INSUFFICIENT_COINS,
        ALREADY_OWNED,
        ALREADY_CAPTURING,
        CANNOT_CAPTURE,
        ALREADY_ACTED,
        FULL_HEALTH,
        CANNOT_HEAL
    }

    private final Reason reason;

    public IllegalMoveException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
