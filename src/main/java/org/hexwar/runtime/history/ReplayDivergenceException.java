package org.hexwar.runtime.history;

/**
 * Thrown when replaying recorded changes does not reproduce the recorded state. This is a
 * defect in the engine and is never retried.
 */
public class ReplayDivergenceException extends RuntimeException {

    public ReplayDivergenceException(String message) {
        super(message);
    }
}
