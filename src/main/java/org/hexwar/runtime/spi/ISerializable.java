package org.hexwar.runtime.spi;

/**
 * A component whose internal state can be captured and restored byte-for-byte, so a game
 * can be checkpointed and resumed, or a speculative evaluation rolled back.
 */
public interface ISerializable {

    /**
     * @return an opaque snapshot of the current state.
     */
    byte[] saveState();

    /**
     * Restores a snapshot previously produced by {@link #saveState()}.
     *
     * @param state the snapshot.
     */
    void loadState(byte[] state);
}
