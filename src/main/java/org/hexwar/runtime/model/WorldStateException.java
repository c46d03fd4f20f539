package org.hexwar.runtime.model;

/**
 * Signals an inconsistent world operation, such as two live units claiming one coordinate or
 * popping the base layer. These are defects in the caller's validation order and are never
 * recoverable at runtime.
 */
public class WorldStateException extends IllegalStateException {

    /**
     * @param message a description of the violated invariant.
     */
    public WorldStateException(String message) {
        super(message);
    }
}
