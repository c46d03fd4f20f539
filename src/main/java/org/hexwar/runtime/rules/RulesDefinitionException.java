package org.hexwar.runtime.rules;

/**
 * Thrown when the engine references a unit or terrain definition that the rules table does
 * not contain, or when a rules source is malformed. The rules table is read-only input, so
 * this always points at broken configuration or a corrupt game snapshot.
 */
public class RulesDefinitionException extends RuntimeException {

    /**
     * @param message a description of the missing or malformed definition.
     */
    public RulesDefinitionException(String message) {
        super(message);
    }

    /**
     * @param message a description of the missing or malformed definition.
     * @param cause   the underlying parse failure.
     */
    public RulesDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
