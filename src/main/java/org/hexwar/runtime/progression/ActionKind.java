package org.hexwar.runtime.progression;

import org.hexwar.runtime.rules.RulesDefinitionException;

/**
 * Actions a unit can take inside its action order.
 */
public enum ActionKind {
    MOVE("move", true),
    ATTACK("attack", false),
    CAPTURE("capture", false),
    BUILD("build", false),
    RETREAT("retreat", true),
    HEAL("heal", false);

    private final String token;
    private final boolean movement;

    ActionKind(String token, boolean movement) {
        this.token = token;
        this.movement = movement;
    }

    /**
     * @return the name used in action orders and as chosen alternative.
     */
    public String token() {
        return token;
    }

    /**
     * @return whether the action spends movement points rather than being one-shot.
     */
    public boolean movement() {
        return movement;
    }

    /**
     * @param token an action name such as {@code attack}.
     * @return the action.
     * @throws RulesDefinitionException if the name is unknown.
     */
    public static ActionKind fromToken(String token) {
        for (ActionKind kind : values()) {
            if (kind.token.equals(token)) {
                return kind;
            }
        }
        throw new RulesDefinitionException("Unknown action '" + token + "' in action order");
    }
}
