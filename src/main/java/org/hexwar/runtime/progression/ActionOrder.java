package org.hexwar.runtime.progression;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed action order of a unit type: a list of slots, each holding one action or a set of
 * mutually exclusive alternatives written as {@code "attack|capture"}.
 */
public final class ActionOrder {

    private final List<List<ActionKind>> slots;

    private ActionOrder(List<List<ActionKind>> slots) {
        this.slots = slots;
    }

    /**
     * @param order slot strings, e.g. {@code ["move", "attack|capture"]}.
     * @return the parsed order.
     */
    public static ActionOrder parse(List<String> order) {
        List<List<ActionKind>> slots = new ArrayList<>(order.size());
        for (String slot : order) {
            List<ActionKind> alternatives = new ArrayList<>();
            for (String token : slot.split("\\|")) {
                String trimmed = token.trim();
                if (!trimmed.isEmpty()) {
                    alternatives.add(ActionKind.fromToken(trimmed));
                }
            }
            slots.add(List.copyOf(alternatives));
        }
        return new ActionOrder(List.copyOf(slots));
    }

    public int size() {
        return slots.size();
    }

    /**
     * @param step a progression step.
     * @return the alternatives of that slot, empty once the step is past the last slot.
     */
    public List<ActionKind> slot(int step) {
        return step >= 0 && step < slots.size() ? slots.get(step) : List.of();
    }

    public boolean hasAlternatives(int step) {
        return slot(step).size() > 1;
    }

    /**
     * @return whether every action in the slot spends movement points.
     */
    public boolean movementSlot(int step) {
        List<ActionKind> slot = slot(step);
        return !slot.isEmpty() && slot.stream().allMatch(ActionKind::movement);
    }
}
