package org.hexwar.runtime.moves;

import java.util.List;

/**
 * A processed move and the changes it produced, in the order they happened.
 *
 * @param move     the move.
 * @param sequence position of the move in the game history, equal to the game version it
 *                 produced (or would produce, for a dry run).
 * @param changes  the ordered changes.
 */
public record MoveResult(Move move, long sequence, List<Change> changes) {

    public MoveResult {
        changes = List.copyOf(changes);
    }
}
