package org.hexwar.runtime.history;

import org.hexwar.runtime.moves.Change;
import org.hexwar.runtime.moves.Move;
import org.hexwar.runtime.moves.MoveResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves submitted together, with the changes they produced.
 *
 * @param index   position of the group in the history, starting at 0.
 * @param results one result per move, in submission order.
 * @param version game version after the group.
 */
public record MoveGroup(int index, List<MoveResult> results, long version) {

    public MoveGroup {
        results = List.copyOf(results);
    }

    public List<Move> moves() {
        List<Move> moves = new ArrayList<>(results.size());
        for (MoveResult result : results) {
            moves.add(result.move());
        }
        return moves;
    }

    /**
     * @return the changes of all moves in the group, in order.
     */
    public List<Change> changes() {
        List<Change> changes = new ArrayList<>();
        for (MoveResult result : results) {
            changes.addAll(result.changes());
        }
        return changes;
    }
}
