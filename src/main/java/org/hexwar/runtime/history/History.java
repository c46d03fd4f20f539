package org.hexwar.runtime.history;

import org.hexwar.runtime.moves.Change;
import org.hexwar.runtime.moves.MoveResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of the move groups applied to a game.
 */
public final class History {

    private final List<MoveGroup> groups = new ArrayList<>();

    /**
     * Appends the results of one submission.
     *
     * @param results the applied moves, in order.
     * @param version the game version after the last of them.
     * @return the new group.
     */
    public MoveGroup append(List<MoveResult> results, long version) {
        MoveGroup group = new MoveGroup(groups.size(), results, version);
        groups.add(group);
        return group;
    }

    public List<MoveGroup> groups() {
        return Collections.unmodifiableList(groups);
    }

    public int size() {
        return groups.size();
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    /**
     * @return every applied move result across all groups.
     */
    public List<MoveResult> results() {
        List<MoveResult> results = new ArrayList<>();
        for (MoveGroup group : groups) {
            results.addAll(group.results());
        }
        return results;
    }

    /**
     * @return the changes of every applied move, in application order.
     */
    public List<Change> changes() {
        List<Change> changes = new ArrayList<>();
        for (MoveGroup group : groups) {
            changes.addAll(group.changes());
        }
        return changes;
    }
}
